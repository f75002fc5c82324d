package com.slb.payout_backend.modules.distribution.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
@Schema(description = "自动分配配置")
public class AutoDistributionUpdateDto {

    @NotNull(message = "enabled 不能为空")
    @Schema(description = "是否开启自动分配", requiredMode = Schema.RequiredMode.REQUIRED)
    private Boolean enabled;

    @NotNull(message = "intervalSeconds 不能为空")
    @Schema(description = "分配间隔（秒），小于 1 按 1 处理", example = "30",
            requiredMode = Schema.RequiredMode.REQUIRED)
    private Long intervalSeconds;
}
