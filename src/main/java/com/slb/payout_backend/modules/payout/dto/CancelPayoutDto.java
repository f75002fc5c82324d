package com.slb.payout_backend.modules.payout.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "取消出款单；原因为空时保留原有取消原因")
public class CancelPayoutDto {

    @Schema(description = "取消原因")
    private String reason;

    @Schema(description = "取消原因代码")
    private String reasonCode;
}
