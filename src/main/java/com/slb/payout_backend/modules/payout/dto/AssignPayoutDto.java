package com.slb.payout_backend.modules.payout.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

@Data
@Schema(description = "人工分配出款单")
public class AssignPayoutDto {

    @Schema(description = "交易员 ID", requiredMode = Schema.RequiredMode.REQUIRED)
    private String traderId;
}
