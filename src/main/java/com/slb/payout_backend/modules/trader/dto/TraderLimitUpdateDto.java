package com.slb.payout_backend.modules.trader.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
public class TraderLimitUpdateDto {
    @Schema(description = "单笔出款上限；为空或小于等于 0 表示清除限额", nullable = true, example = "1000")
    private BigDecimal maxAmount;
}
