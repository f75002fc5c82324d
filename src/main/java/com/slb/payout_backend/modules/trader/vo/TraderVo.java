package com.slb.payout_backend.modules.trader.vo;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Data;

import java.math.BigDecimal;

@Data
@Schema(description = "可接单交易员 / Eligible trader")
public class TraderVo {
    private String id;
    private String email;
    private Integer numericId;
    private BigDecimal balanceRub;
    private BigDecimal frozenRub;
    private BigDecimal payoutBalance;

    @Schema(description = "单笔出款上限，null 表示不限额", nullable = true, example = "1000.00")
    private BigDecimal maxAmount;
}
