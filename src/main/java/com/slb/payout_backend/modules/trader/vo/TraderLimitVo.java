package com.slb.payout_backend.modules.trader.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TraderLimitVo {
    private String traderId;
    private BigDecimal maxAmount;
}
