package com.slb.payout_backend.modules.trader.entity;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 可接单交易员，对应 "User" 表中满足接单条件的行
 */
@Data
public class Trader {
    private String id;
    private String email;
    /** 稳定排序用的数字编号 */
    private Integer numericId;
    /** 可用余额 */
    private BigDecimal balanceRub;
    private BigDecimal frozenRub;
    private BigDecimal payoutBalance;
}
