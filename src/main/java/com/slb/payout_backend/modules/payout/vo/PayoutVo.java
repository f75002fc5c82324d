package com.slb.payout_backend.modules.payout.vo;

import lombok.Data;

import java.math.BigDecimal;

@Data
public class PayoutVo {
    private String id;
    private Integer numericId;
    private BigDecimal amount;
    private String bank;
    private String externalReference;
}
