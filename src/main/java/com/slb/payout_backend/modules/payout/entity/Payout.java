package com.slb.payout_backend.modules.payout.entity;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 待分配出款单（"Payout" 表的精简投影）
 */
@Data
public class Payout {
    private String id;
    private Integer numericId;
    private BigDecimal amount;
    private String bank;
    private String externalReference;
}
