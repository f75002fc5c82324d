package com.slb.payout_backend.modules.payout.entity;

import lombok.Data;

import java.math.BigDecimal;

/**
 * 取消出款、回调商户时使用的完整出款单信息（含商户回调地址与公钥）。
 */
@Data
public class PayoutDetails {
    private String id;
    private Integer numericId;
    private BigDecimal amount;
    private BigDecimal amountUsdt;
    private String status;
    private String wallet;
    private String bank;
    private String externalReference;
    private String merchantId;
    private String merchantWebhookUrl;

    /** 商户附加信息，JSON 文本 */
    private String merchantMetadata;

    /** 凭证文件列表，JSON 数组文本 */
    private String proofFiles;

    /** 申诉文件列表，JSON 数组文本 */
    private String disputeFiles;

    private String disputeMessage;
    private String cancelReason;
    private String cancelReasonCode;
    private String traderId;

    /** 商户公钥（回调时放在请求头） */
    private String merchantApiKey;
}
