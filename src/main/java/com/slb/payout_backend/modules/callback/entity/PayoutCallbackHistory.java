package com.slb.payout_backend.modules.callback.entity;

import lombok.Data;

/**
 * 回调审计记录，对应 "PayoutCallbackHistory" 表；只插入，不更新。
 */
@Data
public class PayoutCallbackHistory {
    private String id;
    private String payoutId;
    private String url;
    /** 发送（或本应发送）的报文 JSON */
    private String payload;
    private String response;
    private Integer statusCode;
    private String error;
}
