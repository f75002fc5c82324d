package com.slb.payout_backend.modules.callback.domain;

/**
 * 回调结果未能写入审计日志。出款状态变更此时已提交，不做回滚，但本次操作必须失败可见。
 */
public class CallbackAuditException extends RuntimeException {

    private final String payoutId;

    public CallbackAuditException(String payoutId, String message, Throwable cause) {
        super(message, cause);
        this.payoutId = payoutId;
    }

    public String getPayoutId() {
        return payoutId;
    }
}
