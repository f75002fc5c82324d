package com.slb.payout_backend.modules.payout.domain;

/**
 * 触发出款单归属变更的来源，随 payouts-updated 事件下发。
 */
public enum ClaimSource {
    AUTO("auto"),
    MANUAL("manual"),
    MANUAL_CANCEL("manual-cancel");

    private final String tag;

    ClaimSource(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }
}
