package com.slb.payout_backend.modules.payout.domain;

public enum ClaimOutcome {
    /** 条件更新命中 1 行，出款单已归属该交易员 */
    APPLIED,
    /** 条件更新命中 0 行：已被其他路径分配、状态变化或不存在 */
    NOT_ELIGIBLE
}
