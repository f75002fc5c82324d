package com.slb.payout_backend.modules.distribution.domain;

/**
 * 自动分配开关与间隔，不可变；每次修改整体替换。
 */
public record AutoDistributionConfig(boolean enabled, long intervalSeconds) {

    public static final long MIN_INTERVAL_SECONDS = 1L;

    public AutoDistributionConfig {
        intervalSeconds = Math.max(MIN_INTERVAL_SECONDS, intervalSeconds);
    }
}
