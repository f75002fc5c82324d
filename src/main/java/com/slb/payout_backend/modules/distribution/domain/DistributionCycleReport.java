package com.slb.payout_backend.modules.distribution.domain;

/**
 * 单个自动分配周期的统计。
 */
public record DistributionCycleReport(
        int traders,
        int payouts,
        int planned,
        int assigned,
        int notEligible,
        int failed,
        int skipped
) {

    public static DistributionCycleReport idle(int traders, int payouts) {
        return new DistributionCycleReport(traders, payouts, 0, 0, 0, 0, 0);
    }
}
