package com.slb.payout_backend.modules.distribution.domain;

import com.slb.payout_backend.modules.payout.entity.Payout;

import java.util.List;

/**
 * 一次分配计算的结果。
 *
 * @param pairings 按出款单输入顺序排列的配对，提交时也按此顺序
 * @param skipped  金额超出所有交易员限额、本轮无人可接的出款单
 * @param cursor   下一轮起始的交易员下标
 */
public record AssignmentPlan(List<Pairing> pairings, List<Payout> skipped, int cursor) {

    public AssignmentPlan {
        pairings = List.copyOf(pairings);
        skipped = List.copyOf(skipped);
    }

    public static AssignmentPlan empty(int cursor) {
        return new AssignmentPlan(List.of(), List.of(), cursor);
    }
}
