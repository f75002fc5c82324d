package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.modules.distribution.domain.AssignmentPlan;
import com.slb.payout_backend.modules.distribution.domain.Pairing;
import com.slb.payout_backend.modules.payout.entity.Payout;
import com.slb.payout_backend.modules.trader.entity.Trader;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 单遍轮询分配：游标在整批出款单之间延续，不会每单从头扫描。
 * <p>
 * 纯计算，无 I/O、无共享状态；相同输入必然得到相同输出。
 */
@Component
public class RoundRobinAssignmentPolicy {

    /**
     * @param traders 按 numericId 排好序的可接单交易员
     * @param payouts 按创建时间排好序的待分配出款单
     * @param limits  交易员 ID -> 单笔上限；缺省表示不限额
     * @param cursor  上一轮留下的游标
     */
    public AssignmentPlan assign(List<Trader> traders,
                                 List<Payout> payouts,
                                 Map<String, BigDecimal> limits,
                                 int cursor) {
        if (traders == null || traders.isEmpty()) {
            return AssignmentPlan.empty(cursor);
        }
        int size = traders.size();
        // 交易员列表可能比上一轮短
        int next = Math.floorMod(cursor, size);
        if (payouts == null || payouts.isEmpty()) {
            return AssignmentPlan.empty(next);
        }

        List<Pairing> pairings = new ArrayList<>();
        List<Payout> skipped = new ArrayList<>();
        for (Payout payout : payouts) {
            BigDecimal amount = payout.getAmount();
            if (amount == null || amount.signum() <= 0) {
                continue;
            }
            int matched = -1;
            for (int attempt = 0; attempt < size; attempt++) {
                int index = (next + attempt) % size;
                BigDecimal limit = limits == null ? null : limits.get(traders.get(index).getId());
                if (limit == null || limit.compareTo(amount) >= 0) {
                    matched = index;
                    break;
                }
            }
            if (matched < 0) {
                skipped.add(payout);
                continue;
            }
            pairings.add(new Pairing(payout.getId(), traders.get(matched).getId(), amount));
            next = (matched + 1) % size;
        }
        return new AssignmentPlan(pairings, skipped, next);
    }
}
