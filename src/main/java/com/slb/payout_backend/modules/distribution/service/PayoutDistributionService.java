package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.modules.distribution.domain.AssignmentPlan;
import com.slb.payout_backend.modules.distribution.domain.DistributionCycleReport;
import com.slb.payout_backend.modules.distribution.domain.Pairing;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import com.slb.payout_backend.modules.event.service.ServerEventBus;
import com.slb.payout_backend.modules.payout.domain.ClaimOutcome;
import com.slb.payout_backend.modules.payout.domain.ClaimSource;
import com.slb.payout_backend.modules.payout.entity.Payout;
import com.slb.payout_backend.modules.payout.mapper.PayoutMapper;
import com.slb.payout_backend.modules.payout.service.PayoutClaimService;
import com.slb.payout_backend.modules.trader.entity.Trader;
import com.slb.payout_backend.modules.trader.mapper.TraderMapper;
import com.slb.payout_backend.modules.trader.service.TraderLimitRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.BooleanSupplier;

/**
 * 一个自动分配周期：读交易员、读待分配出款单、按轮询策略配对，再逐条认领。
 * <p>
 * 每条配对各自一个事务，某条失败只记日志，已成功的配对保留。
 * 游标只在计算配对时加锁，人工分配不碰游标。
 */
@Service
@Slf4j
public class PayoutDistributionService {

    private final TraderMapper traderMapper;
    private final PayoutMapper payoutMapper;
    private final TraderLimitRegistry limitRegistry;
    private final RoundRobinAssignmentPolicy policy;
    private final PayoutClaimService claimService;
    private final ServerEventBus eventBus;

    private final ReentrantLock cursorLock = new ReentrantLock();
    private int cursor;
    /** 上一轮看到的可接单交易员，变化时通知看板 */
    private List<String> lastTraderIds = List.of();

    public PayoutDistributionService(TraderMapper traderMapper,
                                     PayoutMapper payoutMapper,
                                     TraderLimitRegistry limitRegistry,
                                     RoundRobinAssignmentPolicy policy,
                                     PayoutClaimService claimService,
                                     ServerEventBus eventBus) {
        this.traderMapper = traderMapper;
        this.payoutMapper = payoutMapper;
        this.limitRegistry = limitRegistry;
        this.policy = policy;
        this.claimService = claimService;
        this.eventBus = eventBus;
    }

    public DistributionCycleReport runCycle() {
        return runCycle(() -> true);
    }

    /**
     * @param keepRunning 每条配对提交前检查一次；返回 false 时停止提交剩余配对（停机）
     */
    public DistributionCycleReport runCycle(BooleanSupplier keepRunning) {
        List<Trader> traders = traderMapper.selectEligibleTraders();
        trackTraderSet(traders);
        if (traders.isEmpty()) {
            log.info("[auto] No eligible traders available");
            return DistributionCycleReport.idle(0, 0);
        }
        List<Payout> payouts = payoutMapper.selectUnassignedPayouts();
        if (payouts.isEmpty()) {
            log.info("[auto] No unassigned payouts to distribute");
            return DistributionCycleReport.idle(traders.size(), 0);
        }

        Map<String, BigDecimal> limits = limitRegistry.snapshot();
        AssignmentPlan plan;
        cursorLock.lock();
        try {
            plan = policy.assign(traders, payouts, limits, cursor);
            cursor = plan.cursor();
        } finally {
            cursorLock.unlock();
        }

        for (Payout payout : plan.skipped()) {
            log.info("[auto] Skipped payout {} (amount {}): no trader limit covers it",
                    payout.getId(), payout.getAmount());
        }

        int assigned = 0;
        int notEligible = 0;
        int failed = 0;
        for (Pairing pairing : plan.pairings()) {
            if (!keepRunning.getAsBoolean()) {
                log.info("[auto] Stop requested, {} pairing(s) left uncommitted",
                        plan.pairings().size() - assigned - notEligible - failed);
                break;
            }
            try {
                ClaimOutcome outcome = claimService.commit(pairing.payoutId(), pairing.traderId(), ClaimSource.AUTO);
                if (outcome == ClaimOutcome.APPLIED) {
                    assigned++;
                    log.info("[auto] Assigned payout {} (amount {}) to trader {}",
                            pairing.payoutId(), pairing.amount(), pairing.traderId());
                } else {
                    notEligible++;
                    log.info("[auto] Payout {} was no longer eligible for trader {}",
                            pairing.payoutId(), pairing.traderId());
                }
            } catch (RuntimeException e) {
                failed++;
                log.warn("[auto] Failed to assign payout {} to trader {}",
                        pairing.payoutId(), pairing.traderId(), e);
            }
        }

        DistributionCycleReport report = new DistributionCycleReport(traders.size(), payouts.size(),
                plan.pairings().size(), assigned, notEligible, failed, plan.skipped().size());
        log.info("[auto] Cycle finished: traders={}, payouts={}, assigned={}, notEligible={}, failed={}, skipped={}",
                report.traders(), report.payouts(), report.assigned(), report.notEligible(),
                report.failed(), report.skipped());
        return report;
    }

    private void trackTraderSet(List<Trader> traders) {
        List<String> ids = traders.stream().map(Trader::getId).collect(Collectors.toList());
        boolean changed;
        cursorLock.lock();
        try {
            changed = !ids.equals(lastTraderIds);
            lastTraderIds = List.copyOf(ids);
        } finally {
            cursorLock.unlock();
        }
        if (changed) {
            log.info("[auto] Eligible trader set changed: {} trader(s)", ids.size());
            eventBus.publish(ServerEvent.tradersUpdated());
        }
    }

    int currentCursor() {
        cursorLock.lock();
        try {
            return cursor;
        } finally {
            cursorLock.unlock();
        }
    }
}
