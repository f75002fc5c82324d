package com.slb.payout_backend.modules.payout.service;

import com.slb.payout_backend.modules.event.domain.ServerEvent;
import com.slb.payout_backend.modules.event.service.ServerEventBus;
import com.slb.payout_backend.modules.payout.domain.ClaimOutcome;
import com.slb.payout_backend.modules.payout.domain.ClaimSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 出款单认领的唯一写入口（自动分配与人工分配共用）。
 * 每次调用独立事务，一条条件 UPDATE 决定成败；未命中行不算错误。
 */
@Service
@Slf4j
public class PayoutClaimService {

    private final PayoutTxService payoutTxService;
    private final ServerEventBus eventBus;

    public PayoutClaimService(PayoutTxService payoutTxService, ServerEventBus eventBus) {
        this.payoutTxService = payoutTxService;
        this.eventBus = eventBus;
    }

    public ClaimOutcome commit(String payoutId, String traderId, ClaimSource source) {
        if (!StringUtils.hasText(payoutId) || !StringUtils.hasText(traderId)) {
            return ClaimOutcome.NOT_ELIGIBLE;
        }
        int affected = payoutTxService.claim(payoutId, traderId);
        if (affected == 0) {
            log.debug("Claim not applied: payoutId={}, traderId={}, source={}", payoutId, traderId, source.getTag());
            return ClaimOutcome.NOT_ELIGIBLE;
        }
        // 事务已提交
        eventBus.publish(ServerEvent.payoutsUpdated(source.getTag()));
        return ClaimOutcome.APPLIED;
    }
}
