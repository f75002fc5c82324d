package com.slb.payout_backend.modules.payout.service;

import com.slb.payout_backend.common.exception.BizException;
import com.slb.payout_backend.modules.callback.domain.CallbackDispatchResult;
import com.slb.payout_backend.modules.callback.service.PayoutCallbackDispatcher;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import com.slb.payout_backend.modules.event.service.ServerEventBus;
import com.slb.payout_backend.modules.payout.domain.ClaimSource;
import com.slb.payout_backend.modules.payout.domain.PayoutStatus;
import com.slb.payout_backend.modules.payout.entity.PayoutDetails;
import com.slb.payout_backend.modules.payout.vo.CancelPayoutVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 取消出款单：行锁内校验并改状态，提交后先广播事件再回调商户。
 */
@Service
@Slf4j
public class PayoutCancellationService {

    private final PayoutTxService payoutTxService;
    private final PayoutCallbackDispatcher callbackDispatcher;
    private final ServerEventBus eventBus;

    public PayoutCancellationService(PayoutTxService payoutTxService,
                                     PayoutCallbackDispatcher callbackDispatcher,
                                     ServerEventBus eventBus) {
        this.payoutTxService = payoutTxService;
        this.callbackDispatcher = callbackDispatcher;
        this.eventBus = eventBus;
    }

    public CancelPayoutVo cancel(String payoutId, String reason, String reasonCode) {
        if (!StringUtils.hasText(payoutId)) {
            throw new BizException("出款单 ID 不能为空");
        }
        String id = payoutId.trim();
        String normalizedReason = trimToNull(reason);
        String normalizedReasonCode = trimToNull(reasonCode);

        PayoutDetails cancelled = payoutTxService.cancelLocked(id, normalizedReason, normalizedReasonCode);
        log.info("[manual] Cancelled payout {} (reasonCode={})", id, cancelled.getCancelReasonCode());

        // 已提交：先通知看板，回调审计失败也不影响
        eventBus.publish(ServerEvent.payoutsUpdated(ClaimSource.MANUAL_CANCEL.getTag()));
        CallbackDispatchResult callback = callbackDispatcher.dispatchCancelled(cancelled);

        return new CancelPayoutVo(true, PayoutStatus.CANCELED_LABEL, callback.delivered(), callback.error());
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
