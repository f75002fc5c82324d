package com.slb.payout_backend.modules.payout.service;

import com.slb.payout_backend.common.exception.BizException;
import com.slb.payout_backend.modules.payout.config.PayoutProperties;
import com.slb.payout_backend.modules.payout.domain.PayoutStatus;
import com.slb.payout_backend.modules.payout.entity.PayoutDetails;
import com.slb.payout_backend.modules.payout.mapper.PayoutMapper;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 出款单状态变更的事务实现（确保 @Transactional 真实生效：public 方法 + 由外部 Bean 调用）。
 * 调用方在方法返回后事务已提交，回调与事件放在调用方做。
 */
@Service
public class PayoutTxService {

    private final PayoutMapper payoutMapper;
    private final PayoutProperties payoutProperties;

    public PayoutTxService(PayoutMapper payoutMapper, PayoutProperties payoutProperties) {
        this.payoutMapper = payoutMapper;
        this.payoutProperties = payoutProperties;
    }

    /**
     * 条件认领：只有仍未分配、未取消的出款单会被写入。
     *
     * @return 受影响行数，0 表示已不可分配
     */
    @Transactional
    public int claim(String payoutId, String traderId) {
        return payoutMapper.claimPayout(payoutId, traderId, payoutProperties.getAcceptanceTime());
    }

    /**
     * 行锁内校验并标记取消。不存在抛 404，已取消或终态抛 409，均回滚。
     *
     * @return 取消后的出款单快照（reason 为空时保留库里原值）
     */
    @Transactional
    public PayoutDetails cancelLocked(String id, String reason, String reasonCode) {
        PayoutDetails payout = payoutMapper.selectDetailsForUpdate(id)
                .orElseThrow(() -> BizException.notFound("出款单不存在"));
        if (PayoutStatus.isCancelled(payout.getStatus())) {
            throw BizException.conflict("出款单已取消");
        }
        if (PayoutStatus.isTerminal(payout.getStatus())) {
            throw BizException.conflict("状态为 " + payout.getStatus() + " 的出款单不能取消");
        }
        int updated = payoutMapper.markCancelled(id, reason, reasonCode);
        if (updated != 1) {
            // 行锁已持有，不应出现
            throw new IllegalStateException("Failed to mark payout cancelled: " + id + ", updated=" + updated);
        }
        payout.setStatus(PayoutStatus.CANCELLED.name());
        if (reason != null) {
            payout.setCancelReason(reason);
        }
        if (reasonCode != null) {
            payout.setCancelReasonCode(reasonCode);
        }
        return payout;
    }
}
