package com.slb.payout_backend.modules.payout.service;

import com.slb.payout_backend.common.exception.BizException;
import com.slb.payout_backend.modules.payout.domain.ClaimOutcome;
import com.slb.payout_backend.modules.payout.domain.ClaimSource;
import com.slb.payout_backend.modules.payout.entity.Payout;
import com.slb.payout_backend.modules.payout.mapper.PayoutMapper;
import com.slb.payout_backend.modules.payout.vo.AssignPayoutVo;
import com.slb.payout_backend.modules.payout.vo.PayoutVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

@Service
@Slf4j
public class PayoutAssignmentService {

    private final PayoutMapper payoutMapper;
    private final PayoutClaimService claimService;

    public PayoutAssignmentService(PayoutMapper payoutMapper, PayoutClaimService claimService) {
        this.payoutMapper = payoutMapper;
        this.claimService = claimService;
    }

    public List<Payout> findUnassignedPayouts() {
        return payoutMapper.selectUnassignedPayouts();
    }

    public List<PayoutVo> listUnassignedPayouts() {
        return findUnassignedPayouts().stream()
                .map(payout -> {
                    PayoutVo vo = new PayoutVo();
                    BeanUtils.copyProperties(payout, vo);
                    return vo;
                })
                .collect(Collectors.toList());
    }

    /**
     * 人工把出款单指派给交易员。与自动分配走同一个条件更新，不影响轮询游标。
     */
    public AssignPayoutVo assignManually(String payoutId, String traderId) {
        if (!StringUtils.hasText(payoutId)) {
            throw new BizException("出款单 ID 不能为空");
        }
        if (!StringUtils.hasText(traderId)) {
            throw new BizException("交易员 ID 不能为空");
        }
        String normalizedPayoutId = payoutId.trim();
        String normalizedTraderId = traderId.trim();
        ClaimOutcome outcome = claimService.commit(normalizedPayoutId, normalizedTraderId, ClaimSource.MANUAL);
        if (outcome != ClaimOutcome.APPLIED) {
            log.info("[manual] Payout {} is not eligible for assignment to trader {}",
                    normalizedPayoutId, normalizedTraderId);
            throw BizException.conflict("出款单当前不可分配（已被分配、已接单、状态已变更或已由聚合通道处理）");
        }
        log.info("[manual] Assigned payout {} to trader {}", normalizedPayoutId, normalizedTraderId);
        return new AssignPayoutVo(true);
    }
}
