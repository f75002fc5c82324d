package com.slb.payout_backend.modules.trader.service;

import com.slb.payout_backend.common.exception.BizException;
import com.slb.payout_backend.modules.event.domain.ServerEvent;
import com.slb.payout_backend.modules.event.service.ServerEventBus;
import com.slb.payout_backend.modules.trader.entity.Trader;
import com.slb.payout_backend.modules.trader.mapper.TraderMapper;
import com.slb.payout_backend.modules.trader.vo.TraderLimitVo;
import com.slb.payout_backend.modules.trader.vo.TraderVo;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.BeanUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Service
@Slf4j
public class TraderService {

    private final TraderMapper traderMapper;
    private final TraderLimitRegistry limitRegistry;
    private final ServerEventBus eventBus;

    public TraderService(TraderMapper traderMapper, TraderLimitRegistry limitRegistry, ServerEventBus eventBus) {
        this.traderMapper = traderMapper;
        this.limitRegistry = limitRegistry;
        this.eventBus = eventBus;
    }

    public List<Trader> findEligibleTraders() {
        return traderMapper.selectEligibleTraders();
    }

    public List<TraderVo> listTraders() {
        List<Trader> traders = findEligibleTraders();
        Map<String, BigDecimal> limits = limitRegistry.snapshot();
        return traders.stream()
                .map(trader -> toVo(trader, limits.get(trader.getId())))
                .collect(Collectors.toList());
    }

    public TraderLimitVo updateLimit(String traderId, BigDecimal maxAmount) {
        if (!StringUtils.hasText(traderId)) {
            throw new BizException("交易员 ID 不能为空");
        }
        String normalizedId = traderId.trim();
        BigDecimal applied = limitRegistry.update(normalizedId, maxAmount);
        log.info("[settings] Updated trader limit: trader={} limit={}", normalizedId, applied);
        eventBus.publish(ServerEvent.limitsUpdated());
        return new TraderLimitVo(normalizedId, applied);
    }

    private TraderVo toVo(Trader trader, BigDecimal maxAmount) {
        TraderVo vo = new TraderVo();
        BeanUtils.copyProperties(trader, vo);
        vo.setMaxAmount(maxAmount);
        return vo;
    }
}
