package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.modules.distribution.domain.DistributionCycleReport;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class PayoutDistributionServiceTest {

    @Mock
    private TraderMapper traderMapper;
    @Mock
    private PayoutMapper payoutMapper;
    @Mock
    private PayoutClaimService claimService;
    @Mock
    private ServerEventBus eventBus;

    private TraderLimitRegistry limitRegistry;
    private PayoutDistributionService service;

    @BeforeEach
    void setUp() {
        limitRegistry = new TraderLimitRegistry();
        service = new PayoutDistributionService(traderMapper, payoutMapper, limitRegistry,
                new RoundRobinAssignmentPolicy(), claimService, eventBus);
    }

    @Test
    void noTradersSkipsPayoutQuery() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of());

        DistributionCycleReport report = service.runCycle();

        assertThat(report.assigned()).isZero();
        verifyNoInteractions(payoutMapper, claimService);
    }

    @Test
    void noPayoutsCommitsNothing() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("W1")));
        when(payoutMapper.selectUnassignedPayouts()).thenReturn(List.of());

        DistributionCycleReport report = service.runCycle();

        assertThat(report.traders()).isEqualTo(1);
        verifyNoInteractions(claimService);
    }

    @Test
    void commitsPairingsInPolicyOrderWithLimits() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("W1"), trader("W2")));
        when(payoutMapper.selectUnassignedPayouts()).thenReturn(List.of(payout("P1", "500"), payout("P2", "1500")));
        limitRegistry.update("W1", new BigDecimal("1000"));
        when(claimService.commit(anyString(), anyString(), any())).thenReturn(ClaimOutcome.APPLIED);

        DistributionCycleReport report = service.runCycle();

        InOrder order = inOrder(claimService);
        order.verify(claimService).commit("P1", "W1", ClaimSource.AUTO);
        order.verify(claimService).commit("P2", "W2", ClaimSource.AUTO);
        assertThat(report.assigned()).isEqualTo(2);
        assertThat(report.skipped()).isZero();
        assertThat(service.currentCursor()).isEqualTo(0);
    }

    @Test
    void cursorCarriesOverToNextCycle() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("A"), trader("B"), trader("C")));
        when(payoutMapper.selectUnassignedPayouts())
                .thenReturn(List.of(payout("P1", "10")))
                .thenReturn(List.of(payout("P2", "10")));
        when(claimService.commit(anyString(), anyString(), any())).thenReturn(ClaimOutcome.APPLIED);

        service.runCycle();
        service.runCycle();

        verify(claimService).commit("P1", "A", ClaimSource.AUTO);
        verify(claimService).commit("P2", "B", ClaimSource.AUTO);
        assertThat(service.currentCursor()).isEqualTo(2);
    }

    @Test
    void failedPairingDoesNotAbortRemainingOnes() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("A"), trader("B"), trader("C")));
        when(payoutMapper.selectUnassignedPayouts())
                .thenReturn(List.of(payout("P1", "10"), payout("P2", "10"), payout("P3", "10")));
        when(claimService.commit("P1", "A", ClaimSource.AUTO)).thenReturn(ClaimOutcome.APPLIED);
        when(claimService.commit("P2", "B", ClaimSource.AUTO)).thenThrow(new QueryTimeoutException("timeout"));
        when(claimService.commit("P3", "C", ClaimSource.AUTO)).thenReturn(ClaimOutcome.NOT_ELIGIBLE);

        DistributionCycleReport report = service.runCycle();

        assertThat(report.planned()).isEqualTo(3);
        assertThat(report.assigned()).isEqualTo(1);
        assertThat(report.failed()).isEqualTo(1);
        assertThat(report.notEligible()).isEqualTo(1);
    }

    @Test
    void oversizedPayoutIsReportedAsSkipped() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("A")));
        when(payoutMapper.selectUnassignedPayouts()).thenReturn(List.of(payout("BIG", "5000")));
        limitRegistry.update("A", new BigDecimal("100"));

        DistributionCycleReport report = service.runCycle();

        assertThat(report.skipped()).isEqualTo(1);
        verify(claimService, never()).commit(anyString(), anyString(), any());
    }

    @Test
    void stopRequestLeavesRemainingPairingsUncommitted() {
        when(traderMapper.selectEligibleTraders()).thenReturn(List.of(trader("A"), trader("B")));
        when(payoutMapper.selectUnassignedPayouts()).thenReturn(List.of(payout("P1", "10"), payout("P2", "10")));
        when(claimService.commit(anyString(), anyString(), any())).thenReturn(ClaimOutcome.APPLIED);
        AtomicInteger checks = new AtomicInteger();

        DistributionCycleReport report = service.runCycle(() -> checks.incrementAndGet() == 1);

        assertThat(report.assigned()).isEqualTo(1);
        verify(claimService).commit("P1", "A", ClaimSource.AUTO);
        verify(claimService, never()).commit("P2", "B", ClaimSource.AUTO);
    }

    @Test
    void traderSetChangeIsPublishedOncePerChange() {
        when(traderMapper.selectEligibleTraders())
                .thenReturn(List.of(trader("A")))
                .thenReturn(List.of(trader("A")))
                .thenReturn(List.of(trader("A"), trader("B")));
        when(payoutMapper.selectUnassignedPayouts()).thenReturn(List.of());

        service.runCycle();
        service.runCycle();
        service.runCycle();

        verify(eventBus, times(2)).publish(ServerEvent.tradersUpdated());
    }

    private static Trader trader(String id) {
        Trader trader = new Trader();
        trader.setId(id);
        return trader;
    }

    private static Payout payout(String id, String amount) {
        Payout payout = new Payout();
        payout.setId(id);
        payout.setAmount(new BigDecimal(amount));
        return payout;
    }
}
