package com.slb.payout_backend.modules.distribution.service;

import com.slb.payout_backend.modules.distribution.domain.AssignmentPlan;
import com.slb.payout_backend.modules.distribution.domain.Pairing;
import com.slb.payout_backend.modules.payout.entity.Payout;
import com.slb.payout_backend.modules.trader.entity.Trader;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class RoundRobinAssignmentPolicyTest {

    private final RoundRobinAssignmentPolicy policy = new RoundRobinAssignmentPolicy();

    @Test
    void limitedTraderTakesSmallPayoutAndUnlimitedTraderTakesLargeOne() {
        List<Trader> traders = List.of(trader("W1"), trader("W2"));
        List<Payout> payouts = List.of(payout("P1", "500"), payout("P2", "1500"));
        Map<String, BigDecimal> limits = Map.of("W1", new BigDecimal("1000"));

        AssignmentPlan plan = policy.assign(traders, payouts, limits, 0);

        assertThat(plan.pairings())
                .extracting(Pairing::payoutId, Pairing::traderId)
                .containsExactly(
                        tuple("P1", "W1"),
                        tuple("P2", "W2"));
        assertThat(plan.skipped()).isEmpty();
        // W2 是下标 1，下一轮从 (1 + 1) % 2 开始
        assertThat(plan.cursor()).isEqualTo(0);
    }

    @Test
    void cursorContinuesAcrossPayoutsInsteadOfRestarting() {
        List<Trader> traders = List.of(trader("A"), trader("B"), trader("C"));
        List<Payout> payouts = List.of(payout("P1", "10"), payout("P2", "10"), payout("P3", "10"), payout("P4", "10"));

        AssignmentPlan plan = policy.assign(traders, payouts, Map.of(), 1);

        assertThat(plan.pairings()).extracting(Pairing::traderId).containsExactly("B", "C", "A", "B");
        assertThat(plan.cursor()).isEqualTo(2);
    }

    @Test
    void payoutAboveEveryLimitIsSkippedWithoutMovingCursor() {
        List<Trader> traders = List.of(trader("A"), trader("B"));
        Map<String, BigDecimal> limits = Map.of("A", new BigDecimal("100"), "B", new BigDecimal("200"));
        List<Payout> payouts = List.of(payout("BIG", "500"), payout("P1", "50"));

        AssignmentPlan plan = policy.assign(traders, payouts, limits, 0);

        assertThat(plan.skipped()).extracting(Payout::getId).containsExactly("BIG");
        assertThat(plan.pairings()).extracting(Pairing::traderId).containsExactly("A");
        assertThat(plan.cursor()).isEqualTo(1);
    }

    @Test
    void nonPositiveAndMissingAmountsAreIgnored() {
        List<Trader> traders = List.of(trader("A"));
        Payout missing = new Payout();
        missing.setId("NULL");
        List<Payout> payouts = List.of(payout("ZERO", "0"), payout("NEG", "-5"), missing);

        AssignmentPlan plan = policy.assign(traders, payouts, Map.of(), 0);

        assertThat(plan.pairings()).isEmpty();
        assertThat(plan.skipped()).isEmpty();
        assertThat(plan.cursor()).isEqualTo(0);
    }

    @Test
    void emptyTraderListKeepsCursorUnchanged() {
        AssignmentPlan plan = policy.assign(List.of(), List.of(payout("P1", "10")), Map.of(), 7);

        assertThat(plan.pairings()).isEmpty();
        assertThat(plan.cursor()).isEqualTo(7);
    }

    @Test
    void emptyPayoutListProducesNoPairings() {
        AssignmentPlan plan = policy.assign(List.of(trader("A"), trader("B")), List.of(), Map.of(), 1);

        assertThat(plan.pairings()).isEmpty();
        assertThat(plan.skipped()).isEmpty();
        assertThat(plan.cursor()).isEqualTo(1);
    }

    @Test
    void staleCursorIsWrappedIntoShrunkTraderList() {
        List<Trader> traders = List.of(trader("A"), trader("B"));

        AssignmentPlan plan = policy.assign(traders, List.of(payout("P1", "10")), Map.of(), 5);

        assertThat(plan.pairings()).extracting(Pairing::traderId).containsExactly("B");
        assertThat(plan.cursor()).isEqualTo(0);
    }

    @Test
    void limitEqualToAmountAccepts() {
        List<Trader> traders = List.of(trader("A"));
        AssignmentPlan plan = policy.assign(traders, List.of(payout("P1", "100.00")),
                Map.of("A", new BigDecimal("100")), 0);

        assertThat(plan.pairings()).hasSize(1);
    }

    @Test
    void everyCoverablePayoutIsPairedWithinLimits() {
        Random random = new Random(20240611L);
        for (int round = 0; round < 200; round++) {
            List<Trader> traders = randomTraders(random);
            Map<String, BigDecimal> limits = randomLimits(random, traders);
            BigDecimal maxCapacity = traders.stream()
                    .map(t -> limits.getOrDefault(t.getId(), new BigDecimal("100000")))
                    .max(BigDecimal::compareTo)
                    .orElseThrow();
            List<Payout> payouts = new ArrayList<>();
            int payoutCount = 1 + random.nextInt(20);
            for (int i = 0; i < payoutCount; i++) {
                long cents = 1 + (long) (random.nextDouble() * maxCapacity.movePointRight(2).longValue());
                payouts.add(payout("P" + i, BigDecimal.valueOf(cents, 2).toPlainString()));
            }

            AssignmentPlan plan = policy.assign(traders, payouts, limits, random.nextInt(10));

            assertThat(plan.pairings()).hasSize(payouts.size());
            assertThat(plan.skipped()).isEmpty();
            assertThat(plan.pairings()).extracting(Pairing::payoutId)
                    .containsExactlyElementsOf(payouts.stream().map(Payout::getId).collect(Collectors.toList()));
            for (Pairing pairing : plan.pairings()) {
                BigDecimal limit = limits.get(pairing.traderId());
                if (limit != null) {
                    assertThat(pairing.amount()).isLessThanOrEqualTo(limit);
                }
            }
        }
    }

    @Test
    void skippedPayoutDoesNotChangeOtherPairings() {
        Random random = new Random(99L);
        for (int round = 0; round < 200; round++) {
            List<Trader> traders = randomTraders(random);
            Map<String, BigDecimal> limits = new HashMap<>();
            for (Trader trader : traders) {
                limits.put(trader.getId(), BigDecimal.valueOf(100 + random.nextInt(900)));
            }
            List<Payout> payouts = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                payouts.add(payout("P" + i, String.valueOf(1 + random.nextInt(100))));
            }
            int cursor = random.nextInt(traders.size());
            AssignmentPlan baseline = policy.assign(traders, payouts, limits, cursor);

            List<Payout> withOversized = new ArrayList<>(payouts);
            withOversized.add(random.nextInt(withOversized.size() + 1), payout("HUGE", "1000000"));
            AssignmentPlan plan = policy.assign(traders, withOversized, limits, cursor);

            assertThat(plan.skipped()).extracting(Payout::getId).containsExactly("HUGE");
            assertThat(plan.pairings()).isEqualTo(baseline.pairings());
            assertThat(plan.cursor()).isEqualTo(baseline.cursor());
        }
    }

    @Test
    void equalLimitsGiveEachTraderOnePayoutBeforeAnySecond() {
        Random random = new Random(7L);
        for (int round = 0; round < 100; round++) {
            List<Trader> traders = randomTraders(random);
            int n = traders.size();
            List<Payout> payouts = new ArrayList<>();
            int payoutCount = n + random.nextInt(2 * n + 1);
            for (int i = 0; i < payoutCount; i++) {
                payouts.add(payout("P" + i, String.valueOf(1 + random.nextInt(50))));
            }
            Map<String, BigDecimal> limits = new HashMap<>();
            if (random.nextBoolean()) {
                traders.forEach(t -> limits.put(t.getId(), new BigDecimal("50")));
            }

            AssignmentPlan plan = policy.assign(traders, payouts, limits, random.nextInt(n));

            List<String> firstRound = plan.pairings().subList(0, n).stream()
                    .map(Pairing::traderId)
                    .collect(Collectors.toList());
            assertThat(new HashSet<>(firstRound)).hasSize(n);
        }
    }

    @Test
    void sameInputGivesSameOutput() {
        Random random = new Random(1234L);
        for (int round = 0; round < 50; round++) {
            List<Trader> traders = randomTraders(random);
            Map<String, BigDecimal> limits = randomLimits(random, traders);
            List<Payout> payouts = new ArrayList<>();
            for (int i = 0; i < 15; i++) {
                payouts.add(payout("P" + i, String.valueOf(random.nextInt(3000) - 100)));
            }
            int cursor = random.nextInt(20);

            AssignmentPlan first = policy.assign(traders, payouts, limits, cursor);
            AssignmentPlan second = policy.assign(traders, payouts, limits, cursor);

            assertThat(second).isEqualTo(first);
        }
    }

    private static List<Trader> randomTraders(Random random) {
        int count = 1 + random.nextInt(6);
        List<Trader> traders = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            traders.add(trader("T" + i));
        }
        return traders;
    }

    private static Map<String, BigDecimal> randomLimits(Random random, List<Trader> traders) {
        Map<String, BigDecimal> limits = new HashMap<>();
        Set<String> ids = traders.stream().map(Trader::getId).collect(Collectors.toSet());
        for (String id : ids) {
            if (random.nextBoolean()) {
                limits.put(id, BigDecimal.valueOf(100 + random.nextInt(2000)));
            }
        }
        return limits;
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
