package com.slb.payout_backend.modules.distribution.domain;

import java.math.BigDecimal;

public record Pairing(String payoutId, String traderId, BigDecimal amount) {
}
