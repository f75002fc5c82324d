package com.slb.payout_backend.modules.callback.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

/**
 * 推送给商户 webhook 的出款状态变更报文。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class PayoutCallbackPayload {

    private String event;
    private Body payout;

    @Data
    @NoArgsConstructor
    public static class Body {
        private String id;
        private String bank;
        private BigDecimal amount;
        private String status;
        private String wallet;
        private JsonNode metadata;
        private Integer numericId;
        private BigDecimal amountUsdt;
        private List<String> proofFiles;
        private String cancelReason;
        private List<String> disputeFiles;
        private String disputeMessage;
        private String cancelReasonCode;
        private String externalReference;
    }
}
