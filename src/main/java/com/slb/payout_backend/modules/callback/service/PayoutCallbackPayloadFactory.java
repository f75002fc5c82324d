package com.slb.payout_backend.modules.callback.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.slb.payout_backend.modules.callback.dto.PayoutCallbackPayload;
import com.slb.payout_backend.modules.payout.entity.PayoutDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * 由出款单快照组装回调报文。数据库中以 JSON 文本保存的字段在这里还原成结构化节点。
 */
@Component
@Slf4j
public class PayoutCallbackPayloadFactory {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public PayoutCallbackPayloadFactory(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public PayoutCallbackPayload build(String event, String status, PayoutDetails payout) {
        PayoutCallbackPayload.Body body = new PayoutCallbackPayload.Body();
        body.setId(payout.getId());
        body.setBank(payout.getBank());
        body.setAmount(payout.getAmount());
        body.setStatus(status);
        body.setWallet(payout.getWallet());
        body.setMetadata(readMetadata(payout));
        body.setNumericId(payout.getNumericId());
        body.setAmountUsdt(payout.getAmountUsdt());
        body.setProofFiles(readList(payout.getId(), "proofFiles", payout.getProofFiles()));
        body.setCancelReason(payout.getCancelReason());
        body.setDisputeFiles(readList(payout.getId(), "disputeFiles", payout.getDisputeFiles()));
        body.setDisputeMessage(payout.getDisputeMessage());
        body.setCancelReasonCode(payout.getCancelReasonCode());
        body.setExternalReference(payout.getExternalReference());
        return new PayoutCallbackPayload(event, body);
    }

    public String toJson(PayoutCallbackPayload payload) throws JsonProcessingException {
        return objectMapper.writeValueAsString(payload);
    }

    // 商户未配置 metadata 时回调里给空对象
    private JsonNode readMetadata(PayoutDetails payout) {
        String raw = payout.getMerchantMetadata();
        if (!StringUtils.hasText(raw)) {
            return objectMapper.createObjectNode();
        }
        try {
            JsonNode node = objectMapper.readTree(raw);
            return node == null || node.isNull() ? objectMapper.createObjectNode() : node;
        } catch (JsonProcessingException e) {
            log.warn("Merchant metadata is not valid JSON, sending empty object: payoutId={}", payout.getId());
            return objectMapper.createObjectNode();
        }
    }

    private List<String> readList(String payoutId, String field, String raw) {
        if (!StringUtils.hasText(raw)) {
            return List.of();
        }
        try {
            List<String> values = objectMapper.readValue(raw, STRING_LIST);
            return values == null ? List.of() : values;
        } catch (JsonProcessingException e) {
            log.warn("Payout {} is not a JSON string array, sending empty list: payoutId={}", field, payoutId);
            return List.of();
        }
    }
}
