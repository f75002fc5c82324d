package com.slb.payout_backend.modules.callback.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.slb.payout_backend.modules.callback.domain.CallbackAuditException;
import com.slb.payout_backend.modules.callback.domain.CallbackDispatchResult;
import com.slb.payout_backend.modules.callback.dto.PayoutCallbackPayload;
import com.slb.payout_backend.modules.callback.entity.PayoutCallbackHistory;
import com.slb.payout_backend.modules.callback.mapper.PayoutCallbackHistoryMapper;
import com.slb.payout_backend.modules.payout.domain.PayoutStatus;
import com.slb.payout_backend.modules.payout.entity.PayoutDetails;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.UUID;

/**
 * 出款单状态变更后通知商户，并把每一次结果（包括未发送）写入回调审计表。
 * 必须在状态变更事务提交之后调用。
 */
@Service
@Slf4j
public class PayoutCallbackDispatcher {

    public static final String EVENT_CANCELED = "CANCELED";
    public static final String MISSING_WEBHOOK_URL = "(missing-webhook-url)";
    public static final String ERROR_MISSING_WEBHOOK_URL = "Merchant webhook URL is not configured";
    public static final String ERROR_MISSING_API_KEY = "Merchant API key is not configured";

    private final PayoutCallbackClient callbackClient;
    private final PayoutCallbackPayloadFactory payloadFactory;
    private final PayoutCallbackHistoryMapper historyMapper;

    public PayoutCallbackDispatcher(PayoutCallbackClient callbackClient,
                                    PayoutCallbackPayloadFactory payloadFactory,
                                    PayoutCallbackHistoryMapper historyMapper) {
        this.callbackClient = callbackClient;
        this.payloadFactory = payloadFactory;
        this.historyMapper = historyMapper;
    }

    /**
     * 发送 CANCELED 回调。
     *
     * @param payout 已取消出款单的快照（状态、取消原因均为提交后的值）
     * @return 发送结果；前置条件不满足时 delivered=false 且未发起请求
     * @throws CallbackAuditException 审计记录写入失败
     */
    public CallbackDispatchResult dispatchCancelled(PayoutDetails payout) {
        PayoutCallbackPayload payload = payloadFactory.build(EVENT_CANCELED, PayoutStatus.CANCELED_LABEL, payout);
        String json = serialize(payout.getId(), payload);

        String webhookUrl = trimToNull(payout.getMerchantWebhookUrl());
        String apiKey = trimToNull(payout.getMerchantApiKey());
        CallbackDispatchResult result;
        if (webhookUrl == null) {
            log.warn("Skip payout callback, webhook URL missing: payoutId={}, merchantId={}",
                    payout.getId(), payout.getMerchantId());
            result = CallbackDispatchResult.notAttempted(ERROR_MISSING_WEBHOOK_URL, MISSING_WEBHOOK_URL);
        } else if (apiKey == null) {
            log.warn("Skip payout callback, API key missing: payoutId={}, merchantId={}",
                    payout.getId(), payout.getMerchantId());
            result = CallbackDispatchResult.notAttempted(ERROR_MISSING_API_KEY, webhookUrl);
        } else {
            result = callbackClient.post(webhookUrl, apiKey, json);
            if (result.delivered()) {
                log.info("Payout callback delivered: payoutId={}, url={}, status={}",
                        payout.getId(), webhookUrl, result.statusCode());
            } else {
                log.warn("Payout callback failed: payoutId={}, url={}, status={}, error={}",
                        payout.getId(), webhookUrl, result.statusCode(), result.error());
            }
        }

        record(payout.getId(), json, result);
        return result;
    }

    private void record(String payoutId, String json, CallbackDispatchResult result) {
        PayoutCallbackHistory history = new PayoutCallbackHistory();
        history.setId(UUID.randomUUID().toString());
        history.setPayoutId(payoutId);
        history.setUrl(result.url());
        history.setPayload(json);
        history.setResponse(result.responseBody());
        history.setStatusCode(result.statusCode());
        history.setError(result.error());
        try {
            historyMapper.insert(history);
        } catch (RuntimeException e) {
            throw new CallbackAuditException(payoutId, "回调审计记录写入失败", e);
        }
    }

    private String serialize(String payoutId, PayoutCallbackPayload payload) {
        try {
            return payloadFactory.toJson(payload);
        } catch (JsonProcessingException e) {
            throw new CallbackAuditException(payoutId, "回调报文序列化失败", e);
        }
    }

    private static String trimToNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
