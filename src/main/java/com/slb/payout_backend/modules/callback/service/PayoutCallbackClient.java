package com.slb.payout_backend.modules.callback.service;

import com.slb.payout_backend.modules.callback.config.CallbackProperties;
import com.slb.payout_backend.modules.callback.domain.CallbackDispatchResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.net.URI;
import java.time.Duration;

/**
 * 商户 webhook 的 HTTP 发送端。只发一次，不重试；任何传输异常都转换为结果对象返回。
 */
@Component
@Slf4j
public class PayoutCallbackClient {

    private final CallbackProperties properties;
    private final WebClient http;

    public PayoutCallbackClient(WebClient.Builder builder, CallbackProperties properties) {
        this.properties = properties;
        this.http = builder
                .defaultHeader(HttpHeaders.USER_AGENT, "PayoutBackend/CallbackClient")
                .build();
    }

    public CallbackDispatchResult post(String url, String apiKey, String jsonBody) {
        Duration timeout = Duration.ofMillis(Math.max(100L, properties.getTimeoutMs()));
        try {
            ResponseEntity<String> response = http.post()
                    .uri(URI.create(url))
                    .headers(headers -> {
                        headers.set(properties.getApiKeyHeader(), apiKey);
                        headers.setContentType(MediaType.APPLICATION_JSON);
                    })
                    .bodyValue(jsonBody)
                    .retrieve()
                    .toEntity(String.class)
                    .timeout(timeout)
                    .block();
            if (response == null) {
                return CallbackDispatchResult.transportFailure("Empty response from merchant webhook", url);
            }
            return CallbackDispatchResult.responded(
                    response.getStatusCode().value(), trimBody(response.getBody()), url);
        } catch (WebClientResponseException ex) {
            log.warn("Merchant webhook responded with error: url={}, status={}", url, ex.getStatusCode().value());
            return CallbackDispatchResult.responded(
                    ex.getStatusCode().value(), trimBody(ex.getResponseBodyAsString()), url);
        } catch (Exception ex) {
            log.warn("Merchant webhook request failed: url={}, error={}", url, ex.toString());
            return CallbackDispatchResult.transportFailure(describe(ex), url);
        }
    }

    private String describe(Exception ex) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        String message = root.getMessage();
        return StringUtils.hasText(message)
                ? root.getClass().getSimpleName() + ": " + message
                : root.getClass().getSimpleName();
    }

    private String trimBody(String body) {
        if (body == null) {
            return null;
        }
        int max = Math.max(0, properties.getResponseBodyMaxLength());
        return body.length() <= max ? body : body.substring(0, max);
    }
}
