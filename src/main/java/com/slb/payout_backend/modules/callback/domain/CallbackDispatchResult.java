package com.slb.payout_backend.modules.callback.domain;

/**
 * 一次商户回调的结果。delivered 仅在对端返回 2xx 时为 true；
 * statusCode 为空表示没有拿到 HTTP 响应（未发送或传输失败）。
 */
public record CallbackDispatchResult(
        boolean delivered,
        Integer statusCode,
        String responseBody,
        String error,
        String url
) {

    public static CallbackDispatchResult notAttempted(String reason, String url) {
        return new CallbackDispatchResult(false, null, null, reason, url);
    }

    public static CallbackDispatchResult transportFailure(String reason, String url) {
        return new CallbackDispatchResult(false, null, null, reason, url);
    }

    public static CallbackDispatchResult responded(int statusCode, String responseBody, String url) {
        boolean success = statusCode >= 200 && statusCode < 300;
        String body = responseBody == null || responseBody.isEmpty() ? null : responseBody;
        return new CallbackDispatchResult(success, statusCode, body, success ? null : "HTTP " + statusCode, url);
    }
}
