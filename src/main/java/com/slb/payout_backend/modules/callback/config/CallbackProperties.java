package com.slb.payout_backend.modules.callback.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app.callback")
@Data
public class CallbackProperties {
    /** 单次回调的总超时（含建连、发送与读取响应） */
    private long timeoutMs = 15_000L;
    /** 携带商户公钥的请求头 */
    private String apiKeyHeader = "x-merchant-api-key";
    /** 审计日志中保存的响应体最大长度 */
    private int responseBodyMaxLength = 2000;
}
