package com.slb.payout_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * CORS 配置（运营看板从独立域名调用 /api/** 时使用）。
 */
@Component
@ConfigurationProperties(prefix = "app.cors")
@Data
public class CorsProperties {

    private boolean enabled = true;

    /**
     * 精确允许的 Origin 列表。为空则使用 allowedOriginPatterns。
     */
    private List<String> allowedOrigins = new ArrayList<>();

    private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));

    private List<String> allowedMethods = new ArrayList<>(List.of("GET", "POST", "OPTIONS"));

    private List<String> allowedHeaders = new ArrayList<>(List.of(
            "Content-Type",
            "X-Requested-With",
            "X-Trace-Id"
    ));

    private List<String> exposedHeaders = new ArrayList<>(List.of("X-Trace-Id"));

    private boolean allowCredentials = false;

    private long maxAgeSeconds = 3600;
}
