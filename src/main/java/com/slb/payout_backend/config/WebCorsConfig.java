package com.slb.payout_backend.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.CorsRegistration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

/**
 * 看板接口的跨域规则，取值见 {@link CorsProperties}。
 */
@Configuration
public class WebCorsConfig implements WebMvcConfigurer {

    private final CorsProperties corsProperties;

    public WebCorsConfig(CorsProperties corsProperties) {
        this.corsProperties = corsProperties;
    }

    @Override
    public void addCorsMappings(@NonNull CorsRegistry registry) {
        if (!corsProperties.isEnabled()) {
            return;
        }
        CorsRegistration registration = registry.addMapping("/api/**");

        List<String> allowedOrigins = corsProperties.getAllowedOrigins();
        List<String> allowedOriginPatterns = corsProperties.getAllowedOriginPatterns();
        if (allowedOrigins != null && !allowedOrigins.isEmpty()) {
            registration.allowedOrigins(allowedOrigins.toArray(String[]::new));
        } else if (allowedOriginPatterns != null && !allowedOriginPatterns.isEmpty()) {
            registration.allowedOriginPatterns(allowedOriginPatterns.toArray(String[]::new));
        } else {
            // 兜底：配置被覆盖成空列表时仍允许预检通过
            registration.allowedOriginPatterns("*");
        }

        List<String> methods = corsProperties.getAllowedMethods();
        registration.allowedMethods(methods == null || methods.isEmpty()
                ? new String[]{"GET", "POST", "OPTIONS"}
                : methods.toArray(String[]::new));

        List<String> headers = corsProperties.getAllowedHeaders();
        if (headers != null && !headers.isEmpty()) {
            registration.allowedHeaders(headers.toArray(String[]::new));
        }

        List<String> exposed = corsProperties.getExposedHeaders();
        if (exposed != null && !exposed.isEmpty()) {
            registration.exposedHeaders(exposed.toArray(String[]::new));
        }

        registration.allowCredentials(corsProperties.isAllowCredentials());
        registration.maxAge(corsProperties.getMaxAgeSeconds());
    }
}
