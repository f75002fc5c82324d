package com.slb.payout_backend.common.trace;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * 为每个请求分配 {@code X-Trace-Id}（优先沿用调用方传入的值），并写入响应头与日志 MDC。
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdFilter extends OncePerRequestFilter {

    private static final int MAX_SUPPLIED_LENGTH = 64;

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain
    ) throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(TraceIdHolder.TRACE_ID_HEADER));

        TraceIdHolder.set(traceId);
        response.setHeader(TraceIdHolder.TRACE_ID_HEADER, traceId);

        try {
            filterChain.doFilter(request, response);
        } finally {
            TraceIdHolder.clear();
        }
    }

    // SSE 长连接不需要在异步派发时重复处理
    @Override
    protected boolean shouldNotFilterAsyncDispatch() {
        return true;
    }

    private String resolveTraceId(String supplied) {
        if (!StringUtils.hasText(supplied)) {
            return TraceIdHolder.newTraceId();
        }
        String trimmed = supplied.trim();
        return trimmed.length() > MAX_SUPPLIED_LENGTH ? trimmed.substring(0, MAX_SUPPLIED_LENGTH) : trimmed;
    }
}
