package com.slb.payout_backend.common.trace;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.UUID;

/**
 * Thread-local holder for trace identifiers, mirrored into the SLF4J {@code MDC}
 * so that every log line of a request or of a distribution cycle carries it.
 */
public final class TraceIdHolder {
    public static final String TRACE_ID_HEADER = "X-Trace-Id";
    public static final String MDC_KEY = "traceId";

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private TraceIdHolder() {
    }

    public static void set(String traceId) {
        TRACE_ID.set(traceId);
        MDC.put(MDC_KEY, traceId);
    }

    public static Optional<String> getOptional() {
        return Optional.ofNullable(TRACE_ID.get());
    }

    public static String require() {
        return getOptional().orElseGet(() -> {
            String generated = newTraceId();
            set(generated);
            return generated;
        });
    }

    /**
     * Starts a fresh trace for work that is not driven by an inbound request (scheduler cycles).
     */
    public static String begin(String prefix) {
        String traceId = prefix + "-" + newTraceId().substring(0, 12);
        set(traceId);
        return traceId;
    }

    public static String newTraceId() {
        return UUID.randomUUID().toString().replace("-", "");
    }

    public static void clear() {
        TRACE_ID.remove();
        MDC.remove(MDC_KEY);
    }
}
