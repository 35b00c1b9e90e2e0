package com.echo.signaling_service.utility;

import java.util.UUID;

import org.slf4j.MDC;

/**
 * Binds a correlation id to the current thread's MDC so every log line of one inbound
 * frame or request, and every outbound call it makes, carries the same id.
 */
public final class CorrelationIdUtil {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    private CorrelationIdUtil() {
    }

    public static String getCorrelationId() {
        return MDC.get(CORRELATION_ID_HEADER);
    }

    /**
     * Starts a new scope, e.g. {@code ws-<connection>-1a2b3c4d}.
     */
    public static String begin(String prefix) {
        String id = prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
        MDC.put(CORRELATION_ID_HEADER, id);
        return id;
    }

    // id of the current scope, opening one when the thread has none
    public static String getOrCreate() {
        String id = getCorrelationId();
        if (id == null) {
            id = UUID.randomUUID().toString();
            MDC.put(CORRELATION_ID_HEADER, id);
        }
        return id;
    }

    public static void clear() {
        MDC.remove(CORRELATION_ID_HEADER);
    }
}
