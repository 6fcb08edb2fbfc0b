package org.checkpulse.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC context for consistent logging.
 * Adds "component", "check" and "trace.id" metadata to every log entry.
 * Worker threads must call {@link #start} themselves and {@link #clear} in a finally block.
 */
public class LogContext {
    private LogContext() {}

    public static void start(String component) {
        MDC.put("component", component);
        MDC.put("trace.id", UUID.randomUUID().toString());
    }

    public static void start(String component, String check) {
        start(component);
        if (check != null) {
            MDC.put("check", check);
        }
    }

    public static void clear() {
        MDC.clear();
    }

    public static String getTraceId() {
        return MDC.get("trace.id");
    }
}
