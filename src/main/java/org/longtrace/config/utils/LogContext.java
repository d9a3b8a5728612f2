package org.longtrace.config.utils;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * MDC bookkeeping so application log lines carry the ids of the span they were written in.
 * Only the keys below are touched; the host application's own MDC entries are left alone.
 */
public final class LogContext {
    public static final String COMPONENT = "component";
    public static final String TRACE_ID = "trace.id";
    public static final String SPAN_ID = "span.id";

    private LogContext() {}

    /** For threads owned by this library (scheduler, shutdown hook). */
    public static void start(String component) {
        MDC.put(COMPONENT, component);
    }

    public static void enterSpan(UUID traceId, UUID spanId) {
        MDC.put(TRACE_ID, traceId.toString());
        MDC.put(SPAN_ID, spanId.toString());
    }

    /**
     * Restores the MDC after a span closes: either the ids of the span now on top, or nothing.
     */
    public static void restoreSpan(UUID traceId, UUID spanId) {
        if (traceId == null || spanId == null) {
            clearSpan();
        } else {
            enterSpan(traceId, spanId);
        }
    }

    /** Puts back ids captured earlier with {@link #getTraceId()} and {@link #getSpanId()}. */
    public static void restoreSpan(String traceId, String spanId) {
        if (traceId == null || spanId == null) {
            clearSpan();
        } else {
            MDC.put(TRACE_ID, traceId);
            MDC.put(SPAN_ID, spanId);
        }
    }

    public static void clearSpan() {
        MDC.remove(TRACE_ID);
        MDC.remove(SPAN_ID);
    }

    public static void clear() {
        MDC.remove(COMPONENT);
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    public static String getSpanId() {
        return MDC.get(SPAN_ID);
    }
}



/*
 * | Action                               | Rule                                          |
 * | ------------------------------------ | --------------------------------------------- |
 * | Span opened                          | `LogContext.enterSpan(traceId, spanId)`       |
 * | Span closed, stack not empty         | `LogContext.restoreSpan(new top's ids)`       |
 * | Last span of a stack closed          | `LogContext.restoreSpan(ids saved at root)`   |
 * | Library-owned thread starts work     | `LogContext.start("ComponentName")`           |
 * | Library-owned thread finishes        | `LogContext.clear()` in a finally block       |
 */
