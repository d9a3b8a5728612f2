package org.longtrace.tracing;

import org.jetbrains.annotations.Nullable;
import org.longtrace.config.utils.LogContext;
import org.longtrace.records.Attributes;
import org.longtrace.records.LogRecord;
import org.longtrace.registry.TraceRegistry;
import org.longtrace.utils.IdSource;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Entry point for application code: emits log records and opens nested spans.
 *
 * <p>Each thread using a tracer gets its own span stack, so one instance may be shared
 * between threads; spans opened on one thread never become parents of spans on another.
 * A {@link ScopedSpan} must be closed on the thread that opened it.
 *
 * <pre>{@code
 * Tracer tracer = new Tracer();
 * try (ScopedSpan span = tracer.span("import", "{\"file\":\"a.csv\"}")) {
 *     tracer.log("parsed header");
 * }
 * }</pre>
 *
 * Construction never fails; operations throw
 * {@link org.longtrace.exceptions.NotInitializedException} until {@code LongTrace.initialize} succeeds.
 */
public class Tracer {

    private final UUID id = UUID.randomUUID();
    // no initial value: reads must not create a stack on threads that never opened a span
    private final ThreadLocal<Deque<ScopedSpan>> stacks = new ThreadLocal<>();

    public UUID id() {
        return id;
    }

    public void log(String message) {
        emit(TraceRegistry.require("log"), message, null);
    }

    /**
     * @param attributesJson a JSON document, or {@code null} for none
     * @throws org.longtrace.exceptions.InvalidAttributesException if the JSON is malformed
     */
    public void log(String message, @Nullable String attributesJson) {
        TraceRegistry registry = TraceRegistry.require("log");
        emit(registry, message, Attributes.parse(attributesJson));
    }

    public void log(String message, @Nullable Map<String, ?> attributes) {
        TraceRegistry registry = TraceRegistry.require("log");
        emit(registry, message, Attributes.of(attributes));
    }

    private void emit(TraceRegistry registry, String message, @Nullable Attributes attributes) {
        Objects.requireNonNull(message, "message");
        ScopedSpan current = currentSpan();
        LogRecord record = new LogRecord(
                current == null ? null : current.traceId(),
                current == null ? null : current.spanId(),
                message,
                attributes,
                registry.idSource().now());
        registry.enqueue(record);
    }

    public ScopedSpan span(String name) {
        return open(TraceRegistry.require("span"), name, null);
    }

    /**
     * Opens a span as a child of the current one on this thread, or as the root of a new trace.
     * Close it with try-with-resources.
     */
    public ScopedSpan span(String name, @Nullable String attributesJson) {
        TraceRegistry registry = TraceRegistry.require("span");
        return open(registry, name, Attributes.parse(attributesJson));
    }

    public ScopedSpan span(String name, @Nullable Map<String, ?> attributes) {
        TraceRegistry registry = TraceRegistry.require("span");
        return open(registry, name, Attributes.of(attributes));
    }

    private ScopedSpan open(TraceRegistry registry, String name, @Nullable Attributes attributes) {
        Objects.requireNonNull(name, "name");
        IdSource ids = registry.idSource();

        Deque<ScopedSpan> stack = stacks.get();
        if (stack == null) {
            stack = new ArrayDeque<>();
            stacks.set(stack);
        }
        ScopedSpan parent = stack.peek();
        UUID traceId = parent == null ? ids.newTraceId() : parent.traceId();
        ScopedSpan span;
        if (parent == null) {
            span = new ScopedSpan(this, stack, registry, traceId, ids.newSpanId(), null, name, attributes,
                    ids.now(), LogContext.getTraceId(), LogContext.getSpanId());
        } else {
            span = new ScopedSpan(this, stack, registry, traceId, ids.newSpanId(), parent.spanId(), name,
                    attributes, ids.now(), parent.outerTraceId(), parent.outerSpanId());
        }
        stack.push(span);
        LogContext.enterSpan(span.traceId(), span.spanId());
        return span;
    }

    /**
     * @return the innermost open span on the calling thread, or {@code null}
     */
    @Nullable
    public ScopedSpan currentSpan() {
        Deque<ScopedSpan> stack = stacks.get();
        return stack == null ? null : stack.peek();
    }

    /** Number of open spans on the calling thread. */
    public int depth() {
        Deque<ScopedSpan> stack = stacks.get();
        return stack == null ? 0 : stack.size();
    }

    boolean hasStackOnCurrentThread() {
        return stacks.get() != null;
    }

    // keeps pooled threads from pinning empty stacks of discarded tracers
    void releaseIfEmpty(Deque<ScopedSpan> stack) {
        if (stack.isEmpty() && stacks.get() == stack) {
            stacks.remove();
        }
    }
}
