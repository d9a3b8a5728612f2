package org.longtrace.tracing;

import org.jetbrains.annotations.Nullable;
import org.longtrace.config.utils.LogContext;
import org.longtrace.records.Attributes;
import org.longtrace.records.SpanRecord;
import org.longtrace.registry.TraceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Deque;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * An open span. {@link #close()} finalizes it exactly once: it stamps the end time,
 * pops it off the owning tracer's stack and enqueues the finished record.
 *
 * <p>The stack is always restored before the record is enqueued, so a persistence failure
 * thrown from {@code close()} leaves the tracer usable.
 */
public final class ScopedSpan implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(ScopedSpan.class);

    private final Tracer tracer;
    private final Deque<ScopedSpan> stack;
    private final TraceRegistry registry;

    private final UUID traceId;
    private final UUID spanId;
    private final UUID parentSpanId;
    private final String name;
    private final Attributes attributes;
    private final Instant startTime;
    // MDC ids in place when the root of this stack opened, possibly another tracer's span
    private final String outerTraceId;
    private final String outerSpanId;

    private final AtomicBoolean closed = new AtomicBoolean();
    private volatile Instant endTime;

    ScopedSpan(Tracer tracer, Deque<ScopedSpan> stack, TraceRegistry registry, UUID traceId, UUID spanId,
               UUID parentSpanId, String name, Attributes attributes, Instant startTime,
               String outerTraceId, String outerSpanId) {
        this.tracer = tracer;
        this.stack = stack;
        this.registry = registry;
        this.traceId = traceId;
        this.spanId = spanId;
        this.parentSpanId = parentSpanId;
        this.name = name;
        this.attributes = attributes;
        this.startTime = startTime;
        this.outerTraceId = outerTraceId;
        this.outerSpanId = outerSpanId;
    }

    public UUID traceId() {
        return traceId;
    }

    public UUID spanId() {
        return spanId;
    }

    @Nullable
    public UUID parentSpanId() {
        return parentSpanId;
    }

    public String name() {
        return name;
    }

    @Nullable
    public Attributes attributes() {
        return attributes;
    }

    public Instant startTime() {
        return startTime;
    }

    /** Null while the span is open. */
    @Nullable
    public Instant endTime() {
        return endTime;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * @throws org.longtrace.exceptions.TraceConnectionException if enqueuing triggered a flush that failed
     * @throws org.longtrace.exceptions.TraceWriteException likewise, when the store rejected the batch
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        endTime = registry.idSource().now();

        if (stack.peek() == this) {
            stack.pop();
        } else if (stack.removeFirstOccurrence(this)) {
            logger.warn("Span '{}' ({}) closed while inner spans were still open", name, spanId);
        }
        ScopedSpan top = stack.peek();
        if (top != null) {
            LogContext.restoreSpan(top.traceId(), top.spanId());
        } else {
            LogContext.restoreSpan(outerTraceId, outerSpanId);
        }
        tracer.releaseIfEmpty(stack);

        registry.enqueue(toRecord());
    }

    String outerTraceId() {
        return outerTraceId;
    }

    String outerSpanId() {
        return outerSpanId;
    }

    SpanRecord toRecord() {
        return new SpanRecord(traceId, spanId, parentSpanId, name, attributes, startTime, endTime);
    }

    @Override
    public String toString() {
        return "ScopedSpan[name=" + name + ", traceId=" + traceId + ", spanId=" + spanId
                + ", parentSpanId=" + parentSpanId + ", closed=" + closed.get() + "]";
    }
}
