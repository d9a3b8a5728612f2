package org.longtrace.records;

import java.time.Instant;
import java.util.UUID;

/**
 * One {@code log} call. {@code traceId}/{@code spanId} are those of the span that was
 * on top of the tracer's stack, or both null.
 */
public record LogRecord(UUID traceId, UUID spanId, String message, Attributes attributes, Instant timestamp)
        implements TraceRecord {
}
