package org.longtrace.records;

import java.time.Instant;
import java.util.UUID;

/**
 * A finalized span, as persisted to the {@code spans} table.
 */
public record SpanRecord(UUID traceId, UUID spanId, UUID parentSpanId, String name, Attributes attributes,
                         Instant startTime, Instant endTime) implements TraceRecord {

    public boolean isRoot() {
        return parentSpanId == null;
    }
}
