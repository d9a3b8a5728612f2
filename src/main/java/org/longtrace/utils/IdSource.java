package org.longtrace.utils;

import java.time.Instant;
import java.util.UUID;

/**
 * Supplies identifiers and timestamps for spans and log records.
 */
public interface IdSource {

    UUID newTraceId();

    UUID newSpanId();

    /**
     * Never earlier than any value previously returned by the same source.
     */
    Instant now();
}
