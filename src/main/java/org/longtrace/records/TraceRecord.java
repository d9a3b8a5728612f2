package org.longtrace.records;

import java.util.UUID;

/**
 * Anything that can sit in the batch buffer and be written as one row.
 */
public interface TraceRecord {

    /**
     * Null only for a log emitted outside of any span.
     */
    UUID traceId();
}
