package org.longtrace.exceptions;

/**
 * The store was reachable but rejected a batch (constraint or storage error).
 * The whole batch was rolled back.
 */
public class TraceWriteException extends LongTraceException {

    public TraceWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
