package org.longtrace.exceptions;

/**
 * Base type for every failure raised by the tracing client.
 * Callers that only care "did tracing fail" can catch this one type.
 */
public abstract class LongTraceException extends RuntimeException {

    protected LongTraceException(String message) {
        super(message);
    }

    protected LongTraceException(String message, Throwable cause) {
        super(message, cause);
    }
}
