package org.longtrace.exceptions;

/**
 * The store could not be reached: transport, authentication or timeout.
 * Retrying later may succeed.
 */
public class TraceConnectionException extends LongTraceException {

    public TraceConnectionException(String message) {
        super(message);
    }

    public TraceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
