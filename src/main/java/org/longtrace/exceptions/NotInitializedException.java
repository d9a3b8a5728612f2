package org.longtrace.exceptions;

public class NotInitializedException extends LongTraceException {

    public NotInitializedException(String operation) {
        super("Database not initialized: call LongTrace.initialize() before " + operation);
    }
}
