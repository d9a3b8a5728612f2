package org.longtrace.exceptions;

public class InvalidAttributesException extends LongTraceException {

    public InvalidAttributesException(String message, Throwable cause) {
        super(message, cause);
    }
}
