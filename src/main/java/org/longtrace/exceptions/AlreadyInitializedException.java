package org.longtrace.exceptions;

/**
 * Thrown by a second {@code initialize} once a registry has been published.
 */
public class AlreadyInitializedException extends LongTraceException {

    public AlreadyInitializedException(String databaseName) {
        super("Tracing is already initialized (database: " + databaseName + ")");
    }
}
