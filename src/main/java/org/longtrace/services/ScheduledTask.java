package org.longtrace.services;

public interface ScheduledTask {
    /**
     * A short name used for logging and thread naming.
     */
    String name();

    /**
     * Interval in seconds between executions.
     */
    long intervalSeconds();

    /**
     * The work to do. Exceptions are caught and logged by the scheduler.
     */
    void execute();
}
