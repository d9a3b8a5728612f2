package org.longtrace.services.tasks;

import org.longtrace.registry.BatchBuffer;
import org.longtrace.services.ScheduledTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Flushes partial batches so records do not wait indefinitely for the threshold.
 */
public class PeriodicFlushTask implements ScheduledTask {
    private static final Logger logger = LoggerFactory.getLogger(PeriodicFlushTask.class);

    private final BatchBuffer buffer;
    private final long intervalSeconds;

    public PeriodicFlushTask(BatchBuffer buffer, long intervalSeconds) {
        this.buffer = buffer;
        this.intervalSeconds = intervalSeconds;
    }

    @Override public String name() { return "PeriodicFlushTask"; }
    @Override public long intervalSeconds() { return intervalSeconds; }

    @Override
    public void execute() {
        int written = buffer.flush();
        if (written > 0) {
            logger.debug("Periodic flush wrote {} records", written);
        }
    }
}
