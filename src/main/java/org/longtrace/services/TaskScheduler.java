package org.longtrace.services;

import org.longtrace.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs registered tasks at a fixed rate on daemon threads, so an embedding
 * application can exit without stopping it.
 */
public class TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<ScheduledTask> tasks = new ArrayList<>();

    public TaskScheduler() { this(1); }
    public TaskScheduler(int poolSize) {
        this.executor = new ScheduledThreadPoolExecutor(poolSize, daemonThreads());
        this.executor.setRemoveOnCancelPolicy(true);
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread t = new Thread(runnable, "longtrace-scheduler-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    /**
     * Register a task for scheduled execution.
     */
    public synchronized void register(ScheduledTask task) {
        tasks.add(task);
    }

    /**
     * Start all registered tasks. The first run happens one interval after start.
     */
    public synchronized void start() {
        for (ScheduledTask t : tasks) {
            logger.info("Scheduling task {} every {}s", t.name(), t.intervalSeconds());
            ScheduledFuture<?> f = executor.scheduleAtFixedRate(() -> runTaskWithLogging(t),
                    t.intervalSeconds(), t.intervalSeconds(), TimeUnit.SECONDS);
            futures.add(f);
        }
    }

    // an exception escaping here would cancel all future runs of the task
    private void runTaskWithLogging(ScheduledTask task) {
        LogContext.start(task.name());
        long start = System.currentTimeMillis();
        try {
            task.execute();
        } catch (Exception e) {
            logger.error("Error in scheduled task {}: {}", task.name(), e.getMessage(), e);
        } finally {
            logger.trace("Task {} finished in {} ms", task.name(), System.currentTimeMillis() - start);
            LogContext.clear();
        }
    }

    /**
     * Stop all tasks and shutdown executor.
     */
    public synchronized void stop() {
        logger.debug("Shutting down TaskScheduler...");
        for (ScheduledFuture<?> f : futures) f.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("TaskScheduler did not terminate gracefully");
                executor.shutdownNow();
            } else {
                logger.debug("TaskScheduler stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }
}
