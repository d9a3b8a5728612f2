package org.longtrace.registry;

import org.longtrace.config.TraceConfiguration;
import org.longtrace.config.database.DatabaseNames;
import org.longtrace.config.database.DatabaseWriter;
import org.longtrace.config.utils.LogContext;
import org.longtrace.exceptions.AlreadyInitializedException;
import org.longtrace.exceptions.LongTraceException;
import org.longtrace.exceptions.NotInitializedException;
import org.longtrace.records.TraceRecord;
import org.longtrace.services.TaskScheduler;
import org.longtrace.services.tasks.PeriodicFlushTask;
import org.longtrace.utils.IdSource;
import org.longtrace.utils.ValidationUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * The process-wide tracing backend: resolved database, writer and batch buffer.
 *
 * <p>Published at most once. {@link #initialize} is serialized, so concurrent callers see
 * exactly one winner; a failed attempt publishes nothing and may be retried. After
 * publication the instance is immutable and read without locking.
 */
public final class TraceRegistry {
    private static final Logger logger = LoggerFactory.getLogger(TraceRegistry.class);

    private static volatile TraceRegistry instance;

    /** JVM shutdown hook registration; replaced only by tests. */
    interface ShutdownHooks {
        void add(Thread hook);

        void remove(Thread hook);
    }

    static volatile ShutdownHooks shutdownHooks = new ShutdownHooks() {
        @Override
        public void add(Thread hook) {
            Runtime.getRuntime().addShutdownHook(hook);
        }

        @Override
        public void remove(Thread hook) {
            Runtime.getRuntime().removeShutdownHook(hook);
        }
    };

    private final String databaseName;
    private final int batchSize;
    private final DatabaseWriter writer;
    private final BatchBuffer buffer;
    private final IdSource idSource;
    private final TaskScheduler scheduler;
    private final Thread shutdownHook;

    private TraceRegistry(String databaseName, int batchSize, DatabaseWriter writer, IdSource idSource,
                          TraceConfiguration.Tracing tracing) {
        this.databaseName = databaseName;
        this.batchSize = batchSize;
        this.writer = writer;
        this.buffer = new BatchBuffer(batchSize, writer);
        this.idSource = idSource;

        if (tracing.flushIntervalSeconds > 0) {
            scheduler = new TaskScheduler();
            scheduler.register(new PeriodicFlushTask(buffer, tracing.flushIntervalSeconds));
        } else {
            scheduler = null;
        }
        shutdownHook = tracing.flushOnShutdown
                ? new Thread(this::flushOnExit, "longtrace-shutdown")
                : null;
    }

    /**
     * Connects, resolves the database and publishes the registry.
     *
     * @return the resolved database name
     * @throws AlreadyInitializedException if a registry was already published
     * @throws org.longtrace.exceptions.TraceConnectionException if the store is unreachable
     *         or the database cannot be resolved; nothing is published in that case
     */
    public static synchronized String initialize(RegistryOptions options) {
        Objects.requireNonNull(options, "options");
        TraceRegistry existing = instance;
        if (existing != null) {
            throw new AlreadyInitializedException(existing.databaseName);
        }
        ValidationUtil.requireNonBlank(options.connectionString(), "connectionString");
        ValidationUtil.requirePositive(options.batchSize(), "batchSize");
        Objects.requireNonNull(options.configuration(), "configuration");
        Objects.requireNonNull(options.writerFactory(), "writerFactory");
        Objects.requireNonNull(options.idSource(), "idSource");

        String candidate = options.candidateName() != null ? options.candidateName() : DatabaseNames.defaultName();

        logger.info("Initializing tracing (batchSize={}, candidate='{}')", options.batchSize(), candidate);
        DatabaseWriter writer = options.writerFactory().create(options.connectionString(), options.configuration());
        TraceRegistry registry = null;
        String resolved;
        try {
            resolved = writer.ensureDatabase(candidate);
            registry = new TraceRegistry(resolved, options.batchSize(), writer, options.idSource(),
                    options.configuration().tracing);
            registry.start();
        } catch (RuntimeException e) {
            logger.error("Tracing initialization failed: {}", e.getMessage());
            if (registry != null) {
                registry.stopBackground();
            }
            writer.close();
            throw e;
        }
        instance = registry;
        logger.info("Tracing initialized, writing to database '{}'", resolved);
        return resolved;
    }

    private void start() {
        if (scheduler != null) {
            scheduler.start();
        }
        if (shutdownHook != null) {
            shutdownHooks.add(shutdownHook);
        }
    }

    private void stopBackground() {
        if (shutdownHook != null) {
            try {
                shutdownHooks.remove(shutdownHook);
            } catch (IllegalStateException e) {
                logger.debug("JVM already shutting down, hook left in place");
            }
        }
        if (scheduler != null) scheduler.stop();
    }

    /**
     * @return the published registry, or {@code null} before initialization
     */
    public static TraceRegistry get() {
        return instance;
    }

    public static TraceRegistry require(String operation) {
        TraceRegistry registry = instance;
        if (registry == null) {
            throw new NotInitializedException(operation);
        }
        return registry;
    }

    public static boolean isInitialized() {
        return instance != null;
    }

    public void enqueue(TraceRecord record) {
        buffer.enqueue(record);
    }

    public int flush() {
        return buffer.flush();
    }

    public int pendingCount() {
        return buffer.pendingCount();
    }

    public String databaseName() {
        return databaseName;
    }

    public int batchSize() {
        return batchSize;
    }

    public IdSource idSource() {
        return idSource;
    }

    BatchBuffer buffer() {
        return buffer;
    }

    private void flushOnExit() {
        LogContext.start("ShutdownHook");
        try {
            int written = buffer.flush();
            logger.info("Flushed {} pending trace records on shutdown", written);
        } catch (LongTraceException e) {
            logger.error("Pending trace records lost on shutdown: {}", e.getMessage(), e);
        } finally {
            if (scheduler != null) scheduler.stop();
            writer.close();
            LogContext.clear();
        }
    }

    /**
     * Test hook: unpublishes the registry and releases its resources without flushing.
     */
    static synchronized void reset() {
        TraceRegistry registry = instance;
        if (registry == null) return;
        instance = null;
        registry.stopBackground();
        registry.writer.close();
    }
}
