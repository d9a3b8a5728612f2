package org.longtrace.registry;

import org.longtrace.config.database.DatabaseWriter;
import org.longtrace.records.TraceRecord;
import org.longtrace.utils.ValidationUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Shared accumulator of pending records.
 *
 * <p>Appending and draining happen under one lock, so a record is handed to exactly one
 * batch. The write itself runs outside the lock on the thread that triggered it: the
 * producer whose record filled the batch, or the caller of {@link #flush()}. A failed
 * batch is not re-queued; the error goes to that thread.
 */
public class BatchBuffer {
    private static final Logger logger = LoggerFactory.getLogger(BatchBuffer.class);

    private final int batchSize;
    private final DatabaseWriter writer;

    private final Object lock = new Object();
    private final List<TraceRecord> pending = new ArrayList<>();

    public BatchBuffer(int batchSize, DatabaseWriter writer) {
        this.batchSize = ValidationUtil.requirePositive(batchSize, "batchSize");
        this.writer = Objects.requireNonNull(writer, "writer");
    }

    /**
     * Appends a record; if that fills the buffer, writes one batch of {@code batchSize}
     * records before returning.
     */
    public void enqueue(TraceRecord record) {
        Objects.requireNonNull(record, "record");
        List<TraceRecord> batch = null;
        synchronized (lock) {
            pending.add(record);
            if (pending.size() >= batchSize) {
                batch = drain(batchSize);
            }
        }
        if (batch != null) {
            submit(batch, "threshold");
        }
    }

    /**
     * Writes everything pending as one batch, regardless of size.
     *
     * @return number of records written
     */
    public int flush() {
        List<TraceRecord> batch;
        synchronized (lock) {
            batch = drain(pending.size());
        }
        if (batch.isEmpty()) {
            return 0;
        }
        submit(batch, "explicit");
        return batch.size();
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    public int batchSize() {
        return batchSize;
    }

    private List<TraceRecord> drain(int count) {
        List<TraceRecord> head = pending.subList(0, count);
        List<TraceRecord> batch = new ArrayList<>(head);
        head.clear();
        return batch;
    }

    private void submit(List<TraceRecord> batch, String trigger) {
        try {
            writer.writeBatch(Collections.unmodifiableList(batch));
            logger.debug("Wrote {} records ({} flush)", batch.size(), trigger);
        } catch (RuntimeException e) {
            logger.warn("Dropped batch of {} records ({} flush): {}", batch.size(), trigger, e.getMessage());
            throw e;
        }
    }
}
