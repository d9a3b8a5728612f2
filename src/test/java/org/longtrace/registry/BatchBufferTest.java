package org.longtrace.registry;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.longtrace.exceptions.TraceConnectionException;
import org.longtrace.exceptions.TraceWriteException;
import org.longtrace.records.LogRecord;
import org.longtrace.records.TraceRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchBufferTest {

    RecordingWriter writer;

    @BeforeEach
    void setUp() {
        writer = new RecordingWriter();
    }

    private static LogRecord log(String message) {
        return new LogRecord(null, null, message, null, Instant.now());
    }

    @Test
    void reachingBatchSizeWritesExactlyOneBatch() {
        BatchBuffer buffer = new BatchBuffer(5, writer);
        for (int i = 0; i < 4; i++) {
            buffer.enqueue(log("m" + i));
        }
        assertEquals(0, writer.batches().size());
        assertEquals(4, buffer.pendingCount());

        buffer.enqueue(log("m4"));

        assertEquals(0, buffer.pendingCount());
        assertEquals(1, writer.batches().size());
        assertEquals(5, writer.batches().get(0).size());
    }

    @Test
    void batchPreservesSubmissionOrder() {
        BatchBuffer buffer = new BatchBuffer(3, writer);
        buffer.enqueue(log("a"));
        buffer.enqueue(log("b"));
        buffer.enqueue(log("c"));

        List<String> messages = new ArrayList<>();
        for (TraceRecord r : writer.batches().get(0)) {
            messages.add(((LogRecord) r).message());
        }
        assertEquals(List.of("a", "b", "c"), messages);
    }

    @Test
    void explicitFlushDrainsPartialBatch() {
        BatchBuffer buffer = new BatchBuffer(10, writer);
        buffer.enqueue(log("1"));
        buffer.enqueue(log("2"));
        buffer.enqueue(log("3"));

        assertEquals(3, buffer.flush());

        assertEquals(1, writer.batches().size());
        assertEquals(3, writer.batches().get(0).size());
        assertEquals(0, buffer.pendingCount());
    }

    @Test
    void flushOfEmptyBufferWritesNothing() {
        BatchBuffer buffer = new BatchBuffer(10, writer);
        assertEquals(0, buffer.flush());
        assertTrue(writer.batches().isEmpty());
    }

    @Test
    void thresholdFailureReachesTheEnqueuingCaller() {
        BatchBuffer buffer = new BatchBuffer(2, writer);
        TraceConnectionException down = new TraceConnectionException("store down");
        writer.failWritesWith(down);

        buffer.enqueue(log("first"));
        TraceConnectionException thrown = assertThrows(TraceConnectionException.class, () -> buffer.enqueue(log("second")));

        assertSame(down, thrown);
        // no retry queue: the failed batch is gone
        assertEquals(0, buffer.pendingCount());
    }

    @Test
    void flushFailureReachesTheFlushingCaller() {
        BatchBuffer buffer = new BatchBuffer(10, writer);
        buffer.enqueue(log("x"));
        writer.failWritesWith(new TraceWriteException("rejected", null));

        assertThrows(TraceWriteException.class, buffer::flush);
        assertEquals(0, buffer.pendingCount());

        writer.failWritesWith(null);
        buffer.enqueue(log("y"));
        assertEquals(1, buffer.flush());
        assertEquals(1, writer.allRecords().size());
    }

    @Test
    void rejectsNonPositiveBatchSize() {
        assertThrows(IllegalArgumentException.class, () -> new BatchBuffer(0, writer));
        assertThrows(IllegalArgumentException.class, () -> new BatchBuffer(-3, writer));
    }

    @Test
    void concurrentProducersLoseAndDuplicateNothing() throws Exception {
        int threads = 8;
        int perThread = 250;
        BatchBuffer buffer = new BatchBuffer(7, writer);
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        buffer.enqueue(log(thread + ":" + i));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> f : futures) {
                f.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }
        buffer.flush();

        List<TraceRecord> all = writer.allRecords();
        assertEquals(threads * perThread, all.size());
        Set<String> unique = new HashSet<>();
        for (TraceRecord r : all) {
            unique.add(((LogRecord) r).message());
        }
        assertEquals(threads * perThread, unique.size());
        for (List<TraceRecord> batch : writer.batches()) {
            assertTrue(batch.size() <= 7, "batch larger than batchSize: " + batch.size());
        }
    }

    @Test
    void perThreadOrderIsKeptWithinEachBatch() throws Exception {
        BatchBuffer buffer = new BatchBuffer(16, writer);
        Thread a = new Thread(() -> { for (int i = 0; i < 200; i++) buffer.enqueue(log("a:" + i)); });
        Thread b = new Thread(() -> { for (int i = 0; i < 200; i++) buffer.enqueue(log("b:" + i)); });
        a.start();
        b.start();
        a.join();
        b.join();
        buffer.flush();

        for (List<TraceRecord> batch : writer.batches()) {
            int lastA = -1;
            int lastB = -1;
            for (TraceRecord r : batch) {
                String[] parts = ((LogRecord) r).message().split(":");
                int n = Integer.parseInt(parts[1]);
                if (parts[0].equals("a")) {
                    assertTrue(n > lastA);
                    lastA = n;
                } else {
                    assertTrue(n > lastB);
                    lastB = n;
                }
            }
        }
    }
}
