package org.longtrace.utils;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Random UUIDs plus a wall clock that is clamped so it never steps backwards.
 */
public class MonotonicIdSource implements IdSource {

    private final Clock clock;
    private final AtomicReference<Instant> lastIssued = new AtomicReference<>(Instant.MIN);

    public MonotonicIdSource() {
        this(Clock.systemUTC());
    }

    public MonotonicIdSource(Clock clock) {
        this.clock = clock;
    }

    @Override
    public UUID newTraceId() {
        return UUID.randomUUID();
    }

    @Override
    public UUID newSpanId() {
        return UUID.randomUUID();
    }

    @Override
    public Instant now() {
        Instant current = clock.instant();
        return lastIssued.updateAndGet(prev -> current.isAfter(prev) ? current : prev);
    }
}
