package org.longtrace.utils;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;

class MonotonicIdSourceTest {

    /** Returns the queued instants in order, then repeats the last one. */
    static class ScriptedClock extends Clock {
        private final Deque<Instant> script;
        private Instant last;

        ScriptedClock(Instant... instants) {
            this.script = new ArrayDeque<>(java.util.List.of(instants));
        }

        @Override public ZoneId getZone() { return ZoneOffset.UTC; }
        @Override public Clock withZone(ZoneId zone) { return this; }

        @Override
        public Instant instant() {
            if (!script.isEmpty()) last = script.poll();
            return last;
        }
    }

    @Test
    void timeNeverGoesBackwards() {
        Instant t0 = Instant.parse("2024-01-01T00:00:10Z");
        Instant earlier = Instant.parse("2024-01-01T00:00:05Z");
        Instant t1 = Instant.parse("2024-01-01T00:00:11Z");
        MonotonicIdSource ids = new MonotonicIdSource(new ScriptedClock(t0, earlier, t1));

        assertEquals(t0, ids.now());
        assertEquals(t0, ids.now());
        assertEquals(t1, ids.now());
    }

    @Test
    void identifiersAreUnique() {
        MonotonicIdSource ids = new MonotonicIdSource();
        Set<UUID> seen = new HashSet<>();
        for (int i = 0; i < 1000; i++) {
            seen.add(ids.newSpanId());
            seen.add(ids.newTraceId());
        }
        assertEquals(2000, seen.size());
    }
}
