package com.witty.infrastructure.provenance;

import java.time.Clock;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Time source for one request. Reproducible requests use a logical clock that starts at the epoch
 * and advances one millisecond per reading, so timestamps and durations repeat across runs.
 */
public interface RequestClock {

    Instant now();

    default long millisSince(Instant start) {
        return Math.max(0L, now().toEpochMilli() - start.toEpochMilli());
    }

    static RequestClock system() {
        Clock clock = Clock.systemUTC();
        return clock::instant;
    }

    static RequestClock logical() {
        AtomicLong ticks = new AtomicLong();
        return () -> Instant.ofEpochMilli(ticks.getAndIncrement());
    }

    static RequestClock forMode(boolean reproducible) {
        return reproducible ? logical() : system();
    }
}
