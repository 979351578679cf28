package com.gateproof.receipt;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.LongSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * UTC time source that never goes backwards within one lifecycle instance. A wall clock that steps
 * back is clamped to the last issued instant.
 */
public class MonotonicTimeSource {
    private static final Logger log = LoggerFactory.getLogger(MonotonicTimeSource.class);

    private final Clock clock;
    private final LongSupplier nanoTime;
    private final Map<String, ReceiptTimestamp> lastIssued = new ConcurrentHashMap<>();

    public MonotonicTimeSource() {
        this(Clock.systemUTC(), System::nanoTime);
    }

    public MonotonicTimeSource(Clock clock, LongSupplier nanoTime) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.nanoTime = Objects.requireNonNull(nanoTime, "nanoTime");
    }

    public ReceiptTimestamp next(String lifecycleId) {
        return lastIssued.compute(lifecycleId, (id, previous) -> {
            Instant wall = clock.instant();
            long nanos = nanoTime.getAsLong();
            if (previous != null) {
                if (wall.isBefore(previous.wallClock())) {
                    log.warn("time.regression lifecycle={} clock={} last={}", id, wall, previous.wallClock());
                    wall = previous.wallClock();
                }
                nanos = Math.max(nanos, previous.monotonicNanos());
            }
            return new ReceiptTimestamp(wall, nanos);
        });
    }
}
