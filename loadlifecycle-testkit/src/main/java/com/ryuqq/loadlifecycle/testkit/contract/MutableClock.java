package com.ryuqq.loadlifecycle.testkit.contract;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Clock that only moves when a test moves it.
 *
 * <p>Shared by the engine, sweepers and effect handlers so that timeout scenarios
 * can jump hours ahead without sleeping. Thread-safe: effect workers read it concurrently.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> current;
    private final ZoneId zone;

    public MutableClock(Instant start) {
        this(start, ZoneOffset.UTC);
    }

    private MutableClock(Instant start, ZoneId zone) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        this.current = new AtomicReference<>(start);
        this.zone = zone;
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (must not be negative)
     * @return the new current instant
     */
    public Instant advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration cannot be null or negative");
        }
        return current.updateAndGet(instant -> instant.plus(duration));
    }

    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        current.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        return new MutableClock(current.get(), zone);
    }

    @Override
    public Instant instant() {
        return current.get();
    }
}
