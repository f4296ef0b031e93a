package com.ryuqq.loadlifecycle.adapter.inmemory.external;

import com.ryuqq.loadlifecycle.core.spi.HoursOfServiceService;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link HoursOfServiceService}.
 *
 * <p>Drivers without an explicit entry get the default remaining time
 * (11 hours, the daily driving limit).</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryHoursOfServiceService implements HoursOfServiceService {

    private static final Duration DEFAULT_REMAINING = Duration.ofHours(11);

    private final ConcurrentHashMap<String, Duration> remaining = new ConcurrentHashMap<>();
    private final Duration defaultRemaining;

    public InMemoryHoursOfServiceService() {
        this(DEFAULT_REMAINING);
    }

    public InMemoryHoursOfServiceService(Duration defaultRemaining) {
        if (defaultRemaining == null || defaultRemaining.isNegative()) {
            throw new IllegalArgumentException("defaultRemaining cannot be null or negative");
        }
        this.defaultRemaining = defaultRemaining;
    }

    @Override
    public Duration remainingDriveTime(String driverId) {
        if (driverId == null) {
            return Duration.ZERO;
        }
        return remaining.getOrDefault(driverId, defaultRemaining);
    }

    public void setRemaining(String driverId, Duration driveTime) {
        if (driverId == null) {
            throw new IllegalArgumentException("driverId cannot be null");
        }
        if (driveTime == null || driveTime.isNegative()) {
            throw new IllegalArgumentException("driveTime cannot be null or negative");
        }
        remaining.put(driverId, driveTime);
    }
}
