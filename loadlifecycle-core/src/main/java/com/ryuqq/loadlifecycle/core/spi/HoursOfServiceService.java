package com.ryuqq.loadlifecycle.core.spi;

import java.time.Duration;

/**
 * Hours-of-service lookup (ELD provider boundary).
 *
 * <p>Calls may be remote and slow; the engine bounds them with its guard timeout.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface HoursOfServiceService {

    /**
     * Remaining legal driving time for a driver.
     *
     * @param driverId the driver user ID
     * @return remaining drive time ({@link Duration#ZERO} if none or unknown driver)
     */
    Duration remainingDriveTime(String driverId);
}
