package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.NotificationPriority;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Notification addressed to a single user.
 *
 * @param type notification type (e.g. convoy_sync, convoy_hold, convoy_separation_alert)
 * @param title title
 * @param message body
 * @param priority priority
 * @param data related identifiers
 * @param timestamp emission time
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record UserNotification(
    String type,
    String title,
    String message,
    NotificationPriority priority,
    Map<String, Object> data,
    Instant timestamp
) {

    public UserNotification {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
