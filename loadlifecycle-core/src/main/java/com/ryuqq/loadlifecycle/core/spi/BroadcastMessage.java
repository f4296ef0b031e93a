package com.ryuqq.loadlifecycle.core.spi;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Channel broadcast payload.
 *
 * @param event event type (e.g. load_state_changed, convoy_alert)
 * @param data event data
 * @param timestamp emission time
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record BroadcastMessage(String event, Map<String, Object> data, Instant timestamp) {

    public static final String LOAD_STATE_CHANGED = "load_state_changed";
    public static final String CONVOY_ALERT = "convoy_alert";
    public static final String CONVOY_UPDATE = "convoy_update";
    public static final String DISPATCH_ESCALATION = "dispatch_escalation";

    public BroadcastMessage {
        if (event == null || event.isBlank()) {
            throw new IllegalArgumentException("event cannot be null or blank");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
