package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.LoadId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Message handed to an external system (mail, SMS, database job, document or integration).
 *
 * @param kind the effect kind that produced it
 * @param action the action id
 * @param loadId the load
 * @param transitionId the committing transition
 * @param recipients resolved recipient user IDs
 * @param payload effect payload
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record OutboundMessage(
    EffectKind kind,
    String action,
    LoadId loadId,
    String transitionId,
    List<String> recipients,
    Map<String, Object> payload
) {

    public OutboundMessage {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }
}
