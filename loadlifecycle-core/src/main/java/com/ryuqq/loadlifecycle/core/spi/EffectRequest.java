package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.catalog.Effect;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadId;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * One effect to deliver, with enough context to log or replay it.
 *
 * @param effect the declared effect
 * @param loadId the load the effect belongs to
 * @param transitionId the committing transition (or sync point id for convoy effects)
 * @param participants load participants by role at commit time
 * @param occurredAt commit time
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record EffectRequest(
    Effect effect,
    LoadId loadId,
    String transitionId,
    Map<ActorRole, String> participants,
    Instant occurredAt
) {

    public EffectRequest {
        if (effect == null) {
            throw new IllegalArgumentException("effect cannot be null");
        }
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (transitionId == null || transitionId.isBlank()) {
            throw new IllegalArgumentException("transitionId cannot be null or blank");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
        participants = participants == null || participants.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(participants));
    }

    @Override
    public String toString() {
        return "EffectRequest{" + effect.label() + ", loadId=" + loadId.getValue()
            + ", transitionId=" + transitionId + '}';
    }
}
