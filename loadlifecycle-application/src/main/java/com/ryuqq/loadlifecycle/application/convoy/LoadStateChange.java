package com.ryuqq.loadlifecycle.application.convoy;

import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.time.Instant;

/**
 * 커밋된 Load 상태 변경.
 *
 * @param loadId Load ID
 * @param fromState 이전 상태
 * @param toState 새 상태
 * @param transitionId 커밋된 전이 ID
 * @param occurredAt 커밋 시각
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record LoadStateChange(
    LoadId loadId,
    LoadState fromState,
    LoadState toState,
    String transitionId,
    Instant occurredAt
) {

    public LoadStateChange {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (toState == null) {
            throw new IllegalArgumentException("toState cannot be null");
        }
        if (occurredAt == null) {
            throw new IllegalArgumentException("occurredAt cannot be null");
        }
    }
}
