package com.ryuqq.loadlifecycle.core.outcome;

import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;

/**
 * 커밋된 전이.
 *
 * @param loadId Load ID
 * @param transitionId 전이 ID
 * @param fromState 전이 전 상태
 * @param newState 전이 후 상태
 * @param guardsPassed 통과한 가드 식별자
 * @param effectsDispatched 전달한 효과 ("kind:action")
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Committed(
    LoadId loadId,
    String transitionId,
    LoadState fromState,
    LoadState newState,
    List<String> guardsPassed,
    List<String> effectsDispatched
) implements TransitionOutcome {

    public Committed {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (newState == null) {
            throw new IllegalArgumentException("newState cannot be null");
        }
        guardsPassed = guardsPassed == null ? List.of() : List.copyOf(guardsPassed);
        effectsDispatched = effectsDispatched == null ? List.of() : List.copyOf(effectsDispatched);
    }

    @Override
    public List<TransitionError> errors() {
        return List.of();
    }
}
