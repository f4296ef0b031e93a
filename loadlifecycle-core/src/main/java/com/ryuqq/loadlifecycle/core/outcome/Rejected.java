package com.ryuqq.loadlifecycle.core.outcome;

import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;

/**
 * 거부된 전이.
 *
 * <p>Load는 변경되지 않으며, 호출자는 항상 구체적인 거부 사유를 받습니다.</p>
 *
 * @param loadId Load ID
 * @param transitionId 요청된 전이 ID
 * @param newState 변경되지 않은 현재 상태 (Load가 없으면 null)
 * @param error 거부 사유
 * @param guardsPassed 실패 이전까지 통과한 가드 식별자
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Rejected(
    LoadId loadId,
    String transitionId,
    LoadState newState,
    TransitionError error,
    List<String> guardsPassed
) implements TransitionOutcome {

    public Rejected {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        guardsPassed = guardsPassed == null ? List.of() : List.copyOf(guardsPassed);
    }

    @Override
    public List<TransitionError> errors() {
        return List.of(error);
    }

    public TransitionErrorCode code() {
        return error.code();
    }
}
