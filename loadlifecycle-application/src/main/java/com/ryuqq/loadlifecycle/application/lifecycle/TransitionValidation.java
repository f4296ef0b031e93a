package com.ryuqq.loadlifecycle.application.lifecycle;

import com.ryuqq.loadlifecycle.core.outcome.TransitionError;

import java.util.List;

/**
 * 사전 검증 결과.
 *
 * @param transitionId 검증한 전이 ID
 * @param valid 모든 검사 통과 여부
 * @param errors 막힌 사유 (통과하면 빈 목록)
 * @param guardsPassed 통과한 가드 식별자
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record TransitionValidation(
    String transitionId,
    boolean valid,
    List<TransitionError> errors,
    List<String> guardsPassed
) {

    public TransitionValidation {
        errors = errors == null ? List.of() : List.copyOf(errors);
        guardsPassed = guardsPassed == null ? List.of() : List.copyOf(guardsPassed);
        if (valid && !errors.isEmpty()) {
            throw new IllegalArgumentException("valid validation cannot carry errors");
        }
    }

    public List<String> blockedReasons() {
        return errors.stream().map(TransitionError::message).toList();
    }
}
