package com.ryuqq.loadlifecycle.application.lifecycle;

import com.ryuqq.loadlifecycle.core.catalog.TransitionDefinition;

import java.util.List;

/**
 * 행위자에게 표시할 전이 후보.
 *
 * @param definition 전이 정의
 * @param canExecute 지금 실행 가능 여부
 * @param blockedReasons 실행할 수 없는 사유 (가드 메시지)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record AvailableTransition(
    TransitionDefinition definition,
    boolean canExecute,
    List<String> blockedReasons
) {

    public AvailableTransition {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        blockedReasons = blockedReasons == null ? List.of() : List.copyOf(blockedReasons);
    }
}
