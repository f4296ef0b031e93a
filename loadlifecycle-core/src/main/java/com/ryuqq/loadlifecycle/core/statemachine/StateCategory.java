package com.ryuqq.loadlifecycle.core.statemachine;

/**
 * Load 상태의 분류.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum StateCategory {
    CREATION,
    ASSIGNMENT,
    EXECUTION,
    COMPLETION,
    FINANCIAL,
    EXCEPTION
}
