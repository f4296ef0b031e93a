package com.ryuqq.loadlifecycle.core.catalog;

/**
 * 가드 유형.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum GuardKind {
    STATE,
    DATA,
    TIME,
    LOCATION,
    DOCUMENT,
    APPROVAL,
    HOURS_OF_SERVICE
}
