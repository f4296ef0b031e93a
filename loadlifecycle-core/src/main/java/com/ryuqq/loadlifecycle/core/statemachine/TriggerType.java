package com.ryuqq.loadlifecycle.core.statemachine;

/**
 * 전이를 유발하는 트리거 유형.
 *
 * <p>트리거 유형은 감사 기록에 남으며, 엔진의 검증 로직에는 영향을 주지 않습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum TriggerType {
    USER_ACTION,
    GEOFENCE,
    TIMER,
    ELD_EVENT,
    DOCUMENT,
    PAYMENT,
    APPROVAL,
    EXCEPTION,
    TIMEOUT,
    EXTERNAL,
    SYSTEM
}
