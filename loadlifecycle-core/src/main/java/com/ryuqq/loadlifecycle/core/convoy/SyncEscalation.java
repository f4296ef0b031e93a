package com.ryuqq.loadlifecycle.core.convoy;

/**
 * 동기화 지점 대기 시간 초과 시 수행할 조치.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum SyncEscalation {

    /** 배차 채널로 지연 알림 */
    NOTIFY_DISPATCH,

    /** 간격 감시를 즉시 재실행 */
    SEPARATION_CHECK
}
