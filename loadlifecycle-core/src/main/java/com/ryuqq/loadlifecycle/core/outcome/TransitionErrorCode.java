package com.ryuqq.loadlifecycle.core.outcome;

/**
 * 전이 거부 사유 코드.
 *
 * <ul>
 *   <li>{@link #INVALID_TRANSITION}: 현재 상태에서 출발하지 않는 전이 (또는 알 수 없는 전이 ID)</li>
 *   <li>{@link #UNAUTHORIZED_ACTOR}: 허용되지 않은 역할</li>
 *   <li>{@link #GUARD_FAILED}: 선언 순서상 첫 번째로 실패한 가드</li>
 *   <li>{@link #CONCURRENT_MODIFICATION}: 읽기와 커밋 사이에 Load가 변경됨 (호출자가 재시도)</li>
 *   <li>{@link #LOAD_NOT_FOUND}: 존재하지 않는 Load</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum TransitionErrorCode {
    INVALID_TRANSITION,
    UNAUTHORIZED_ACTOR,
    GUARD_FAILED,
    CONCURRENT_MODIFICATION,
    LOAD_NOT_FOUND;

    /**
     * 호출자가 새로 읽은 상태로 재시도하면 성공할 수 있는 오류인지 여부.
     *
     * @return CONCURRENT_MODIFICATION이면 true
     */
    public boolean isRetryable() {
        return this == CONCURRENT_MODIFICATION;
    }
}
