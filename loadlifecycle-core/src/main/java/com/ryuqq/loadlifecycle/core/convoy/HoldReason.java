package com.ryuqq.loadlifecycle.core.convoy;

/**
 * Convoy가 ESCORT_HOLD에 들어간 사유.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum HoldReason {

    /** 주 Load가 화물 예외 상태에 진입 (예외 해소 시 자동 복귀) */
    CARGO_EXCEPTION,

    /** 연속 간격 경보로 자동 정지 (수동 해제) */
    SEPARATION,

    /** 행위자가 직접 정지 */
    MANUAL
}
