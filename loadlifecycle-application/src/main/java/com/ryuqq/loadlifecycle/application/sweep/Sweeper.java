package com.ryuqq.loadlifecycle.application.sweep;

/**
 * 주기 실행 스윕 작업.
 *
 * <p>영속된 타임스탬프를 기준으로 판정하므로 스케줄러가 늦게 실행되거나 재시작되어도
 * 조건을 만족한 대상은 다음 스윕에서 처리됩니다 (at-least-once).</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sweeper {

    /**
     * 스윕 1회 실행.
     *
     * <p>개별 항목 실패는 내부에서 기록하고 계속 진행합니다.</p>
     *
     * @return 실행 결과
     */
    SweepReport sweep();
}
