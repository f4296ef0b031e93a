package com.ryuqq.loadlifecycle.adapter.runner.engine;

/**
 * Transition Engine 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>guardTimeoutMs: 가드 하나의 최대 평가 시간 (기본 2000ms, 0이면 호출 스레드에서 제한 없이 평가)</li>
 *   <li>guardConcurrency: 가드 평가 스레드 수 (기본 4)</li>
 * </ul>
 *
 * <p>HOS, 승인처럼 외부 서비스를 부르는 가드가 전이를 무기한 붙잡지 않도록 제한합니다.
 * 시간 초과는 가드 실패로 처리됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 * @param guardTimeoutMs 가드 평가 제한 시간 (밀리초, 0 이상)
 * @param guardConcurrency 가드 평가 스레드 수 (1 이상)
 */
public record EngineConfig(
    long guardTimeoutMs,
    int guardConcurrency
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: guardTimeoutMs=2000ms, guardConcurrency=4</p>
     */
    public EngineConfig() {
        this(2000, 4);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EngineConfig {
        if (guardTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "guardTimeoutMs cannot be negative (current: " + guardTimeoutMs + ")"
            );
        }
        if (guardConcurrency <= 0) {
            throw new IllegalArgumentException(
                "guardConcurrency must be positive (current: " + guardConcurrency + ")"
            );
        }
    }

    /**
     * guardTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withGuardTimeoutMs(long guardTimeoutMs) {
        return new EngineConfig(guardTimeoutMs, guardConcurrency);
    }

    /**
     * guardConcurrency만 변경한 새 인스턴스 생성.
     */
    public EngineConfig withGuardConcurrency(int guardConcurrency) {
        return new EngineConfig(guardTimeoutMs, guardConcurrency);
    }

    /**
     * 가드를 별도 스레드에서 시간 제한을 두고 평가하는지 여부.
     *
     * @return guardTimeoutMs가 0보다 크면 true
     */
    public boolean isGuardTimeoutEnabled() {
        return guardTimeoutMs > 0;
    }
}
