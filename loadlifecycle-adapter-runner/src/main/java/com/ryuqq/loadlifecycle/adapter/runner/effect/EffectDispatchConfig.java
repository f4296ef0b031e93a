package com.ryuqq.loadlifecycle.adapter.runner.effect;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Effect Dispatcher 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>concurrency: 효과 실행 스레드 수 (기본 4)</li>
 *   <li>maxAttempts: 효과 하나의 최대 시도 횟수 (기본 3, 첫 시도 포함)</li>
 *   <li>deadLettersEnabled: 재시도 소진 시 Dead Letter 기록 여부 (기본 true)</li>
 *   <li>baseDelayMs / maxDelayMs / jitterFactor: 재시도 지연 파라미터
 *       (기본 1000ms / 300000ms / 0.1, {@link #retryDelayMs(int)} 참고)</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 * @param concurrency 실행 스레드 수 (1 이상)
 * @param maxAttempts 최대 시도 횟수 (1 이상)
 * @param deadLettersEnabled Dead Letter 기록 여부
 * @param baseDelayMs 재시도 기본 지연 (밀리초, 양수)
 * @param maxDelayMs 재시도 최대 지연 (밀리초, baseDelayMs 이상)
 * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
 */
public record EffectDispatchConfig(
    int concurrency,
    int maxAttempts,
    boolean deadLettersEnabled,
    long baseDelayMs,
    long maxDelayMs,
    double jitterFactor
) {

    /**
     * 기본 설정 생성자.
     */
    public EffectDispatchConfig() {
        this(4, 3, true, 1000, 300000, 0.1);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public EffectDispatchConfig {
        if (concurrency <= 0) {
            throw new IllegalArgumentException(
                "concurrency must be positive (current: " + concurrency + ")"
            );
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (baseDelayMs <= 0) {
            throw new IllegalArgumentException(
                "baseDelayMs must be positive (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
    }

    /**
     * concurrency만 변경한 새 인스턴스 생성.
     */
    public EffectDispatchConfig withConcurrency(int concurrency) {
        return new EffectDispatchConfig(concurrency, maxAttempts, deadLettersEnabled, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * maxAttempts만 변경한 새 인스턴스 생성.
     */
    public EffectDispatchConfig withMaxAttempts(int maxAttempts) {
        return new EffectDispatchConfig(concurrency, maxAttempts, deadLettersEnabled, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * deadLettersEnabled만 변경한 새 인스턴스 생성.
     */
    public EffectDispatchConfig withDeadLettersEnabled(boolean deadLettersEnabled) {
        return new EffectDispatchConfig(concurrency, maxAttempts, deadLettersEnabled, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 재시도 지연 파라미터만 변경한 새 인스턴스 생성.
     */
    public EffectDispatchConfig withBackoff(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        return new EffectDispatchConfig(concurrency, maxAttempts, deadLettersEnabled, baseDelayMs, maxDelayMs, jitterFactor);
    }

    /**
     * 실패한 시도 다음의 재시도 지연.
     *
     * <pre>
     * delay = min(baseDelay * 2^(failedAttempt-1) + jitter, maxDelay)
     * jitter = random(0, exponential * jitterFactor)
     * </pre>
     *
     * @param failedAttempt 실패한 시도 번호 (1부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException failedAttempt가 양수가 아닌 경우
     */
    public long retryDelayMs(int failedAttempt) {
        if (failedAttempt <= 0) {
            throw new IllegalArgumentException(
                "failedAttempt must be positive (current: " + failedAttempt + ")"
            );
        }
        int shift = Math.min(failedAttempt - 1, 62);
        long exponential = baseDelayMs > (maxDelayMs >> shift) ? maxDelayMs : baseDelayMs << shift;
        long jitter = (long) (exponential * jitterFactor * ThreadLocalRandom.current().nextDouble());
        return Math.min(exponential + jitter, maxDelayMs);
    }
}
