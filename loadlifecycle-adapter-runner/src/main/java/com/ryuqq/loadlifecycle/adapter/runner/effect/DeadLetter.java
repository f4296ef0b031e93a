package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.spi.EffectRequest;

import java.time.Instant;

/**
 * 재시도를 모두 소진한 효과.
 *
 * @param request 원본 요청
 * @param attempts 수행한 시도 횟수
 * @param errorMessage 마지막 실패 사유
 * @param failedAt 포기 시각
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record DeadLetter(
    EffectRequest request,
    int attempts,
    String errorMessage,
    Instant failedAt
) {

    public DeadLetter {
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (failedAt == null) {
            throw new IllegalArgumentException("failedAt cannot be null");
        }
    }
}
