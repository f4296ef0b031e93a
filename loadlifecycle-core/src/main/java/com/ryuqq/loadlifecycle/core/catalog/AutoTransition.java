package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.time.Duration;

/**
 * 상태별 자동 전이 선언.
 *
 * <p>Load가 이 상태에 {@code timeout} 이상 머물면 스케줄러가
 * {@code transitionId} 전이를 시스템 행위자로 시도합니다.</p>
 *
 * @param transitionId 시도할 전이 ID
 * @param target 자동 전이 목표 상태
 * @param timeout 상태 체류 허용 시간
 * @param condition 사람이 읽는 조건 설명
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record AutoTransition(
    String transitionId,
    LoadState target,
    Duration timeout,
    String condition
) {

    public AutoTransition {
        if (transitionId == null || transitionId.isBlank()) {
            throw new IllegalArgumentException("transitionId cannot be null or blank");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
    }
}
