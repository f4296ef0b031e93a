package com.ryuqq.loadlifecycle.core.convoy;

import java.time.Duration;

/**
 * 동기화 지점 대기 제한.
 *
 * @param duration Convoy가 대기 상태에 머무를 수 있는 시간
 * @param escalation 초과 시 조치
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SyncTimeout(Duration duration, SyncEscalation escalation) {

    public SyncTimeout {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            throw new IllegalArgumentException("duration must be positive (current: " + duration + ")");
        }
        if (escalation == null) {
            throw new IllegalArgumentException("escalation cannot be null");
        }
    }

    public static SyncTimeout ofMinutes(long minutes, SyncEscalation escalation) {
        return new SyncTimeout(Duration.ofMinutes(minutes), escalation);
    }
}
