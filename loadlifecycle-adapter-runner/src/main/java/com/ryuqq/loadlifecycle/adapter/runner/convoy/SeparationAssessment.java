package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SeparationCheck;

import java.time.Instant;

/**
 * 이격 거리 평가 결과.
 *
 * @param check 판정
 * @param convoy 거리와 연속 경보 횟수를 반영한 Convoy (저장 전)
 * @param notificationDue 경보를 참여자에게 알려야 하는지 여부 (알림 간격 기준)
 * @param assessedAt 평가 시각
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SeparationAssessment(
    SeparationCheck check,
    Convoy convoy,
    boolean notificationDue,
    Instant assessedAt
) {
}
