package com.ryuqq.loadlifecycle.core.outcome;

import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;

/**
 * 전이 시도 결과.
 *
 * <p>TransitionOutcome은 두 가지 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Committed}: 상태가 커밋되고 효과가 전달됨</li>
 *   <li>{@link Rejected}: 검증/가드/동시성 사유로 거부됨 (Load 변경 없음)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public sealed interface TransitionOutcome permits Committed, Rejected {

    LoadId loadId();

    /**
     * 시도 이후의 Load 상태.
     *
     * <p>Committed이면 새 상태, Rejected이면 변경되지 않은 현재 상태입니다
     * (Load가 없으면 null).</p>
     *
     * @return 시도 이후 상태
     */
    LoadState newState();

    /**
     * 전이 오류 목록.
     *
     * @return Committed이면 빈 목록, Rejected이면 단일 오류
     */
    List<TransitionError> errors();

    default boolean isSuccess() {
        return this instanceof Committed;
    }
}
