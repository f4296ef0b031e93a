package com.ryuqq.loadlifecycle.application.lifecycle;

import com.ryuqq.loadlifecycle.core.catalog.StateMetadata;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.TransitionOutcome;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;

/**
 * Load 생명주기 전이 API.
 *
 * <p>UI/API 계층이 호출하는 진입점입니다. 모든 상태 변경은 {@link #attemptTransition}을
 * 거치며, 시도마다 감사 기록이 남습니다 (Load가 존재하지 않는 경우 제외).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * TransitionContext context = TransitionContext.builder()
 *     .location(GeoPoint.of(29.7604, -95.3698))
 *     .build();
 * TransitionOutcome outcome = lifecycle.attemptTransition(
 *     loadId, "EN_ROUTE_TO_AT_PICKUP", Actor.of("driver-7", ActorRole.DRIVER), context);
 *
 * if (!outcome.isSuccess()) {
 *     // 실패한 첫 가드의 메시지를 그대로 사용자에게 표시
 *     String message = outcome.errors().get(0).message();
 * }
 * </pre>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface LoadLifecycle {

    /**
     * 전이 시도.
     *
     * <p><strong>처리 순서:</strong></p>
     * <ol>
     *   <li>Load 조회 (없으면 LOAD_NOT_FOUND)</li>
     *   <li>전이 정의 해석 (현재 상태가 from에 없으면 INVALID_TRANSITION)</li>
     *   <li>역할 검사 (UNAUTHORIZED_ACTOR)</li>
     *   <li>가드를 선언 순서대로 평가, 첫 실패에서 중단 (GUARD_FAILED)</li>
     *   <li>버전 비교 후 커밋 + 성공 감사 기록 (충돌 시 CONCURRENT_MODIFICATION)</li>
     *   <li>커밋 후 효과 전달 및 상태 변경 리스너 통지</li>
     * </ol>
     *
     * @param loadId Load ID
     * @param transitionId 전이 ID
     * @param actor 요청 행위자
     * @param context 요청 컨텍스트
     * @return Committed 또는 Rejected
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    TransitionOutcome attemptTransition(LoadId loadId, String transitionId, Actor actor, TransitionContext context);

    /**
     * 현재 상태에서 행위자가 볼 수 있는 전이 목록.
     *
     * <p>역할이 허용된 전이만 표시 우선순위 순서로 반환하며, 각 항목에는
     * 지금 실행 가능한지와 막힌 사유가 포함됩니다. Load가 없으면 빈 목록입니다.</p>
     *
     * @param loadId Load ID
     * @param actor 조회 행위자
     * @param context 가드 평가에 사용할 컨텍스트
     * @return 사용 가능한 전이 목록
     */
    List<AvailableTransition> listAvailableTransitions(LoadId loadId, Actor actor, TransitionContext context);

    /**
     * 역할 기준 전이 목록 (빈 컨텍스트로 가드 평가).
     *
     * @param loadId Load ID
     * @param role 조회 역할
     * @return 사용 가능한 전이 목록
     */
    default List<AvailableTransition> listAvailableTransitions(LoadId loadId, ActorRole role) {
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        return listAvailableTransitions(loadId, Actor.of(role.name().toLowerCase(), role), TransitionContext.empty());
    }

    /**
     * 상태 메타데이터 조회.
     *
     * @param state 상태
     * @return 메타데이터
     */
    StateMetadata getStateMetadata(LoadState state);

    /**
     * 전이 이력 (기록 순서).
     *
     * @param loadId Load ID
     * @return 감사 기록 목록 (없으면 빈 목록)
     */
    List<TransitionAuditRecord> getStateHistory(LoadId loadId);

    /**
     * 커밋 없는 사전 검증.
     *
     * <p>attemptTransition과 같은 검사를 수행하되 상태를 바꾸지 않고 감사 기록도 남기지 않습니다.
     * 가드는 단락 평가 없이 모두 평가하여 막힌 사유를 전부 반환합니다.</p>
     *
     * @param loadId Load ID
     * @param transitionId 전이 ID
     * @param actor 요청 행위자
     * @param context 요청 컨텍스트
     * @return 검증 결과
     */
    TransitionValidation validateTransition(LoadId loadId, String transitionId, Actor actor, TransitionContext context);
}
