package com.ryuqq.loadlifecycle.application.convoy;

import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SeparationCheck;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoint;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;

import java.util.List;
import java.util.Optional;

/**
 * Convoy 동기화 API.
 *
 * <p>호송 측 상태 기계를 주 Load 상태와 맞춰 진행시킵니다. 같은 Convoy에 대한
 * 연산은 직렬화되며, 서로 다른 Convoy는 병렬로 처리됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface ConvoyCoordinator {

    /**
     * Convoy 편성 (EN_ROUTE_STAGING에서 시작).
     *
     * @param loadId 주 Load ID
     * @param leadUserId 선도 차량 사용자
     * @param rearUserId 후미 차량 사용자 (없으면 null)
     * @param loadUserId 주 Load 사용자
     * @return 생성된 Convoy
     * @throws IllegalStateException 해당 Load에 활성 Convoy가 이미 있는 경우
     */
    Convoy createConvoy(LoadId loadId, String leadUserId, String rearUserId, String loadUserId);

    /**
     * 호송 측 수동 전이.
     *
     * @param convoyId Convoy ID
     * @param target 목표 상태
     * @param actor 요청 행위자
     * @return 갱신된 Convoy
     * @throws IllegalArgumentException Convoy가 없는 경우
     * @throws IllegalStateException 허용되지 않은 역할, 전이 또는 비활성 Convoy인 경우
     */
    Convoy transitionEscort(ConvoyId convoyId, EscortState target, Actor actor);

    /**
     * 첫 번째로 일치하는 동기화 지점.
     *
     * <p>주 Load가 화물 예외 상태이거나 Convoy가 비활성이면 empty입니다.</p>
     *
     * @param convoyId Convoy ID
     * @param loadId 주 Load ID
     * @return 일치한 지점 (없으면 empty)
     */
    Optional<SyncPoint> checkSyncPoints(ConvoyId convoyId, LoadId loadId);

    /**
     * 동기화 지점 실행.
     *
     * @param convoyId Convoy ID
     * @param syncPoint 실행할 지점
     * @return 실행 결과
     */
    SyncResult executeSyncPoint(ConvoyId convoyId, SyncPoint syncPoint);

    /**
     * 간격 보고 반영 및 감시.
     *
     * @param convoyId Convoy ID
     * @param leadDistanceMeters 선도 간격 (없으면 null)
     * @param rearDistanceMeters 후미 간격 (없으면 null)
     * @return 판정 결과
     * @throws IllegalArgumentException Convoy가 없는 경우
     */
    SeparationCheck updateSeparation(ConvoyId convoyId, Double leadDistanceMeters, Double rearDistanceMeters);

    /**
     * Convoy 해산.
     *
     * @param convoyId Convoy ID
     * @param actor 요청 행위자
     * @return 해산된 Convoy
     */
    Convoy disband(ConvoyId convoyId, Actor actor);

    /**
     * 동기화 지점 대기 에스컬레이션 표시.
     *
     * <p>Convoy가 아직 해당 지점에서 대기 중이고 이번 대기 구간에서 표시된 적이 없을 때만
     * 기록합니다. 다른 Convoy 연산과 같은 잠금 아래에서 수행됩니다.</p>
     *
     * @param convoyId Convoy ID
     * @param syncPointId 대기 중인 동기화 지점 ID
     * @return 표시가 저장된 Convoy (이미 표시됐거나 더 이상 대기 중이 아니면 empty)
     */
    Optional<Convoy> markEscalated(ConvoyId convoyId, String syncPointId);

    Optional<Convoy> findConvoy(ConvoyId convoyId);

    List<TransitionAuditRecord> convoyHistory(ConvoyId convoyId);
}
