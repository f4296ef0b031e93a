package com.ryuqq.loadlifecycle.core.convoy;

import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Convoy 스냅샷 (불변).
 *
 * <p>하나의 Load에 연결된 호송 편성 단위입니다. 주 Load와 병렬로
 * {@link EscortState} 상태 기계를 따르며, 동기화 지점에서 Load 상태와 맞춰집니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>ESCORT_HOLD 상태일 때만 {@code holdReason}과 {@code statusBeforeHold}가 설정됨</li>
 *   <li>{@code escalatedSyncPoints}는 현재 상태 진입 이후 이미 에스컬레이션된 지점만 보관</li>
 *   <li>{@code version}은 저장마다 1씩 증가</li>
 * </ul>
 *
 * @param convoyId Convoy ID
 * @param loadId 주 Load ID
 * @param status 현재 호송 상태
 * @param leadUserId 선도 호송 차량 사용자 ID
 * @param rearUserId 후미 호송 차량 사용자 ID (없으면 null)
 * @param loadUserId 주 Load 운전자/소유자 사용자 ID
 * @param leadDistanceMeters 마지막으로 보고된 선도 간격 (없으면 null)
 * @param rearDistanceMeters 마지막으로 보고된 후미 간격 (없으면 null)
 * @param consecutiveSeparationAlerts 연속 간격 경보 횟수
 * @param lastSeparationAlertAt 마지막 간격 경보 알림 시각 (없으면 null)
 * @param holdReason 정지 사유 (ESCORT_HOLD가 아니면 null)
 * @param statusBeforeHold 정지 직전 상태 (ESCORT_HOLD가 아니면 null)
 * @param escalatedSyncPoints 현재 상태에서 에스컬레이션된 동기화 지점 ID
 * @param statusEnteredAt 현재 상태 진입 시각
 * @param version 저장 버전
 * @param disbanded 해산 여부
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Convoy(
    ConvoyId convoyId,
    LoadId loadId,
    EscortState status,
    String leadUserId,
    String rearUserId,
    String loadUserId,
    Double leadDistanceMeters,
    Double rearDistanceMeters,
    int consecutiveSeparationAlerts,
    Instant lastSeparationAlertAt,
    HoldReason holdReason,
    EscortState statusBeforeHold,
    Set<String> escalatedSyncPoints,
    Instant statusEnteredAt,
    long version,
    boolean disbanded
) {

    public Convoy {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (leadUserId == null || leadUserId.isBlank()) {
            throw new IllegalArgumentException("leadUserId cannot be null or blank");
        }
        if (loadUserId == null || loadUserId.isBlank()) {
            throw new IllegalArgumentException("loadUserId cannot be null or blank");
        }
        if (statusEnteredAt == null) {
            throw new IllegalArgumentException("statusEnteredAt cannot be null");
        }
        if (consecutiveSeparationAlerts < 0) {
            throw new IllegalArgumentException(
                "consecutiveSeparationAlerts cannot be negative (current: " + consecutiveSeparationAlerts + ")"
            );
        }
        escalatedSyncPoints = escalatedSyncPoints == null ? Set.of() : Set.copyOf(escalatedSyncPoints);
    }

    /**
     * EN_ROUTE_STAGING 상태의 새 Convoy 생성.
     *
     * @param convoyId Convoy ID
     * @param loadId 주 Load ID
     * @param leadUserId 선도 차량 사용자 ID
     * @param rearUserId 후미 차량 사용자 ID (선택)
     * @param loadUserId 주 Load 사용자 ID
     * @param createdAt 생성 시각
     * @return 버전 0의 Convoy
     */
    public static Convoy form(
        ConvoyId convoyId,
        LoadId loadId,
        String leadUserId,
        String rearUserId,
        String loadUserId,
        Instant createdAt
    ) {
        return new Convoy(convoyId, loadId, EscortState.EN_ROUTE_STAGING, leadUserId, rearUserId, loadUserId,
            null, null, 0, null, null, null, Set.of(), createdAt, 0, false);
    }

    /**
     * 동기화 진행 가능 여부.
     *
     * @return 해산되지 않았고 종료 상태가 아니면 true
     */
    public boolean isActive() {
        return !disbanded && !status.isTerminal();
    }

    public boolean isOnHold() {
        return status == EscortState.ESCORT_HOLD;
    }

    public Optional<String> rearUser() {
        return Optional.ofNullable(rearUserId);
    }

    /**
     * 알림 대상 참여자 (선도, 후미, 주 Load 순).
     *
     * @return 참여자 사용자 ID 목록
     */
    public List<String> participants() {
        return rearUserId == null
            ? List.of(leadUserId, loadUserId)
            : List.of(leadUserId, rearUserId, loadUserId);
    }

    /**
     * 상태 변경 (정지 정보와 에스컬레이션 기록 초기화).
     */
    public Convoy withStatus(EscortState status, Instant enteredAt) {
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            null, null, Set.of(), enteredAt, version, disbanded);
    }

    /**
     * ESCORT_HOLD 진입.
     *
     * <p>이미 정지 상태이면 최초 정지 직전 상태를 유지합니다.</p>
     */
    public Convoy withHold(HoldReason reason, Instant enteredAt) {
        EscortState before = isOnHold() ? statusBeforeHold : status;
        return new Convoy(convoyId, loadId, EscortState.ESCORT_HOLD, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            reason, before, Set.of(), isOnHold() ? statusEnteredAt : enteredAt, version, disbanded);
    }

    public Convoy withDistances(Double leadDistanceMeters, Double rearDistanceMeters) {
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            holdReason, statusBeforeHold, escalatedSyncPoints, statusEnteredAt, version, disbanded);
    }

    public Convoy withSeparationAlerts(int consecutiveSeparationAlerts, Instant lastSeparationAlertAt) {
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            holdReason, statusBeforeHold, escalatedSyncPoints, statusEnteredAt, version, disbanded);
    }

    public Convoy withEscalated(String syncPointId) {
        Set<String> updated = new HashSet<>(escalatedSyncPoints);
        updated.add(syncPointId);
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            holdReason, statusBeforeHold, updated, statusEnteredAt, version, disbanded);
    }

    public Convoy withVersion(long version) {
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            holdReason, statusBeforeHold, escalatedSyncPoints, statusEnteredAt, version, disbanded);
    }

    public Convoy disband() {
        return new Convoy(convoyId, loadId, status, leadUserId, rearUserId, loadUserId,
            leadDistanceMeters, rearDistanceMeters, consecutiveSeparationAlerts, lastSeparationAlertAt,
            holdReason, statusBeforeHold, escalatedSyncPoints, statusEnteredAt, version, true);
    }
}
