package com.ryuqq.loadlifecycle.core.convoy;

import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 동기화 지점 정의.
 *
 * <p>주 Load 상태가 {@code primaryStates}에 있고 Convoy 상태가 {@code escortStates}에 있으면
 * 일치한 것으로 보고, Convoy를 {@code escortTransition}으로 이동시킨 뒤
 * 알림과 효과를 전달합니다.</p>
 *
 * @param id 동기화 지점 ID (예: SYNC_AT_DELIVERY)
 * @param name 표시 이름
 * @param primaryStates 주 Load 상태 조건
 * @param escortStates Convoy 상태 조건
 * @param escortTransition 일치 시 Convoy 목표 상태
 * @param notifications 참여자에게 보낼 알림 키 (선언 순서)
 * @param effects 전달할 효과 키 (선언 순서)
 * @param timeout 대기 제한 (없으면 null)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SyncPoint(
    String id,
    String name,
    Set<LoadState> primaryStates,
    Set<EscortState> escortStates,
    EscortState escortTransition,
    List<String> notifications,
    List<String> effects,
    SyncTimeout timeout
) {

    public SyncPoint {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (primaryStates == null || primaryStates.isEmpty()) {
            throw new IllegalArgumentException("primaryStates cannot be null or empty (syncPoint: " + id + ")");
        }
        if (escortStates == null || escortStates.isEmpty()) {
            throw new IllegalArgumentException("escortStates cannot be null or empty (syncPoint: " + id + ")");
        }
        if (escortTransition == null) {
            throw new IllegalArgumentException("escortTransition cannot be null (syncPoint: " + id + ")");
        }
        primaryStates = Set.copyOf(primaryStates);
        escortStates = Set.copyOf(escortStates);
        notifications = notifications == null ? List.of() : List.copyOf(notifications);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    /**
     * 상태 쌍 일치 여부.
     *
     * @param primary 주 Load 현재 상태
     * @param escort Convoy 현재 상태
     * @return 두 조건을 모두 만족하면 true
     */
    public boolean matches(LoadState primary, EscortState escort) {
        return primaryStates.contains(primary) && escortStates.contains(escort);
    }

    public Optional<SyncTimeout> findTimeout() {
        return Optional.ofNullable(timeout);
    }
}
