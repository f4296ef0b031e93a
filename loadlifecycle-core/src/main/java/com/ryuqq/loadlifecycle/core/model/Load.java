package com.ryuqq.loadlifecycle.core.model;

import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Load 스냅샷 (불변).
 *
 * <p>저장소에서 읽은 한 시점의 Load 상태입니다. 상태 변경은 새 스냅샷을 만들어
 * {@link com.ryuqq.loadlifecycle.core.spi.LoadStore#commitTransition}으로 커밋합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>{@code state}는 항상 {@link LoadState}의 값</li>
 *   <li>{@code state} 변경은 Transition Engine만 수행하며, 항상 감사 기록을 남김</li>
 *   <li>{@code version}은 커밋마다 1씩 증가 (낙관적 동시성 제어)</li>
 * </ul>
 *
 * @param loadId Load ID
 * @param state 현재 상태
 * @param stateEnteredAt 현재 상태 진입 시각 (타임아웃 계산 기준)
 * @param version 저장 버전
 * @param previousState ON_HOLD 진입 직전 상태 (없으면 null)
 * @param participants 역할별 참여자 사용자 ID (SHIPPER, BROKER, CATALYST, DRIVER)
 * @param pickupLocation 상차지 좌표 (없으면 null)
 * @param deliveryLocation 하차지 좌표 (없으면 null)
 * @param rate 운임 (없으면 null)
 * @param pickupAt 상차 예정 시각 (없으면 null)
 * @param documents 기록된 문서 플래그
 * @param activeTimers 진행 중인 재무 타이머
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Load(
    LoadId loadId,
    LoadState state,
    Instant stateEnteredAt,
    long version,
    LoadState previousState,
    Map<ActorRole, String> participants,
    GeoPoint pickupLocation,
    GeoPoint deliveryLocation,
    BigDecimal rate,
    Instant pickupAt,
    Set<LoadDocument> documents,
    Set<FinancialTimer> activeTimers
) {

    public Load {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (stateEnteredAt == null) {
            throw new IllegalArgumentException("stateEnteredAt cannot be null");
        }
        if (version < 0) {
            throw new IllegalArgumentException("version cannot be negative (current: " + version + ")");
        }
        participants = participants == null || participants.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(participants));
        documents = documents == null || documents.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(documents));
        activeTimers = activeTimers == null || activeTimers.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(activeTimers));
    }

    /**
     * DRAFT 상태의 새 Load 생성.
     *
     * @param loadId Load ID
     * @param shipperId 화주 사용자 ID
     * @param createdAt 생성 시각
     * @return 버전 0의 DRAFT Load
     */
    public static Load draft(LoadId loadId, String shipperId, Instant createdAt) {
        Map<ActorRole, String> participants = new EnumMap<>(ActorRole.class);
        if (shipperId != null) {
            participants.put(ActorRole.SHIPPER, shipperId);
        }
        return new Load(loadId, LoadState.DRAFT, createdAt, 0, null, participants,
            null, null, null, null, Set.of(), Set.of());
    }

    /**
     * 역할별 참여자 조회.
     *
     * @param role 역할
     * @return 사용자 ID (없으면 empty)
     */
    public Optional<String> participant(ActorRole role) {
        return Optional.ofNullable(participants.get(role));
    }

    public boolean hasDocument(LoadDocument document) {
        return documents.contains(document);
    }

    public boolean isTimerActive(FinancialTimer timer) {
        return activeTimers.contains(timer);
    }

    /**
     * 상태만 변경한 새 스냅샷 (버전은 저장소가 증가시킴).
     */
    public Load withState(LoadState state, Instant enteredAt) {
        return new Load(loadId, state, enteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withVersion(long version) {
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withPreviousState(LoadState previousState) {
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withParticipant(ActorRole role, String userId) {
        Map<ActorRole, String> updated = new EnumMap<>(ActorRole.class);
        updated.putAll(participants);
        updated.put(role, userId);
        return new Load(loadId, state, stateEnteredAt, version, previousState, updated,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withRoute(GeoPoint pickupLocation, GeoPoint deliveryLocation) {
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withRate(BigDecimal rate) {
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withPickupAt(Instant pickupAt) {
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, activeTimers);
    }

    public Load withDocuments(Set<LoadDocument> added) {
        EnumSet<LoadDocument> updated = EnumSet.noneOf(LoadDocument.class);
        updated.addAll(documents);
        updated.addAll(added);
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, updated, activeTimers);
    }

    public Load withTimer(FinancialTimer timer, boolean active) {
        EnumSet<FinancialTimer> updated = EnumSet.noneOf(FinancialTimer.class);
        updated.addAll(activeTimers);
        if (active) {
            updated.add(timer);
        } else {
            updated.remove(timer);
        }
        return new Load(loadId, state, stateEnteredAt, version, previousState, participants,
            pickupLocation, deliveryLocation, rate, pickupAt, documents, updated);
    }
}
