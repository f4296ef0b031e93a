package com.ryuqq.loadlifecycle.core.convoy;

import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 표준 동기화 지점 목록 (평가 순서 고정).
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class SyncPoints {

    public static final SyncPoint SYNC_CONFIRMED = new SyncPoint(
        "SYNC_CONFIRMED",
        "Both Confirmed",
        Set.of(LoadState.CONFIRMED),
        Set.of(EscortState.STAGING_COMPLETE),
        EscortState.AWAITING_PRIMARY,
        List.of("convoy_ready_to_depart"),
        List.of("activate_convoy_tracking"),
        SyncTimeout.ofMinutes(60, SyncEscalation.NOTIFY_DISPATCH)
    );

    public static final SyncPoint SYNC_READY_TO_ROLL = new SyncPoint(
        "SYNC_READY_TO_ROLL",
        "Ready to Roll",
        Set.of(LoadState.LOADED),
        Set.of(EscortState.AWAITING_PRIMARY),
        EscortState.CONVOY_FORMING,
        List.of("convoy_departing"),
        List.of("start_convoy_gps"),
        null
    );

    public static final SyncPoint SYNC_CONVOY_FORMED = new SyncPoint(
        "SYNC_CONVOY_FORMED",
        "Convoy Formed",
        Set.of(LoadState.IN_TRANSIT),
        Set.of(EscortState.CONVOY_FORMING),
        EscortState.ESCORTING,
        List.of("convoy_formed_all_positions"),
        List.of("activate_separation_monitoring"),
        SyncTimeout.ofMinutes(15, SyncEscalation.SEPARATION_CHECK)
    );

    public static final SyncPoint SYNC_AT_DELIVERY = new SyncPoint(
        "SYNC_AT_DELIVERY",
        "Convoy Arrived",
        Set.of(LoadState.AT_DELIVERY),
        Set.of(EscortState.ESCORTING),
        EscortState.DELIVERY_STANDBY,
        List.of("convoy_arrived_at_delivery"),
        List.of("stop_separation_monitoring"),
        null
    );

    public static final SyncPoint SYNC_COMPLETE = new SyncPoint(
        "SYNC_COMPLETE",
        "All Complete",
        Set.of(LoadState.DELIVERED, LoadState.INVOICED, LoadState.PAID, LoadState.COMPLETE),
        Set.of(EscortState.DELIVERY_STANDBY),
        EscortState.ESCORT_COMPLETE,
        List.of("escort_mission_complete"),
        List.of("deactivate_convoy_tracking", "generate_escort_report"),
        null
    );

    private static final List<SyncPoint> ORDERED = List.of(
        SYNC_CONFIRMED,
        SYNC_READY_TO_ROLL,
        SYNC_CONVOY_FORMED,
        SYNC_AT_DELIVERY,
        SYNC_COMPLETE
    );

    private SyncPoints() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static List<SyncPoint> ordered() {
        return ORDERED;
    }

    /**
     * 첫 번째로 일치하는 동기화 지점.
     *
     * @param primary 주 Load 상태
     * @param escort Convoy 상태
     * @return 일치한 지점 (없으면 empty)
     */
    public static Optional<SyncPoint> firstMatch(LoadState primary, EscortState escort) {
        for (SyncPoint point : ORDERED) {
            if (point.matches(primary, escort)) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    /**
     * 주어진 Convoy 상태에서 대기 중인 동기화 지점.
     *
     * <p>타임아웃 스위퍼가 대기 시간을 판정할 때 사용합니다.</p>
     *
     * @param escort Convoy 상태
     * @return 해당 상태를 조건으로 가지는 지점 (없으면 empty)
     */
    public static Optional<SyncPoint> awaitingIn(EscortState escort) {
        for (SyncPoint point : ORDERED) {
            if (point.escortStates().contains(escort)) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }

    public static Optional<SyncPoint> byId(String id) {
        for (SyncPoint point : ORDERED) {
            if (point.id().equals(id)) {
                return Optional.of(point);
            }
        }
        return Optional.empty();
    }
}
