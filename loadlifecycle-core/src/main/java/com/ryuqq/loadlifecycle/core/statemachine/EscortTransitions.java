package com.ryuqq.loadlifecycle.core.statemachine;

/**
 * 호송 상태 전이 검증.
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>집결 단계: EN_ROUTE_STAGING → AT_STAGING → EQUIPMENT_CHECK → STAGING_COMPLETE</li>
 *   <li>STAGING_COMPLETE → AWAITING_PRIMARY → CONVOY_FORMING → ESCORTING</li>
 *   <li>ESCORTING → 사건 상태, ESCORT_HOLD, DELIVERY_STANDBY</li>
 *   <li>사건 상태 → ESCORTING 또는 ESCORT_HOLD</li>
 *   <li>DELIVERY_STANDBY → ESCORT_COMPLETE</li>
 *   <li>종료 상태가 아닌 모든 상태 → ESCORT_HOLD</li>
 *   <li>ESCORT_HOLD → 종료 상태를 제외한 모든 상태 (보류 이전 상태로 복귀)</li>
 * </ul>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>ESCORT_COMPLETE에서는 어떤 상태로도 전이 불가</li>
 *   <li>자기 자신으로의 전이 불가</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class EscortTransitions {

    // Utility class - prevent instantiation
    private EscortTransitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 호송 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(EscortState from, EscortState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        if (!isAllowed(from, to)) {
            throw new IllegalStateException(
                String.format("Invalid escort transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 호송 상태 전이 허용 여부.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @return 허용되면 true
     */
    public static boolean isAllowed(EscortState from, EscortState to) {
        if (from == null || to == null || from == to || from.isTerminal()) {
            return false;
        }
        if (to == EscortState.ESCORT_HOLD) {
            return true;
        }

        return switch (from) {
            case EN_ROUTE_STAGING -> to == EscortState.AT_STAGING;
            case AT_STAGING -> to == EscortState.EQUIPMENT_CHECK;
            case EQUIPMENT_CHECK -> to == EscortState.STAGING_COMPLETE;
            case STAGING_COMPLETE -> to == EscortState.AWAITING_PRIMARY;
            case AWAITING_PRIMARY -> to == EscortState.CONVOY_FORMING;
            case CONVOY_FORMING -> to == EscortState.ESCORTING;
            case ESCORTING -> to.isIncident() || to == EscortState.DELIVERY_STANDBY;
            case CLEARING_HAZARD, TRAFFIC_CONTROL, SEPARATION_ALERT,
                 PRIMARY_BREAKDOWN, ESCORT_BREAKDOWN, ROUTE_BLOCKED, POLICE_STOP -> to == EscortState.ESCORTING;
            case ESCORT_HOLD -> !to.isTerminal();
            case DELIVERY_STANDBY -> to == EscortState.ESCORT_COMPLETE;
            case ESCORT_COMPLETE -> false;
        };
    }
}
