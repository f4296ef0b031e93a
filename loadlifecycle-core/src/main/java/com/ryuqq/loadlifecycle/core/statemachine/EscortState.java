package com.ryuqq.loadlifecycle.core.statemachine;

/**
 * 호송(escort) 차량 측 상태.
 *
 * <p>Convoy는 Load와 병렬로 이 상태 기계를 따라 이동하며,
 * 동기화 지점(Sync Point)에서 Load 상태와 맞춰집니다.</p>
 *
 * <p><strong>상태 그룹:</strong></p>
 * <ul>
 *   <li>집결: EN_ROUTE_STAGING, AT_STAGING, EQUIPMENT_CHECK, STAGING_COMPLETE</li>
 *   <li>대기/편성: AWAITING_PRIMARY, CONVOY_FORMING</li>
 *   <li>운행: ESCORTING 및 운행 중 사건 상태</li>
 *   <li>종료: DELIVERY_STANDBY, ESCORT_COMPLETE</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum EscortState {
    EN_ROUTE_STAGING,
    AT_STAGING,
    EQUIPMENT_CHECK,
    STAGING_COMPLETE,
    AWAITING_PRIMARY,
    CONVOY_FORMING,
    ESCORTING,
    ESCORT_HOLD,
    CLEARING_HAZARD,
    TRAFFIC_CONTROL,
    SEPARATION_ALERT,
    DELIVERY_STANDBY,
    ESCORT_COMPLETE,
    PRIMARY_BREAKDOWN,
    ESCORT_BREAKDOWN,
    ROUTE_BLOCKED,
    POLICE_STOP;

    /**
     * 종료 상태 여부.
     *
     * @return ESCORT_COMPLETE이면 true
     */
    public boolean isTerminal() {
        return this == ESCORT_COMPLETE;
    }

    /**
     * 운행 중 발생한 사건 상태 여부.
     *
     * <p>사건 상태는 해소 후 ESCORTING으로 복귀합니다.</p>
     *
     * @return 사건 상태이면 true
     */
    public boolean isIncident() {
        return switch (this) {
            case CLEARING_HAZARD, TRAFFIC_CONTROL, SEPARATION_ALERT,
                 PRIMARY_BREAKDOWN, ESCORT_BREAKDOWN, ROUTE_BLOCKED, POLICE_STOP -> true;
            default -> false;
        };
    }
}
