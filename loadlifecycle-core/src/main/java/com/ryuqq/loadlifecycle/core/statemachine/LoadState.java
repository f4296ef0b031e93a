package com.ryuqq.loadlifecycle.core.statemachine;

/**
 * Load의 생명주기 상태.
 *
 * <p>상태별 분류, 역할, 필수 문서, 자동 전이 등 메타데이터는
 * {@link com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog}가 보관합니다.
 * 이 enum은 상태 집합 자체만 정의합니다.</p>
 *
 * <p><strong>분류:</strong></p>
 * <ul>
 *   <li>CREATION: DRAFT, POSTED, BIDDING, EXPIRED</li>
 *   <li>ASSIGNMENT: AWARDED ~ CONFIRMED</li>
 *   <li>EXECUTION: EN_ROUTE_PICKUP ~ UNLOADED</li>
 *   <li>COMPLETION: POD_PENDING, DELIVERED</li>
 *   <li>FINANCIAL: INVOICED, PAID, COMPLETE</li>
 *   <li>EXCEPTION: 예외/보류/취소 및 화물 예외 상태</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum LoadState {
    DRAFT,
    POSTED,
    BIDDING,
    EXPIRED,

    AWARDED,
    DECLINED,
    LAPSED,
    ACCEPTED,
    ASSIGNED,
    CONFIRMED,

    EN_ROUTE_PICKUP,
    AT_PICKUP,
    PICKUP_CHECKIN,
    LOADING,
    LOADING_EXCEPTION,
    LOADED,
    IN_TRANSIT,
    TRANSIT_HOLD,
    TRANSIT_EXCEPTION,
    AT_DELIVERY,
    DELIVERY_CHECKIN,
    UNLOADING,
    UNLOADING_EXCEPTION,
    UNLOADED,

    POD_PENDING,
    POD_REJECTED,
    DELIVERED,

    INVOICED,
    DISPUTED,
    PAID,
    COMPLETE,

    CANCELLED,
    ON_HOLD,

    TEMP_EXCURSION,
    REEFER_BREAKDOWN,
    CONTAMINATION_REJECT,
    SEAL_BREACH,
    WEIGHT_VIOLATION
}
