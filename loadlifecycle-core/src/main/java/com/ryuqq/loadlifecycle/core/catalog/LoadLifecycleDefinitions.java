package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadDocument;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import com.ryuqq.loadlifecycle.core.statemachine.StateCategory;
import com.ryuqq.loadlifecycle.core.statemachine.TriggerType;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static com.ryuqq.loadlifecycle.core.model.ActorRole.*;
import static com.ryuqq.loadlifecycle.core.statemachine.LoadState.*;

/**
 * Load 생명주기의 정적 상태/전이 선언.
 *
 * <p>이 클래스는 순수 데이터입니다. 조회 인덱스는 {@link TransitionCatalog}가
 * 기동 시점에 한 번 구성합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class LoadLifecycleDefinitions {

    /**
     * 화물 예외 상태를 보고할 수 있는 출발 상태.
     */
    private static final LoadState[] CARGO_EXCEPTION_SOURCES = {
        LOADED, IN_TRANSIT, TRANSIT_HOLD, AT_DELIVERY, DELIVERY_CHECKIN
    };

    private static final ActorRole[] CARGO_EXCEPTION_REPORTERS = {
        DRIVER, DISPATCH, ESCORT, TERMINAL_MANAGER, SAFETY_MANAGER, SYSTEM
    };

    // Utility class - prevent instantiation
    private LoadLifecycleDefinitions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 모든 상태의 메타데이터.
     *
     * @return 표시 순서대로 정렬된 상태 메타데이터
     */
    public static List<StateMetadata> states() {
        List<StateMetadata> states = new ArrayList<>();

        // CREATION
        states.add(state(DRAFT, StateCategory.CREATION, "Draft", "Load created, not yet published")
            .primary(SHIPPER, BROKER)
            .allowed(SHIPPER, BROKER, DISPATCH, TERMINAL_MANAGER, ADMIN, SUPER_ADMIN)
            .build());
        states.add(state(POSTED, StateCategory.CREATION, "Posted", "Live on load board, accepting bids")
            .primary(SHIPPER, BROKER)
            .allowed(SHIPPER, BROKER, DISPATCH, ADMIN, SUPER_ADMIN)
            .auto("POSTED_TO_EXPIRED", EXPIRED, Duration.ofHours(72), "No bids after posting deadline")
            .build());
        states.add(state(BIDDING, StateCategory.CREATION, "Bidding", "Bids received, under review")
            .primary(SHIPPER, BROKER)
            .allowed(SHIPPER, BROKER, CATALYST, DRIVER, DISPATCH, ADMIN, SUPER_ADMIN)
            .auto("POSTED_TO_EXPIRED", EXPIRED, Duration.ofHours(48), "Bidding deadline passed")
            .build());
        states.add(state(EXPIRED, StateCategory.CREATION, "Expired", "Posting deadline passed without award")
            .primary(SHIPPER)
            .allowed(SHIPPER, BROKER, ADMIN)
            .terminal()
            .build());

        // ASSIGNMENT
        states.add(state(AWARDED, StateCategory.ASSIGNMENT, "Awarded", "Carrier selected, awaiting acceptance")
            .primary(CATALYST, DISPATCH)
            .allowed(SHIPPER, BROKER, CATALYST, DISPATCH, ADMIN, SUPER_ADMIN)
            .auto("AWARDED_TO_LAPSED", LAPSED, Duration.ofMinutes(120), "Carrier did not respond")
            .build());
        states.add(state(DECLINED, StateCategory.ASSIGNMENT, "Declined", "Carrier declined the award")
            .primary(SHIPPER)
            .allowed(SHIPPER, BROKER, ADMIN)
            .exception()
            .build());
        states.add(state(LAPSED, StateCategory.ASSIGNMENT, "Lapsed", "Award expired before the carrier or driver responded")
            .primary(SHIPPER)
            .allowed(SHIPPER, BROKER, ADMIN)
            .exception()
            .build());
        states.add(state(ACCEPTED, StateCategory.ASSIGNMENT, "Accepted", "Carrier accepted, assigning driver")
            .primary(CATALYST, DISPATCH)
            .allowed(CATALYST, DISPATCH, ADMIN, SUPER_ADMIN)
            .build());
        states.add(state(ASSIGNED, StateCategory.ASSIGNMENT, "Assigned", "Driver assigned, awaiting driver confirmation")
            .primary(DRIVER)
            .allowed(CATALYST, DISPATCH, DRIVER, ADMIN, SUPER_ADMIN)
            .auto("ASSIGNED_TO_LAPSED", LAPSED, Duration.ofMinutes(60), "Driver did not confirm")
            .build());
        states.add(state(CONFIRMED, StateCategory.ASSIGNMENT, "Confirmed", "Driver confirmed, ready to start trip")
            .primary(DRIVER)
            .allowed(DRIVER, DISPATCH, ADMIN)
            .documents(LoadDocument.PRE_TRIP_INSPECTION)
            .build());

        // PICKUP
        states.add(state(EN_ROUTE_PICKUP, StateCategory.EXECUTION, "En Route to Pickup", "Driver heading to pickup facility")
            .primary(DRIVER)
            .allowed(DRIVER, DISPATCH, ADMIN)
            .gps()
            .documents(LoadDocument.PRE_TRIP_INSPECTION)
            .financialImpact("GPS tracking active")
            .build());
        states.add(state(AT_PICKUP, StateCategory.EXECUTION, "At Pickup", "Vehicle within pickup geofence")
            .primary(DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .financialImpact("Detention timer starts after free time")
            .build());
        states.add(state(PICKUP_CHECKIN, StateCategory.EXECUTION, "Pickup Check-In", "Driver checked in at facility gate")
            .primary(TERMINAL_MANAGER, DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH, ADMIN)
            .gps()
            .build());
        states.add(state(LOADING, StateCategory.EXECUTION, "Loading", "Cargo being loaded onto vehicle")
            .primary(TERMINAL_MANAGER, DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .build());
        states.add(state(LOADING_EXCEPTION, StateCategory.EXECUTION, "Loading Exception", "Issue during loading (wrong cargo, damage, weight discrepancy)")
            .primary(DRIVER, TERMINAL_MANAGER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH, SHIPPER, ADMIN)
            .gps()
            .documents(LoadDocument.EXCEPTION_PHOTOS)
            .exception()
            .build());
        states.add(state(LOADED, StateCategory.EXECUTION, "Loaded", "Cargo loaded, seals applied, weights recorded")
            .primary(DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .documents(LoadDocument.BOL_SIGNED, LoadDocument.SEAL_NUMBERS)
            .financialImpact("Detention timer stops")
            .build());

        // TRANSIT
        states.add(state(IN_TRANSIT, StateCategory.EXECUTION, "In Transit", "Shipment on the road")
            .primary(DRIVER)
            .allowed(DRIVER, DISPATCH, ESCORT, ADMIN)
            .gps()
            .documents(LoadDocument.BOL_SIGNED)
            .financialImpact("Per-mile tracking, fuel surcharge active")
            .build());
        states.add(state(TRANSIT_HOLD, StateCategory.EXECUTION, "Transit Hold", "Driver on mandatory HOS break")
            .primary(DRIVER)
            .allowed(DRIVER, DISPATCH, ADMIN)
            .gps()
            .financialImpact("Layover charges may apply")
            .build());
        states.add(state(TRANSIT_EXCEPTION, StateCategory.EXECUTION, "Transit Exception", "Breakdown, weather delay, or incident")
            .primary(DRIVER, DISPATCH)
            .allowed(DRIVER, DISPATCH, ESCORT, ADMIN, SAFETY_MANAGER)
            .gps()
            .documents(LoadDocument.EXCEPTION_PHOTOS)
            .financialImpact("Delay penalty calculation")
            .exception()
            .build());

        // DELIVERY
        states.add(state(AT_DELIVERY, StateCategory.EXECUTION, "At Delivery", "Vehicle within delivery geofence")
            .primary(DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .financialImpact("Demurrage timer starts after free time")
            .build());
        states.add(state(DELIVERY_CHECKIN, StateCategory.EXECUTION, "Delivery Check-In", "Driver checked in at delivery facility")
            .primary(TERMINAL_MANAGER, DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .build());
        states.add(state(UNLOADING, StateCategory.EXECUTION, "Unloading", "Cargo being unloaded")
            .primary(TERMINAL_MANAGER, DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .build());
        states.add(state(UNLOADING_EXCEPTION, StateCategory.EXECUTION, "Unloading Exception", "Damage, quantity discrepancy, or refusal")
            .primary(DRIVER, TERMINAL_MANAGER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH, SHIPPER, ADMIN)
            .gps()
            .documents(LoadDocument.EXCEPTION_PHOTOS, LoadDocument.DAMAGE_REPORT)
            .exception()
            .build());
        states.add(state(UNLOADED, StateCategory.EXECUTION, "Unloaded", "Cargo fully unloaded, awaiting POD")
            .primary(DRIVER)
            .allowed(DRIVER, TERMINAL_MANAGER, DISPATCH)
            .gps()
            .financialImpact("Demurrage timer stops")
            .build());

        // COMPLETION
        states.add(state(POD_PENDING, StateCategory.COMPLETION, "POD Pending", "Proof of Delivery submitted, awaiting verification")
            .primary(SHIPPER, TERMINAL_MANAGER)
            .allowed(SHIPPER, BROKER, TERMINAL_MANAGER, ADMIN)
            .documents(LoadDocument.POD_PHOTO, LoadDocument.POD_SIGNATURE)
            .auto("POD_AUTO_APPROVE", DELIVERED, Duration.ofHours(24), "Auto-approve after 24h if no issues")
            .build());
        states.add(state(POD_REJECTED, StateCategory.COMPLETION, "POD Rejected", "Proof of Delivery rejected, resubmission required")
            .primary(DRIVER)
            .allowed(DRIVER, DISPATCH, ADMIN)
            .documents(LoadDocument.POD_PHOTO, LoadDocument.POD_SIGNATURE)
            .exception()
            .build());
        states.add(state(DELIVERED, StateCategory.COMPLETION, "Delivered", "Shipment delivered and confirmed")
            .primary(SHIPPER)
            .allowed(SHIPPER, BROKER, ADMIN, SUPER_ADMIN)
            .documents(LoadDocument.POD_VERIFIED)
            .financialImpact("Escrow capture, invoice generation")
            .build());

        // FINANCIAL
        states.add(state(INVOICED, StateCategory.FINANCIAL, "Invoiced", "Invoice generated and sent")
            .primary(FACTORING, SHIPPER)
            .allowed(SHIPPER, BROKER, FACTORING, ADMIN, SUPER_ADMIN)
            .documents(LoadDocument.INVOICE)
            .financialImpact("Payment terms active")
            .build());
        states.add(state(DISPUTED, StateCategory.FINANCIAL, "Disputed", "Charge dispute filed")
            .primary(SHIPPER, ADMIN)
            .allowed(SHIPPER, BROKER, CATALYST, FACTORING, ADMIN, SUPER_ADMIN)
            .exception()
            .build());
        states.add(state(PAID, StateCategory.FINANCIAL, "Paid", "Payment received")
            .primary(FACTORING)
            .allowed(FACTORING, ADMIN, SUPER_ADMIN)
            .financialImpact("Settlement processing")
            .build());
        states.add(state(COMPLETE, StateCategory.FINANCIAL, "Complete", "Load lifecycle fully complete and settled")
            .primary(ADMIN)
            .allowed(ADMIN, SUPER_ADMIN)
            .terminal()
            .build());

        // EXCEPTION
        states.add(state(CANCELLED, StateCategory.EXCEPTION, "Cancelled", "Load cancelled")
            .primary(SHIPPER)
            .allowed(SHIPPER, BROKER, DISPATCH, ADMIN, SUPER_ADMIN)
            .financialImpact("Cancellation penalty if after assignment")
            .terminal()
            .build());
        states.add(state(ON_HOLD, StateCategory.EXCEPTION, "On Hold", "Load paused by compliance or admin")
            .primary(COMPLIANCE_OFFICER, ADMIN)
            .allowed(COMPLIANCE_OFFICER, SAFETY_MANAGER, ADMIN, SUPER_ADMIN)
            .exception()
            .build());
        states.add(cargoException(TEMP_EXCURSION, "Temperature Excursion",
            "Reefer temperature deviated outside acceptable range", "Cold chain claim exposure"));
        states.add(cargoException(REEFER_BREAKDOWN, "Reefer Breakdown",
            "Refrigeration unit failure, emergency transfer may be needed", "Layover timer started"));
        states.add(cargoException(CONTAMINATION_REJECT, "Contamination Reject",
            "Product rejected due to contamination, lab results required", "Tank washout charges may apply"));
        states.add(cargoException(SEAL_BREACH, "Seal Breach",
            "Seal broken, missing, or tampered with, full inspection required", null));
        states.add(state(WEIGHT_VIOLATION, StateCategory.EXCEPTION, "Weight Violation", "Load exceeds legal weight limits")
            .primary(DRIVER, DISPATCH)
            .allowed(CARGO_EXCEPTION_REPORTERS)
            .allowed(COMPLIANCE_OFFICER, ADMIN, SUPER_ADMIN)
            .gps()
            .documents(LoadDocument.WEIGHT_TICKET)
            .financialImpact("Reweigh fee applied")
            .exception()
            .build());

        return List.copyOf(states);
    }

    /**
     * 모든 전이 정의.
     *
     * @return 선언 순서대로 정렬된 전이 정의
     */
    public static List<TransitionDefinition> transitions() {
        List<TransitionDefinition> transitions = new ArrayList<>();

        // CREATION
        transitions.add(TransitionDefinition.builder("DRAFT_TO_POSTED")
            .from(DRAFT).to(POSTED)
            .trigger(TriggerType.USER_ACTION, "publish_load")
            .actors(SHIPPER, BROKER, DISPATCH, TERMINAL_MANAGER, ADMIN, SUPER_ADMIN)
            .guard(GuardKind.DATA, "has_pickup_location", "Pickup location required")
            .guard(GuardKind.DATA, "has_delivery_location", "Delivery location required")
            .guard(GuardKind.DATA, "has_rate", "Rate must be set")
            .guard(GuardKind.TIME, "pickup_date_future", "Pickup date must be in the future")
            .effect(EffectKind.BROADCAST, "broadcast_new_load", CATALYST, DRIVER, DISPATCH, BROKER)
            .effect(EffectKind.NOTIFICATION, "load_posted", SHIPPER)
            .build());
        transitions.add(TransitionDefinition.builder("POSTED_TO_BIDDING")
            .from(POSTED).to(BIDDING)
            .trigger(TriggerType.SYSTEM, "first_bid_received")
            .actors(CATALYST, DRIVER, DISPATCH, BROKER)
            .effect(EffectKind.NOTIFICATION, "first_bid_received", SHIPPER, BROKER)
            .effect(EffectKind.BROADCAST, "bid_activity_started")
            .build());
        transitions.add(TransitionDefinition.builder("POSTED_TO_AWARDED")
            .from(POSTED).to(AWARDED)
            .trigger(TriggerType.USER_ACTION, "direct_assign")
            .actors(SHIPPER, BROKER, DISPATCH, ADMIN)
            .guard(GuardKind.DATA, "has_carrier", "Carrier must be selected")
            .effect(EffectKind.NOTIFICATION, "load_awarded", CATALYST, DISPATCH)
            .effect(EffectKind.EMAIL, "award_confirmation", CATALYST)
            .priority(2)
            .build());
        transitions.add(TransitionDefinition.builder("BIDDING_TO_AWARDED")
            .from(BIDDING).to(AWARDED)
            .trigger(TriggerType.USER_ACTION, "accept_bid")
            .actors(SHIPPER, BROKER, ADMIN)
            .guard(GuardKind.DATA, "has_winning_bid", "No bid selected")
            .guard(GuardKind.APPROVAL, "rate_within_limit", "Rate exceeds approval limit, manager approval required")
            .effect(EffectKind.NOTIFICATION, "bid_accepted", CATALYST, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "bid_rejected", CATALYST)
            .effect(EffectKind.EMAIL, "award_confirmation", CATALYST)
            .effect(EffectKind.FINANCIAL, "create_rate_confirmation")
            .build());
        transitions.add(TransitionDefinition.builder("POSTED_TO_EXPIRED")
            .from(POSTED, BIDDING).to(EXPIRED)
            .trigger(TriggerType.TIMEOUT, "posting_expired")
            .actors(SYSTEM, ADMIN)
            .guard(GuardKind.TIME, "past_deadline", "Posting has not expired yet")
            .effect(EffectKind.NOTIFICATION, "load_expired", SHIPPER, BROKER)
            .build());

        // ASSIGNMENT
        transitions.add(TransitionDefinition.builder("AWARDED_TO_ACCEPTED")
            .from(AWARDED).to(ACCEPTED)
            .trigger(TriggerType.USER_ACTION, "carrier_accept")
            .actors(CATALYST, DISPATCH, BROKER)
            .effect(EffectKind.NOTIFICATION, "carrier_accepted", SHIPPER, BROKER)
            .effect(EffectKind.BROADCAST, "load_accepted")
            .build());
        transitions.add(TransitionDefinition.builder("AWARDED_TO_DECLINED")
            .from(AWARDED).to(DECLINED)
            .trigger(TriggerType.USER_ACTION, "carrier_decline")
            .actors(CATALYST, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "carrier_declined", SHIPPER, BROKER)
            .priority(2)
            .build());
        transitions.add(TransitionDefinition.builder("AWARDED_TO_LAPSED")
            .from(AWARDED).to(LAPSED)
            .trigger(TriggerType.TIMEOUT, "award_timeout")
            .actors(SYSTEM, ADMIN)
            .guard(GuardKind.TIME, "award_expired_2hr", "Award has not expired yet")
            .effect(EffectKind.NOTIFICATION, "award_lapsed", SHIPPER, BROKER, CATALYST)
            .build());
        transitions.add(TransitionDefinition.builder("DECLINED_TO_POSTED")
            .from(DECLINED, LAPSED).to(POSTED)
            .trigger(TriggerType.USER_ACTION, "repost_load")
            .actors(SHIPPER, BROKER, ADMIN)
            .effect(EffectKind.BROADCAST, "broadcast_new_load", CATALYST, DRIVER, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "load_reposted", SHIPPER)
            .build());
        transitions.add(TransitionDefinition.builder("ACCEPTED_TO_ASSIGNED")
            .from(ACCEPTED).to(ASSIGNED)
            .trigger(TriggerType.USER_ACTION, "assign_driver")
            .actors(CATALYST, DISPATCH, ADMIN)
            .guard(GuardKind.DATA, "has_driver", "Driver must be assigned")
            .guard(GuardKind.HOURS_OF_SERVICE, "driver_has_hours", "Driver does not have sufficient HOS hours")
            .effect(EffectKind.NOTIFICATION, "driver_assigned", DRIVER)
            .effect(EffectKind.BROADCAST, "load_driver_assigned")
            .build());
        transitions.add(TransitionDefinition.builder("ASSIGNED_TO_CONFIRMED")
            .from(ASSIGNED).to(CONFIRMED)
            .trigger(TriggerType.USER_ACTION, "driver_confirm")
            .actors(DRIVER)
            .effect(EffectKind.NOTIFICATION, "driver_confirmed", CATALYST, DISPATCH, SHIPPER)
            .effect(EffectKind.BROADCAST, "driver_confirmed")
            .build());
        transitions.add(TransitionDefinition.builder("ASSIGNED_TO_LAPSED")
            .from(ASSIGNED).to(LAPSED)
            .trigger(TriggerType.TIMEOUT, "driver_confirmation_timeout")
            .actors(SYSTEM, ADMIN)
            .guard(GuardKind.TIME, "confirmation_window_elapsed", "Driver confirmation window has not elapsed")
            .effect(EffectKind.NOTIFICATION, "assignment_lapsed", SHIPPER, CATALYST, DISPATCH)
            .priority(2)
            .build());

        // PICKUP
        transitions.add(TransitionDefinition.builder("CONFIRMED_TO_EN_ROUTE_PICKUP")
            .from(CONFIRMED).to(EN_ROUTE_PICKUP)
            .trigger(TriggerType.USER_ACTION, "start_trip")
            .actors(DRIVER)
            .guard(GuardKind.DOCUMENT, "pre_trip_complete", "Pre-trip inspection must be completed")
            .guard(GuardKind.HOURS_OF_SERVICE, "driver_has_hours", "Insufficient HOS hours to begin trip")
            .effect(EffectKind.NOTIFICATION, "trip_started", SHIPPER, CATALYST, DISPATCH)
            .effect(EffectKind.BROADCAST, "trip_started")
            .effect(EffectKind.INTEGRATION, "activate_gps_tracking")
            .effect(EffectKind.INTEGRATION, "activate_pickup_geofence")
            .build());
        transitions.add(TransitionDefinition.builder("EN_ROUTE_TO_AT_PICKUP")
            .from(EN_ROUTE_PICKUP).to(AT_PICKUP)
            .trigger(TriggerType.GEOFENCE, "entered_pickup_geofence")
            .actors(DRIVER)
            .guard(GuardKind.LOCATION, "within_pickup_geofence", "Not within pickup facility geofence")
            .effect(EffectKind.NOTIFICATION, "arrived_at_pickup", SHIPPER, TERMINAL_MANAGER, DISPATCH)
            .effect(EffectKind.FINANCIAL, "start_detention_timer")
            .effect(EffectKind.BROADCAST, "arrived_pickup")
            .build());
        transitions.add(TransitionDefinition.builder("AT_PICKUP_TO_CHECKIN")
            .from(AT_PICKUP).to(PICKUP_CHECKIN)
            .trigger(TriggerType.USER_ACTION, "driver_checkin")
            .actors(DRIVER, TERMINAL_MANAGER)
            .guard(GuardKind.LOCATION, "within_pickup_geofence", "Must be at pickup facility")
            .effect(EffectKind.NOTIFICATION, "driver_checked_in", TERMINAL_MANAGER)
            .build());
        transitions.add(TransitionDefinition.builder("CHECKIN_TO_LOADING")
            .from(PICKUP_CHECKIN).to(LOADING)
            .trigger(TriggerType.USER_ACTION, "approve_loading")
            .actors(TERMINAL_MANAGER, DRIVER, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "loading_started", SHIPPER, DISPATCH)
            .effect(EffectKind.BROADCAST, "loading_started")
            .build());
        transitions.add(TransitionDefinition.builder("LOADING_TO_EXCEPTION")
            .from(LOADING).to(LOADING_EXCEPTION)
            .trigger(TriggerType.EXCEPTION, "loading_issue")
            .actors(DRIVER, TERMINAL_MANAGER)
            .effect(EffectKind.NOTIFICATION, "loading_exception", SHIPPER, DISPATCH, CATALYST, SAFETY_MANAGER)
            .effect(EffectKind.BROADCAST, "exception_reported")
            .build());
        transitions.add(TransitionDefinition.builder("LOADING_EXCEPTION_TO_LOADING")
            .from(LOADING_EXCEPTION).to(LOADING)
            .trigger(TriggerType.USER_ACTION, "resolve_loading_exception")
            .actors(DRIVER, TERMINAL_MANAGER, DISPATCH, ADMIN)
            .effect(EffectKind.NOTIFICATION, "exception_resolved", SHIPPER, DISPATCH)
            .build());
        transitions.add(TransitionDefinition.builder("LOADING_TO_LOADED")
            .from(LOADING).to(LOADED)
            .trigger(TriggerType.USER_ACTION, "loading_complete")
            .actors(DRIVER, TERMINAL_MANAGER)
            .guard(GuardKind.DATA, "has_weight", "Weight must be recorded")
            .guard(GuardKind.DATA, "has_seal_numbers", "Seal numbers required")
            .effect(EffectKind.NOTIFICATION, "loading_complete", SHIPPER, DISPATCH, CATALYST)
            .effect(EffectKind.FINANCIAL, "stop_detention_timer")
            .effect(EffectKind.BROADCAST, "loaded")
            .build());
        transitions.add(TransitionDefinition.builder("LOADED_TO_IN_TRANSIT")
            .from(LOADED).to(IN_TRANSIT)
            .trigger(TriggerType.USER_ACTION, "depart_pickup")
            .actors(DRIVER)
            .guard(GuardKind.DOCUMENT, "bol_signed", "Bill of Lading must be signed before departure")
            .guard(GuardKind.HOURS_OF_SERVICE, "driver_has_hours", "Insufficient HOS hours")
            .effect(EffectKind.NOTIFICATION, "departed_pickup", SHIPPER, CATALYST, DISPATCH)
            .effect(EffectKind.INTEGRATION, "activate_delivery_geofence")
            .effect(EffectKind.BROADCAST, "in_transit")
            .effect(EffectKind.FINANCIAL, "start_tracking")
            .build());

        // TRANSIT
        transitions.add(TransitionDefinition.builder("IN_TRANSIT_TO_HOLD")
            .from(IN_TRANSIT).to(TRANSIT_HOLD)
            .trigger(TriggerType.USER_ACTION, "hos_break")
            .actors(DRIVER)
            .effect(EffectKind.NOTIFICATION, "hos_break_started", DISPATCH)
            .effect(EffectKind.FINANCIAL, "start_layover_timer")
            .effect(EffectKind.BROADCAST, "transit_hold")
            .priority(2)
            .build());
        transitions.add(TransitionDefinition.builder("TRANSIT_HOLD_TO_IN_TRANSIT")
            .from(TRANSIT_HOLD).to(IN_TRANSIT)
            .trigger(TriggerType.USER_ACTION, "resume_transit")
            .actors(DRIVER)
            .guard(GuardKind.HOURS_OF_SERVICE, "driver_has_hours", "Still on mandatory rest, insufficient HOS hours")
            .effect(EffectKind.NOTIFICATION, "transit_resumed", DISPATCH, SHIPPER)
            .effect(EffectKind.FINANCIAL, "stop_layover_timer")
            .effect(EffectKind.BROADCAST, "transit_resumed")
            .build());
        transitions.add(TransitionDefinition.builder("IN_TRANSIT_TO_EXCEPTION")
            .from(IN_TRANSIT).to(TRANSIT_EXCEPTION)
            .trigger(TriggerType.EXCEPTION, "transit_issue")
            .actors(DRIVER, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "transit_exception", SHIPPER, DISPATCH, CATALYST, SAFETY_MANAGER)
            .effect(EffectKind.BROADCAST, "exception_reported")
            .build());
        transitions.add(TransitionDefinition.builder("TRANSIT_EXCEPTION_TO_IN_TRANSIT")
            .from(TRANSIT_EXCEPTION).to(IN_TRANSIT)
            .trigger(TriggerType.USER_ACTION, "resolve_transit_exception")
            .actors(DRIVER, DISPATCH, ADMIN)
            .effect(EffectKind.NOTIFICATION, "exception_resolved", SHIPPER, DISPATCH)
            .build());
        transitions.add(TransitionDefinition.builder("IN_TRANSIT_TO_AT_DELIVERY")
            .from(IN_TRANSIT).to(AT_DELIVERY)
            .trigger(TriggerType.GEOFENCE, "entered_delivery_geofence")
            .actors(DRIVER)
            .guard(GuardKind.LOCATION, "within_delivery_geofence", "Not within delivery facility geofence")
            .effect(EffectKind.NOTIFICATION, "arrived_at_delivery", SHIPPER, TERMINAL_MANAGER, DISPATCH)
            .effect(EffectKind.FINANCIAL, "start_demurrage_timer")
            .effect(EffectKind.BROADCAST, "arrived_delivery")
            .build());

        // DELIVERY
        transitions.add(TransitionDefinition.builder("AT_DELIVERY_TO_CHECKIN")
            .from(AT_DELIVERY).to(DELIVERY_CHECKIN)
            .trigger(TriggerType.USER_ACTION, "driver_checkin_delivery")
            .actors(DRIVER, TERMINAL_MANAGER)
            .guard(GuardKind.LOCATION, "within_delivery_geofence", "Must be at delivery facility")
            .effect(EffectKind.NOTIFICATION, "driver_checked_in_delivery", TERMINAL_MANAGER)
            .build());
        transitions.add(TransitionDefinition.builder("DELIVERY_CHECKIN_TO_UNLOADING")
            .from(DELIVERY_CHECKIN).to(UNLOADING)
            .trigger(TriggerType.USER_ACTION, "approve_unloading")
            .actors(TERMINAL_MANAGER, DRIVER, DISPATCH)
            .effect(EffectKind.NOTIFICATION, "unloading_started", SHIPPER, DISPATCH)
            .effect(EffectKind.BROADCAST, "unloading_started")
            .build());
        transitions.add(TransitionDefinition.builder("UNLOADING_TO_EXCEPTION")
            .from(UNLOADING).to(UNLOADING_EXCEPTION)
            .trigger(TriggerType.EXCEPTION, "unloading_issue")
            .actors(DRIVER, TERMINAL_MANAGER)
            .effect(EffectKind.NOTIFICATION, "unloading_exception", SHIPPER, DISPATCH, CATALYST, SAFETY_MANAGER)
            .build());
        transitions.add(TransitionDefinition.builder("UNLOADING_EXCEPTION_TO_UNLOADING")
            .from(UNLOADING_EXCEPTION).to(UNLOADING)
            .trigger(TriggerType.USER_ACTION, "resolve_unloading_exception")
            .actors(DRIVER, TERMINAL_MANAGER, DISPATCH, ADMIN)
            .effect(EffectKind.NOTIFICATION, "exception_resolved", SHIPPER, DISPATCH)
            .build());
        transitions.add(TransitionDefinition.builder("UNLOADING_TO_UNLOADED")
            .from(UNLOADING).to(UNLOADED)
            .trigger(TriggerType.USER_ACTION, "unloading_complete")
            .actors(DRIVER, TERMINAL_MANAGER)
            .effect(EffectKind.NOTIFICATION, "unloading_complete", SHIPPER, DISPATCH, CATALYST)
            .effect(EffectKind.FINANCIAL, "stop_demurrage_timer")
            .effect(EffectKind.BROADCAST, "unloaded")
            .build());
        transitions.add(TransitionDefinition.builder("UNLOADED_TO_POD_PENDING")
            .from(UNLOADED).to(POD_PENDING)
            .trigger(TriggerType.USER_ACTION, "submit_pod")
            .actors(DRIVER)
            .guard(GuardKind.DOCUMENT, "pod_photo_present", "POD photo required")
            .guard(GuardKind.DOCUMENT, "pod_signature_present", "Receiver signature required")
            .effect(EffectKind.NOTIFICATION, "pod_submitted", SHIPPER, BROKER, TERMINAL_MANAGER)
            .effect(EffectKind.BROADCAST, "pod_submitted")
            .build());
        transitions.add(TransitionDefinition.builder("POD_TO_DELIVERED")
            .from(POD_PENDING).to(DELIVERED)
            .trigger(TriggerType.APPROVAL, "pod_approved")
            .actors(SHIPPER, TERMINAL_MANAGER, ADMIN)
            .effect(EffectKind.NOTIFICATION, "delivery_confirmed", DRIVER, CATALYST, DISPATCH, FACTORING)
            .effect(EffectKind.FINANCIAL, "capture_escrow")
            .effect(EffectKind.FINANCIAL, "generate_invoice")
            .effect(EffectKind.DATABASE, "update_gamification_score")
            .effect(EffectKind.INTEGRATION, "generate_route_report")
            .effect(EffectKind.BROADCAST, "delivered")
            .build());
        transitions.add(TransitionDefinition.builder("POD_AUTO_APPROVE")
            .from(POD_PENDING).to(DELIVERED)
            .trigger(TriggerType.TIMEOUT, "pod_auto_approved")
            .actors(SYSTEM, ADMIN)
            .guard(GuardKind.TIME, "pod_24h_elapsed", "24-hour auto-approve window not reached")
            .effect(EffectKind.NOTIFICATION, "pod_auto_approved", SHIPPER, DRIVER, CATALYST)
            .effect(EffectKind.FINANCIAL, "capture_escrow")
            .effect(EffectKind.FINANCIAL, "generate_invoice")
            .effect(EffectKind.DATABASE, "update_gamification_score")
            .effect(EffectKind.BROADCAST, "delivered")
            .build());
        transitions.add(TransitionDefinition.builder("POD_TO_REJECTED")
            .from(POD_PENDING).to(POD_REJECTED)
            .trigger(TriggerType.USER_ACTION, "reject_pod")
            .actors(SHIPPER, TERMINAL_MANAGER, ADMIN)
            .effect(EffectKind.NOTIFICATION, "pod_rejected", DRIVER, DISPATCH, CATALYST)
            .priority(2)
            .build());
        transitions.add(TransitionDefinition.builder("POD_REJECTED_TO_POD_PENDING")
            .from(POD_REJECTED).to(POD_PENDING)
            .trigger(TriggerType.USER_ACTION, "resubmit_pod")
            .actors(DRIVER)
            .guard(GuardKind.DOCUMENT, "pod_photo_present", "Updated POD photo required")
            .guard(GuardKind.DOCUMENT, "pod_signature_present", "Updated receiver signature required")
            .effect(EffectKind.NOTIFICATION, "pod_resubmitted", SHIPPER, TERMINAL_MANAGER)
            .build());

        // FINANCIAL
        transitions.add(TransitionDefinition.builder("DELIVERED_TO_INVOICED")
            .from(DELIVERED).to(INVOICED)
            .trigger(TriggerType.SYSTEM, "invoice_generated")
            .actors(ADMIN, SUPER_ADMIN, FACTORING, SYSTEM)
            .effect(EffectKind.EMAIL, "invoice_sent", SHIPPER)
            .effect(EffectKind.NOTIFICATION, "invoice_ready", SHIPPER, FACTORING)
            .effect(EffectKind.DOCUMENT, "generate_invoice_pdf")
            .build());
        transitions.add(TransitionDefinition.builder("INVOICED_TO_DISPUTED")
            .from(INVOICED).to(DISPUTED)
            .trigger(TriggerType.USER_ACTION, "file_dispute")
            .actors(SHIPPER, BROKER)
            .effect(EffectKind.NOTIFICATION, "dispute_filed", CATALYST, FACTORING, ADMIN)
            .effect(EffectKind.EMAIL, "dispute_notification", CATALYST, ADMIN)
            .priority(2)
            .build());
        transitions.add(TransitionDefinition.builder("INVOICED_TO_PAID")
            .from(INVOICED).to(PAID)
            .trigger(TriggerType.PAYMENT, "payment_received")
            .actors(FACTORING, ADMIN, SUPER_ADMIN)
            .guard(GuardKind.APPROVAL, "payment_amount_valid", "Payment amount does not match invoice")
            .effect(EffectKind.NOTIFICATION, "payment_received", SHIPPER, CATALYST, DISPATCH)
            .effect(EffectKind.FINANCIAL, "process_settlement")
            .effect(EffectKind.BROADCAST, "payment_received")
            .build());
        transitions.add(TransitionDefinition.builder("DISPUTED_TO_INVOICED")
            .from(DISPUTED).to(INVOICED)
            .trigger(TriggerType.USER_ACTION, "resolve_dispute")
            .actors(ADMIN, SUPER_ADMIN)
            .effect(EffectKind.NOTIFICATION, "dispute_resolved", SHIPPER, CATALYST, FACTORING)
            .build());
        transitions.add(TransitionDefinition.builder("PAID_TO_COMPLETE")
            .from(PAID).to(COMPLETE)
            .trigger(TriggerType.SYSTEM, "settlement_complete")
            .actors(ADMIN, SUPER_ADMIN, FACTORING, SYSTEM)
            .effect(EffectKind.NOTIFICATION, "load_complete", SHIPPER, CATALYST, DRIVER)
            .effect(EffectKind.FINANCIAL, "close_load_ledger")
            .effect(EffectKind.DATABASE, "archive_load")
            .build());

        // EXCEPTION
        transitions.add(TransitionDefinition.builder("ANY_TO_CANCELLED")
            .from(DRAFT, POSTED, BIDDING, AWARDED, DECLINED, LAPSED, ACCEPTED, ASSIGNED, CONFIRMED).to(CANCELLED)
            .trigger(TriggerType.USER_ACTION, "cancel_load")
            .actors(SHIPPER, BROKER, ADMIN, SUPER_ADMIN)
            .effect(EffectKind.NOTIFICATION, "load_cancelled", CATALYST, DRIVER, DISPATCH)
            .effect(EffectKind.FINANCIAL, "apply_cancellation_penalty")
            .effect(EffectKind.FINANCIAL, "release_escrow")
            .effect(EffectKind.BROADCAST, "load_cancelled")
            .priority(10)
            .build());
        transitions.add(TransitionDefinition.builder("EXECUTION_TO_ON_HOLD")
            .from(EN_ROUTE_PICKUP, AT_PICKUP, LOADING, IN_TRANSIT, AT_DELIVERY, UNLOADING)
            .from(TEMP_EXCURSION, REEFER_BREAKDOWN, CONTAMINATION_REJECT, SEAL_BREACH, WEIGHT_VIOLATION)
            .to(ON_HOLD)
            .trigger(TriggerType.USER_ACTION, "place_on_hold")
            .actors(COMPLIANCE_OFFICER, SAFETY_MANAGER, ADMIN, SUPER_ADMIN)
            .effect(EffectKind.NOTIFICATION, "load_on_hold", DRIVER, DISPATCH, SHIPPER, CATALYST)
            .effect(EffectKind.BROADCAST, "load_on_hold")
            .priority(5)
            .build());
        transitions.add(TransitionDefinition.builder("ON_HOLD_TO_PREVIOUS")
            .from(ON_HOLD).to(IN_TRANSIT)
            .trigger(TriggerType.USER_ACTION, "release_hold")
            .actors(COMPLIANCE_OFFICER, SAFETY_MANAGER, ADMIN, SUPER_ADMIN)
            .effect(EffectKind.NOTIFICATION, "hold_released", DRIVER, DISPATCH, SHIPPER, CATALYST)
            .effect(EffectKind.BROADCAST, "hold_released")
            .build());

        // CARGO EXCEPTIONS
        transitions.add(cargoExceptionReport("REPORT_TEMP_EXCURSION", TEMP_EXCURSION, TriggerType.ELD_EVENT, "temperature_excursion")
            .build());
        transitions.add(cargoExceptionReport("REPORT_REEFER_BREAKDOWN", REEFER_BREAKDOWN, TriggerType.ELD_EVENT, "reefer_failure")
            .effect(EffectKind.FINANCIAL, "start_layover_timer")
            .build());
        transitions.add(cargoExceptionReport("REPORT_CONTAMINATION", CONTAMINATION_REJECT, TriggerType.EXCEPTION, "contamination_detected")
            .effect(EffectKind.FINANCIAL, "apply_washout_charge")
            .build());
        transitions.add(cargoExceptionReport("REPORT_SEAL_BREACH", SEAL_BREACH, TriggerType.EXCEPTION, "seal_breach_detected")
            .build());
        transitions.add(cargoExceptionReport("REPORT_WEIGHT_VIOLATION", WEIGHT_VIOLATION, TriggerType.EXCEPTION, "weight_violation_detected")
            .effect(EffectKind.FINANCIAL, "apply_reweigh_fee")
            .build());
        transitions.add(TransitionDefinition.builder("CARGO_EXCEPTION_TO_IN_TRANSIT")
            .from(TEMP_EXCURSION, REEFER_BREAKDOWN, CONTAMINATION_REJECT, SEAL_BREACH, WEIGHT_VIOLATION)
            .to(IN_TRANSIT)
            .trigger(TriggerType.USER_ACTION, "resolve_cargo_exception")
            .actors(DISPATCH, SAFETY_MANAGER, COMPLIANCE_OFFICER, ADMIN, SUPER_ADMIN)
            .effect(EffectKind.NOTIFICATION, "cargo_exception_resolved", SHIPPER, DISPATCH, DRIVER)
            .effect(EffectKind.FINANCIAL, "stop_layover_timer")
            .effect(EffectKind.BROADCAST, "exception_resolved")
            .build());

        return List.copyOf(transitions);
    }

    private static TransitionDefinition.Builder cargoExceptionReport(
        String id, LoadState target, TriggerType trigger, String event
    ) {
        return TransitionDefinition.builder(id)
            .from(CARGO_EXCEPTION_SOURCES).to(target)
            .trigger(trigger, event)
            .actors(CARGO_EXCEPTION_REPORTERS)
            .effect(EffectKind.NOTIFICATION, "cargo_exception", SHIPPER, DISPATCH, CATALYST, SAFETY_MANAGER)
            .effect(EffectKind.BROADCAST, "exception_reported")
            .priority(3);
    }

    private static StateMetadata cargoException(LoadState state, String displayName, String description, String financialImpact) {
        return state(state, StateCategory.EXCEPTION, displayName, description)
            .primary(DRIVER, DISPATCH)
            .allowed(CARGO_EXCEPTION_REPORTERS)
            .allowed(COMPLIANCE_OFFICER, ADMIN, SUPER_ADMIN)
            .gps()
            .documents(LoadDocument.EXCEPTION_PHOTOS)
            .financialImpact(financialImpact)
            .exception()
            .build();
    }

    private static MetadataBuilder state(LoadState state, StateCategory category, String displayName, String description) {
        return new MetadataBuilder(state, category, displayName, description);
    }

    private static final class MetadataBuilder {

        private final LoadState state;
        private final StateCategory category;
        private final String displayName;
        private final String description;
        private final EnumSet<ActorRole> primary = EnumSet.noneOf(ActorRole.class);
        private final EnumSet<ActorRole> allowed = EnumSet.noneOf(ActorRole.class);
        private final List<LoadDocument> documents = new ArrayList<>();
        private boolean gpsRequired;
        private String financialImpact;
        private AutoTransition autoTransition;
        private boolean isFinal;
        private boolean isException;

        private MetadataBuilder(LoadState state, StateCategory category, String displayName, String description) {
            this.state = state;
            this.category = category;
            this.displayName = displayName;
            this.description = description;
        }

        MetadataBuilder primary(ActorRole... roles) {
            primary.addAll(Arrays.asList(roles));
            return this;
        }

        MetadataBuilder allowed(ActorRole... roles) {
            allowed.addAll(Arrays.asList(roles));
            return this;
        }

        MetadataBuilder documents(LoadDocument... required) {
            documents.addAll(Arrays.asList(required));
            return this;
        }

        MetadataBuilder gps() {
            this.gpsRequired = true;
            return this;
        }

        MetadataBuilder financialImpact(String impact) {
            this.financialImpact = impact;
            return this;
        }

        MetadataBuilder auto(String transitionId, LoadState target, Duration timeout, String condition) {
            this.autoTransition = new AutoTransition(transitionId, target, timeout, condition);
            return this;
        }

        MetadataBuilder terminal() {
            this.isFinal = true;
            return this;
        }

        MetadataBuilder exception() {
            this.isException = true;
            return this;
        }

        StateMetadata build() {
            return new StateMetadata(state, category, displayName, description, primary, allowed,
                gpsRequired, documents, financialImpact, autoTransition, isFinal, isException);
        }
    }
}
