package com.ryuqq.loadlifecycle.testkit.contract;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.FinancialTimer;
import com.ryuqq.loadlifecycle.core.model.GeoPoint;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadDocument;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.Rejected;
import com.ryuqq.loadlifecycle.core.outcome.TransitionErrorCode;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.LedgerEntry;
import com.ryuqq.loadlifecycle.core.spi.OutboundMessage;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for the full load lifecycle.
 *
 * <p>Drives a load from DRAFT to COMPLETE through the real engine, guards and effect handlers,
 * and checks that every committed step is audited and that effects reach their sinks.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>DRAFT → COMPLETE: 20 successful audit records, state chain is continuous</li>
 *   <li>Effects: notifications, broadcasts, ledger entries and outbound messages delivered</li>
 *   <li>Financial timers start and stop with pickup and delivery dwell</li>
 *   <li>Rejections leave state untouched and write a failure audit</li>
 *   <li>ON_HOLD remembers the previous state; cancellation is final</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class EndToEndLifecycleContractTest extends AbstractContractTest {

    @Test
    void testLifecycle_DraftToComplete_AuditsEveryStep() {
        // Given: a publishable draft
        LoadId loadId = seedPublishableDraft("LOAD-E2E-01");

        // When: driven along the whole happy path
        driveTo(loadId, LoadState.COMPLETE);

        // Then: final state and a continuous audit chain
        assertLoadState(loadId, LoadState.COMPLETE);

        List<TransitionAuditRecord> history = engine.getStateHistory(loadId);
        assertEquals(20, history.size());
        assertTrue(history.stream().allMatch(TransitionAuditRecord::success),
            "Every happy path step should be audited as successful");
        assertEquals("DRAFT", history.get(0).fromState());
        assertEquals("COMPLETE", history.get(history.size() - 1).toState());
        for (int i = 1; i < history.size(); i++) {
            assertEquals(history.get(i - 1).toState(), history.get(i).fromState(),
                "Audit chain broken at step " + i);
        }

        Load load = loadStore.findById(loadId).orElseThrow();
        assertEquals(20, load.version());
        assertEquals(CARRIER.actorId(), load.participant(ActorRole.CATALYST).orElseThrow());
        assertEquals(DRIVER.actorId(), load.participant(ActorRole.DRIVER).orElseThrow());
        assertTrue(load.hasDocument(LoadDocument.BOL_SIGNED));
        assertTrue(load.hasDocument(LoadDocument.POD_SIGNATURE));
    }

    @Test
    void testLifecycle_DraftToComplete_DeliversEffects() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-02");

        // When
        driveTo(loadId, LoadState.COMPLETE);
        awaitEffects();

        // Then: no effect was dead-lettered
        assertTrue(effectDispatcher.deadLetters().isEmpty(),
            "Unexpected dead letters: " + effectDispatcher.deadLetters());

        // Then: participants received their notifications
        List<String> shipperTypes = hub.notifications(SHIPPER.actorId()).stream()
            .map(UserNotification::type)
            .toList();
        assertTrue(shipperTypes.containsAll(List.of("load_posted", "carrier_accepted", "invoice_ready", "load_complete")),
            "Shipper notifications were " + shipperTypes);
        assertTrue(hub.notifications(DRIVER.actorId()).stream()
            .anyMatch(notification -> notification.type().equals("delivery_confirmed")));

        // Then: state changes were broadcast on the load channel
        List<BroadcastMessage> loadChannel = hub.messages(ChannelKeys.load(loadId));
        assertTrue(loadChannel.stream().anyMatch(message ->
            message.event().equals(BroadcastMessage.LOAD_STATE_CHANGED) && "delivered".equals(message.data().get("action"))));

        // Then: escrow, invoice and settlement were booked at the load rate
        List<LedgerEntry> entries = ledger.entries(loadId);
        for (String action : List.of("capture_escrow", "generate_invoice", "process_settlement")) {
            LedgerEntry entry = entries.stream()
                .filter(candidate -> candidate.action().equals(action))
                .findFirst()
                .orElseThrow(() -> new AssertionError("Missing ledger entry " + action));
            assertEquals(0, RATE.compareTo(entry.amount()), action + " should carry the load rate");
        }
        assertTrue(entries.stream().anyMatch(entry -> entry.action().equals("close_load_ledger")));

        // Then: outbound integrations were sent
        assertTrue(gateway.sent(EffectKind.EMAIL).stream()
            .map(OutboundMessage::action)
            .anyMatch("invoice_sent"::equals));
        assertTrue(gateway.sent(EffectKind.DOCUMENT).stream()
            .map(OutboundMessage::action)
            .anyMatch("generate_invoice_pdf"::equals));
        assertTrue(gateway.sent(EffectKind.DATABASE).stream()
            .map(OutboundMessage::action)
            .anyMatch("archive_load"::equals));
    }

    @Test
    void testLifecycle_DwellTimers_StartAndStopAtFacilities() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-03");

        // When/Then: detention runs between pickup arrival and loading complete
        driveTo(loadId, LoadState.AT_PICKUP);
        assertTrue(loadStore.findById(loadId).orElseThrow().isTimerActive(FinancialTimer.DETENTION));

        driveTo(loadId, LoadState.LOADED);
        assertFalse(loadStore.findById(loadId).orElseThrow().isTimerActive(FinancialTimer.DETENTION));

        // When/Then: demurrage runs between delivery arrival and unloading complete
        driveTo(loadId, LoadState.AT_DELIVERY);
        assertTrue(loadStore.findById(loadId).orElseThrow().isTimerActive(FinancialTimer.DEMURRAGE));

        driveTo(loadId, LoadState.UNLOADED);
        assertTrue(loadStore.findById(loadId).orElseThrow().activeTimers().isEmpty());
    }

    @Test
    void testTransition_MissingBillOfLading_RejectedWithFailureAudit() {
        // Given: a loaded trailer without a signed BOL
        LoadId loadId = seedPublishableDraft("LOAD-E2E-04");
        driveTo(loadId, LoadState.LOADED);
        int auditsBefore = engine.getStateHistory(loadId).size();

        // When
        Rejected rejected = reject(loadId, "LOADED_TO_IN_TRANSIT", DRIVER, TransitionContext.empty());

        // Then: guard failure names the check, state unchanged
        assertEquals(TransitionErrorCode.GUARD_FAILED, rejected.code());
        assertEquals("bol_signed", rejected.error().check());
        assertLoadState(loadId, LoadState.LOADED);

        List<TransitionAuditRecord> history = engine.getStateHistory(loadId);
        assertEquals(auditsBefore + 1, history.size());
        TransitionAuditRecord failure = history.get(history.size() - 1);
        assertFalse(failure.success());
        assertEquals("LOADED_TO_IN_TRANSIT", failure.transitionId());
        assertNotNull(failure.errorMessage());
    }

    @Test
    void testTransition_WrongRole_RejectedAsUnauthorized() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-05");

        // When
        Rejected rejected = reject(loadId, "DRAFT_TO_POSTED", DRIVER, TransitionContext.empty());

        // Then
        assertEquals(TransitionErrorCode.UNAUTHORIZED_ACTOR, rejected.code());
        assertLoadState(loadId, LoadState.DRAFT);
    }

    @Test
    void testTransition_DriverOutOfHours_CannotStartTrip() {
        // Given: confirmed load, driver has exhausted drive time
        LoadId loadId = seedPublishableDraft("LOAD-E2E-06");
        driveTo(loadId, LoadState.CONFIRMED);
        hoursOfService.setRemaining(DRIVER.actorId(), Duration.ZERO);

        // When
        Rejected rejected = reject(loadId, "CONFIRMED_TO_EN_ROUTE_PICKUP", DRIVER,
            TransitionContext.builder().document(LoadDocument.PRE_TRIP_INSPECTION).build());

        // Then: the document guard passed, HOS blocked
        assertEquals(TransitionErrorCode.GUARD_FAILED, rejected.code());
        assertEquals("driver_has_hours", rejected.error().check());
        assertEquals(List.of("pre_trip_complete"), rejected.guardsPassed());
        assertLoadState(loadId, LoadState.CONFIRMED);
    }

    @Test
    void testTransition_OutsidePickupGeofence_Rejected() {
        // Given: driver is still miles away from the shipper dock
        LoadId loadId = seedPublishableDraft("LOAD-E2E-07");
        driveTo(loadId, LoadState.EN_ROUTE_PICKUP);

        // When
        Rejected rejected = reject(loadId, "EN_ROUTE_TO_AT_PICKUP", DRIVER,
            TransitionContext.builder().location(GeoPoint.of(32.90, -96.80)).build());

        // Then
        assertEquals("within_pickup_geofence", rejected.error().check());
        assertLoadState(loadId, LoadState.EN_ROUTE_PICKUP);
    }

    @Test
    void testTransition_PaymentMismatch_Rejected() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-08");
        driveTo(loadId, LoadState.INVOICED);

        // When
        Rejected rejected = reject(loadId, "INVOICED_TO_PAID", FACTOR,
            TransitionContext.builder().data("paymentAmount", new BigDecimal("100.00")).build());

        // Then
        assertEquals("payment_amount_valid", rejected.error().check());
        assertLoadState(loadId, LoadState.INVOICED);
    }

    @Test
    void testHold_ReleaseReturnsToTransit() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-09");
        driveTo(loadId, LoadState.IN_TRANSIT);
        Actor safety = Actor.of("safety-1", ActorRole.SAFETY_MANAGER);

        // When: placed on hold
        commit(loadId, "EXECUTION_TO_ON_HOLD", safety, TransitionContext.empty());

        // Then: previous state remembered
        Load held = loadStore.findById(loadId).orElseThrow();
        assertEquals(LoadState.ON_HOLD, held.state());
        assertEquals(LoadState.IN_TRANSIT, held.previousState());

        // When: released
        commit(loadId, "ON_HOLD_TO_PREVIOUS", safety, TransitionContext.empty());

        // Then
        Load released = loadStore.findById(loadId).orElseThrow();
        assertEquals(LoadState.IN_TRANSIT, released.state());
        assertNull(released.previousState());
    }

    @Test
    void testCancel_BeforeDispatch_IsFinal() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-10");
        driveTo(loadId, LoadState.AWARDED);

        // When
        commit(loadId, "ANY_TO_CANCELLED", SHIPPER, TransitionContext.empty());
        awaitEffects();

        // Then: escrow released, no way out of CANCELLED
        assertLoadState(loadId, LoadState.CANCELLED);
        assertTrue(ledger.entries(loadId).stream().anyMatch(entry -> entry.action().equals("release_escrow")));
        assertTrue(engine.listAvailableTransitions(loadId, Actor.of("admin-1", ActorRole.ADMIN), TransitionContext.empty())
            .isEmpty());

        Rejected rejected = reject(loadId, "DECLINED_TO_POSTED", SHIPPER, TransitionContext.empty());
        assertEquals(TransitionErrorCode.INVALID_TRANSITION, rejected.code());
    }

    @Test
    void testCancel_AfterPickupStarted_NotAllowed() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-E2E-11");
        driveTo(loadId, LoadState.EN_ROUTE_PICKUP);

        // When
        Rejected rejected = reject(loadId, "ANY_TO_CANCELLED", SHIPPER, TransitionContext.empty());

        // Then
        assertEquals(TransitionErrorCode.INVALID_TRANSITION, rejected.code());
        assertLoadState(loadId, LoadState.EN_ROUTE_PICKUP);
    }
}
