package com.ryuqq.loadlifecycle.testkit.contract;

import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoints;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for time-driven transitions.
 *
 * <p>Validates that the scheduled sweeps move loads out of states whose auto-transition
 * window has elapsed, and escalate convoys that wait too long at a sync point.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>POSTED: nothing happens before 72h, EXPIRED after</li>
 *   <li>AWARDED: LAPSED after 2h, then reposted by the shipper</li>
 *   <li>ASSIGNED: LAPSED after the 60 minute confirmation window</li>
 *   <li>POD_PENDING: auto-approved to DELIVERED after 24h with escrow capture</li>
 *   <li>Convoy at staging for more than 60 minutes: one dispatch escalation</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class TimeoutSweepContractTest extends AbstractContractTest {

    @Test
    void testSweep_PostedBeforeDeadline_NoChange() {
        // Given: posted load, 71 hours later
        LoadId loadId = seedPublishableDraft("LOAD-TO-01");
        driveTo(loadId, LoadState.POSTED);
        clock.advance(Duration.ofHours(71));

        // When
        SweepReport report = sweepRunner.runOnce();

        // Then
        assertEquals(0, report.applied());
        assertLoadState(loadId, LoadState.POSTED);
    }

    @Test
    void testSweep_PostedPastDeadline_Expires() {
        // Given: posted load, 73 hours later
        LoadId loadId = seedPublishableDraft("LOAD-TO-02");
        driveTo(loadId, LoadState.POSTED);
        clock.advance(Duration.ofHours(73));

        // When
        SweepReport report = sweepRunner.runOnce();
        awaitEffects();

        // Then: expired by the system, shipper told
        assertEquals(1, report.applied());
        assertLoadState(loadId, LoadState.EXPIRED);

        List<TransitionAuditRecord> history = engine.getStateHistory(loadId);
        TransitionAuditRecord last = history.get(history.size() - 1);
        assertEquals("POSTED_TO_EXPIRED", last.transitionId());
        assertEquals("TIMEOUT", last.triggerType());
        assertEquals(ActorRole.SYSTEM, last.actorRole());
        assertTrue(last.guardsPassed().contains("past_deadline"));

        assertTrue(hub.notifications(SHIPPER.actorId()).stream()
            .anyMatch(notification -> notification.type().equals("load_expired")));
    }

    @Test
    void testSweep_ExpiredLoad_NotSweptAgain() {
        // Given: already expired
        LoadId loadId = seedPublishableDraft("LOAD-TO-03");
        driveTo(loadId, LoadState.POSTED);
        clock.advance(Duration.ofHours(73));
        sweepRunner.runOnce();

        // When: much later
        clock.advance(Duration.ofDays(30));
        SweepReport report = sweepRunner.runOnce();

        // Then: terminal state has no auto transition
        assertEquals(0, report.scanned());
        assertLoadState(loadId, LoadState.EXPIRED);
    }

    @Test
    void testSweep_AwardNotAccepted_LapsesAndCanBeReposted() {
        // Given: awarded, carrier silent for just over 2 hours
        LoadId loadId = seedPublishableDraft("LOAD-TO-04");
        driveTo(loadId, LoadState.AWARDED);
        clock.advance(Duration.ofMinutes(121));

        // When
        sweepRunner.runOnce();

        // Then
        assertLoadState(loadId, LoadState.LAPSED);

        // When: shipper reposts
        commit(loadId, "DECLINED_TO_POSTED", SHIPPER, TransitionContext.empty());

        // Then
        assertLoadState(loadId, LoadState.POSTED);
    }

    @Test
    void testSweep_DriverNeverConfirms_AssignmentLapses() {
        // Given
        LoadId loadId = seedPublishableDraft("LOAD-TO-05");
        driveTo(loadId, LoadState.ASSIGNED);
        clock.advance(Duration.ofMinutes(61));

        // When
        sweepRunner.runOnce();

        // Then
        assertLoadState(loadId, LoadState.LAPSED);
        List<TransitionAuditRecord> history = engine.getStateHistory(loadId);
        assertEquals("ASSIGNED_TO_LAPSED", history.get(history.size() - 1).transitionId());
    }

    @Test
    void testSweep_PodUnreviewed_AutoApprovedWithEscrowCapture() {
        // Given: POD submitted, nobody reviewed it for a day
        LoadId loadId = seedPublishableDraft("LOAD-TO-06");
        driveTo(loadId, LoadState.POD_PENDING);
        clock.advance(Duration.ofHours(24).plusMinutes(1));

        // When
        sweepRunner.runOnce();
        awaitEffects();

        // Then
        assertLoadState(loadId, LoadState.DELIVERED);
        List<TransitionAuditRecord> history = engine.getStateHistory(loadId);
        assertEquals("POD_AUTO_APPROVE", history.get(history.size() - 1).transitionId());
        assertTrue(ledger.entries(loadId).stream()
            .anyMatch(entry -> entry.action().equals("capture_escrow") && RATE.compareTo(entry.amount()) == 0));
    }

    @Test
    void testSweep_ConvoyStuckAtStaging_EscalatesOnce() {
        // Given: escorts staged while the load is still waiting for a driver
        LoadId loadId = seedPublishableDraft("LOAD-TO-07");
        driveTo(loadId, LoadState.ACCEPTED);
        Convoy convoy = stageConvoy(loadId);
        assertEquals(EscortState.STAGING_COMPLETE, convoy.status());
        clock.advance(Duration.ofMinutes(61));

        // When: swept twice
        SweepReport first = sweepRunner.runOnce();
        SweepReport second = sweepRunner.runOnce();

        // Then: dispatch hears about it exactly once
        assertEquals(1, first.applied());
        assertEquals(0, second.applied());

        List<BroadcastMessage> escalations = hub.messages(ChannelKeys.DISPATCH_UPDATES).stream()
            .filter(message -> message.event().equals(BroadcastMessage.DISPATCH_ESCALATION))
            .toList();
        assertEquals(1, escalations.size());
        assertEquals(SyncPoints.SYNC_CONFIRMED.id(), escalations.get(0).data().get("syncPointId"));
        assertEquals(61L, escalations.get(0).data().get("waitedMinutes"));

        // When: the load finally confirms
        driveTo(loadId, LoadState.CONFIRMED);

        // Then: the convoy moves on
        assertEscortState(convoy.convoyId(), EscortState.AWAITING_PRIMARY);
    }
}
