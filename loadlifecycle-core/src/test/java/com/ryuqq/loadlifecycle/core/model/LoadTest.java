package com.ryuqq.loadlifecycle.core.model;

import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Load 스냅샷 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class LoadTest {

    private static final Instant CREATED_AT = Instant.parse("2026-03-01T08:00:00Z");
    private static final LoadId LOAD_ID = LoadId.of("load-1");

    @Test
    void draft_NewLoad_StartsInDraftWithShipper() {
        // When
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT);

        // Then
        assertEquals(LoadState.DRAFT, load.state());
        assertEquals(CREATED_AT, load.stateEnteredAt());
        assertEquals(0, load.version());
        assertEquals("shipper-1", load.participant(ActorRole.SHIPPER).orElseThrow());
        assertTrue(load.participant(ActorRole.DRIVER).isEmpty());
        assertTrue(load.documents().isEmpty());
        assertTrue(load.activeTimers().isEmpty());
    }

    @Test
    void withState_KeepsVersionAndOtherFields() {
        // Given
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT)
            .withRate(new BigDecimal("1800.00"))
            .withVersion(4);
        Instant enteredAt = CREATED_AT.plusSeconds(600);

        // When
        Load posted = load.withState(LoadState.POSTED, enteredAt);

        // Then
        assertEquals(LoadState.POSTED, posted.state());
        assertEquals(enteredAt, posted.stateEnteredAt());
        assertEquals(4, posted.version());
        assertEquals(new BigDecimal("1800.00"), posted.rate());
        assertEquals(LoadState.DRAFT, load.state());
    }

    @Test
    void withDocuments_AddsToExistingDocuments() {
        // Given
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT).withDocuments(Set.of(LoadDocument.BOL_SIGNED));

        // When
        Load updated = load.withDocuments(Set.of(LoadDocument.POD_PHOTO));

        // Then
        assertTrue(updated.hasDocument(LoadDocument.BOL_SIGNED));
        assertTrue(updated.hasDocument(LoadDocument.POD_PHOTO));
        assertFalse(load.hasDocument(LoadDocument.POD_PHOTO));
    }

    @Test
    void withTimer_StartAndStop() {
        // Given
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT);

        // When
        Load started = load.withTimer(FinancialTimer.DETENTION, true);
        Load stopped = started.withTimer(FinancialTimer.DETENTION, false);

        // Then
        assertTrue(started.isTimerActive(FinancialTimer.DETENTION));
        assertFalse(stopped.isTimerActive(FinancialTimer.DETENTION));
    }

    @Test
    void withParticipant_ReplacesRole() {
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT)
            .withParticipant(ActorRole.DRIVER, "driver-1")
            .withParticipant(ActorRole.DRIVER, "driver-2");

        assertEquals("driver-2", load.participant(ActorRole.DRIVER).orElseThrow());
    }

    @Test
    void participants_AreImmutable() {
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT);

        assertThrows(UnsupportedOperationException.class, () -> load.participants().put(ActorRole.DRIVER, "driver-1"));
    }

    @Test
    void constructor_NegativeVersion_ThrowsException() {
        Load load = Load.draft(LOAD_ID, "shipper-1", CREATED_AT);

        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () -> load.withVersion(-1));
        assertTrue(exception.getMessage().contains("version cannot be negative"));
    }

    @Test
    void financialTimer_ResolvesFromEffectAction() {
        assertEquals(FinancialTimer.DETENTION, FinancialTimer.startedBy("start_detention_timer").orElseThrow());
        assertEquals(FinancialTimer.LAYOVER, FinancialTimer.stoppedBy("stop_layover_timer").orElseThrow());
        assertTrue(FinancialTimer.startedBy("capture_escrow").isEmpty());
    }
}
