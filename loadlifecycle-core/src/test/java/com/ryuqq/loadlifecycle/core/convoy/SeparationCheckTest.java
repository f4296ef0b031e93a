package com.ryuqq.loadlifecycle.core.convoy;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SeparationCheck 판정 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class SeparationCheckTest {

    private final SeparationConfig config = new SeparationConfig();

    @Test
    void evaluate_LeadBeyondLimit_Alerts() {
        // When
        SeparationCheck check = SeparationCheck.evaluate(config, 1300.0, 500.0, 0);

        // Then
        assertTrue(check.isAlert());
        assertTrue(check.leadAlert());
        assertFalse(check.rearAlert());
        assertEquals(1, check.consecutiveAlerts());
        assertFalse(check.autoHold());
        assertEquals("Separation alert: Lead escort 1300m away (max 1200m)", check.message());
    }

    @Test
    void evaluate_BothBeyondLimit_ListsBoth() {
        SeparationCheck check = SeparationCheck.evaluate(config, 1250.0, 850.0, 0);

        assertEquals("Separation alert: Lead escort 1250m away (max 1200m); Rear escort 850m away (max 800m)",
            check.message());
    }

    @Test
    void evaluate_AtLimit_IsWarningNotAlert() {
        // 한계값 자체는 초과가 아님
        SeparationCheck check = SeparationCheck.evaluate(config, 1200.0, null, 2);

        assertFalse(check.isAlert());
        assertTrue(check.isWarning());
        assertEquals(0, check.consecutiveAlerts());
        assertTrue(check.message().startsWith("Separation warning: "));
    }

    @Test
    void evaluate_RearAboveEightyPercent_Warns() {
        SeparationCheck check = SeparationCheck.evaluate(config, null, 700.0, 0);

        assertTrue(check.rearWarning());
        assertEquals("Separation warning: Rear escort 700m away (max 800m)", check.message());
    }

    @Test
    void evaluate_ThirdConsecutiveAlert_AutoHolds() {
        SeparationCheck check = SeparationCheck.evaluate(config, 1500.0, null, 2);

        assertEquals(3, check.consecutiveAlerts());
        assertTrue(check.autoHold());
    }

    @Test
    void evaluate_NoDistances_Clear() {
        SeparationCheck check = SeparationCheck.evaluate(config, null, null, 1);

        assertFalse(check.isAlert());
        assertFalse(check.isWarning());
        assertNull(check.message());
        assertEquals(0, check.consecutiveAlerts());
    }

    @Test
    void config_InvalidValues_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> config.withMaxLeadDistanceMeters(0));
        assertThrows(IllegalArgumentException.class, () -> config.withWarningThresholdPct(1.5));
        assertThrows(IllegalArgumentException.class, () -> config.withAutoHoldAfterAlerts(0));
        assertThrows(IllegalArgumentException.class, () -> config.withAlertIntervalSeconds(-1));
    }
}
