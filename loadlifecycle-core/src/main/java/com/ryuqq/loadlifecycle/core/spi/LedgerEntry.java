package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.LoadId;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Financial ledger line written by a FINANCIAL effect.
 *
 * <p>Amount computation is outside this system; {@code amount} carries the load rate
 * where one applies, otherwise null.</p>
 *
 * @param loadId the load
 * @param action the financial action (e.g. capture_escrow, start_detention_timer)
 * @param transitionId the committing transition
 * @param amount associated amount (nullable)
 * @param recordedAt effect time
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record LedgerEntry(
    LoadId loadId,
    String action,
    String transitionId,
    BigDecimal amount,
    Instant recordedAt
) {

    public LedgerEntry {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        if (recordedAt == null) {
            throw new IllegalArgumentException("recordedAt cannot be null");
        }
    }
}
