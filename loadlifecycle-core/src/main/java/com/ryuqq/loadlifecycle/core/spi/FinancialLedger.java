package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.LoadId;

import java.util.List;

/**
 * Financial ledger boundary.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface FinancialLedger {

    void record(LedgerEntry entry);

    List<LedgerEntry> entries(LoadId loadId);
}
