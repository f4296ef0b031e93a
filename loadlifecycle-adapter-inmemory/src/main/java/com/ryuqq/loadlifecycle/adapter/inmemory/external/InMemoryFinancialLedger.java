package com.ryuqq.loadlifecycle.adapter.inmemory.external;

import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.spi.FinancialLedger;
import com.ryuqq.loadlifecycle.core.spi.LedgerEntry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link FinancialLedger}.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryFinancialLedger implements FinancialLedger {

    private final List<LedgerEntry> entries = new CopyOnWriteArrayList<>();

    @Override
    public void record(LedgerEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        entries.add(entry);
    }

    @Override
    public List<LedgerEntry> entries(LoadId loadId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        return entries.stream()
            .filter(entry -> entry.loadId().equals(loadId))
            .collect(Collectors.toList());
    }

    public List<LedgerEntry> allEntries() {
        return List.copyOf(entries);
    }
}
