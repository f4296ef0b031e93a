package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;

import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for convoys and their sync audit trail.
 *
 * <p>Convoy audit records reuse the {@link TransitionAuditRecord} layout with the
 * convoy id as {@code entityId}.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface ConvoyStore {

    Optional<Convoy> findById(ConvoyId convoyId);

    /**
     * Finds the active (not disbanded, not complete) convoy escorting a load.
     *
     * @param loadId the primary load ID
     * @return the active convoy, or empty
     */
    Optional<Convoy> findActiveByLoad(LoadId loadId);

    /**
     * Inserts a new convoy.
     *
     * @param convoy the convoy (version 0)
     * @return the stored snapshot
     * @throws IllegalStateException if a convoy with the same id already exists
     */
    Convoy insert(Convoy convoy);

    /**
     * Replaces a convoy with a compare-and-set on version.
     *
     * @param convoy the new snapshot (its version is ignored)
     * @param expectedVersion the version the caller read
     * @return the stored snapshot with {@code expectedVersion + 1}
     * @throws StaleVersionException if the stored version differs
     */
    Convoy update(Convoy convoy, long expectedVersion);

    /**
     * Scans active convoys.
     *
     * @param batchSize maximum number of results
     * @return active convoys ordered by status-entry time, oldest first
     */
    List<Convoy> scanActive(int batchSize);

    void appendAudit(TransitionAuditRecord record);

    List<TransitionAuditRecord> auditTrail(ConvoyId convoyId);
}
