package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistent storage SPI for loads and their transition audit trail.
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Single read of the current load snapshot</li>
 *   <li>Atomic state commit together with one success audit record</li>
 *   <li>Append-only audit trail for failed attempts</li>
 *   <li>Timeout candidate scanning by persisted state-entry timestamp (auto-transition sweeper)</li>
 * </ul>
 *
 * <p><strong>Commit Transaction Boundary:</strong></p>
 * <pre>
 * BEGIN TRANSACTION;
 *   UPDATE loads SET state = ?, state_entered_at = ?, ..., version = version + 1
 *     WHERE load_id = ? AND version = ?;          -- 0 rows → StaleVersionException
 *   INSERT INTO load_state_transitions (...) VALUES (...);
 * COMMIT;
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: all methods callable from multiple threads</li>
 *   <li>Per-load serialization: concurrent commits on the same load yield exactly one winner</li>
 *   <li>No last-writer-wins: a version mismatch never overwrites</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface LoadStore {

    /**
     * Reads the current snapshot.
     *
     * @param loadId the load ID
     * @return the snapshot, or empty if the load does not exist
     * @throws IllegalArgumentException if loadId is null
     */
    Optional<Load> findById(LoadId loadId);

    /**
     * Inserts or replaces a load outside of the transition path (creation, route or rate edits).
     *
     * <p>State changes must go through {@link #commitTransition}. Implementations keep the
     * stored state and version when the load already exists and only replace the remaining
     * fields.</p>
     *
     * @param load the load
     * @return the stored snapshot
     * @throws IllegalArgumentException if load is null
     */
    Load save(Load load);

    /**
     * Atomically replaces the snapshot and appends the success audit record.
     *
     * @param updated the new snapshot (its version is ignored)
     * @param expectedVersion the version the caller read
     * @param record the success audit record
     * @return the stored snapshot with {@code expectedVersion + 1}
     * @throws StaleVersionException if the stored version differs from expectedVersion
     * @throws IllegalArgumentException if any argument is null or the load does not exist
     */
    Load commitTransition(Load updated, long expectedVersion, TransitionAuditRecord record);

    /**
     * Appends an audit record without touching the load (failed attempts).
     *
     * @param record the audit record
     * @throws IllegalArgumentException if record is null
     */
    void appendAudit(TransitionAuditRecord record);

    /**
     * Scans loads that entered the given state before the cutoff.
     *
     * <p><strong>Query Example:</strong></p>
     * <pre>
     * SELECT * FROM loads
     * WHERE state = ? AND state_entered_at &lt; ?
     * ORDER BY state_entered_at ASC
     * LIMIT ?;
     * </pre>
     *
     * @param state the state to scan
     * @param enteredBefore exclusive cutoff on the state-entry timestamp
     * @param batchSize maximum number of results
     * @return matching loads, oldest first
     * @throws IllegalArgumentException if state or enteredBefore is null, or batchSize is not positive
     */
    List<Load> scanInState(LoadState state, Instant enteredBefore, int batchSize);

    /**
     * Returns the audit trail of a load in append order.
     *
     * @param loadId the load ID
     * @return audit records, oldest first (empty if none)
     */
    List<TransitionAuditRecord> auditTrail(LoadId loadId);
}
