package com.ryuqq.loadlifecycle.adapter.inmemory.store;

import com.ryuqq.loadlifecycle.adapter.inmemory.codec.AuditRecordJsonCodec;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.spi.LoadStore;
import com.ryuqq.loadlifecycle.core.spi.StaleVersionException;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link LoadStore} SPI for testing and reference purposes.
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>loads:</strong> ConcurrentHashMap&lt;LoadId, Load&gt; - Current snapshot per load (O(1) access)</li>
 *   <li><strong>audits:</strong> ConcurrentHashMap&lt;String, CopyOnWriteArrayList&gt; - Append-only audit trail per entity</li>
 * </ul>
 *
 * <p><strong>Atomicity:</strong> {@link #commitTransition} runs the version check, the snapshot
 * replacement and the audit append inside a single {@link ConcurrentHashMap#compute} for the
 * load key, so concurrent commits on the same load are serialized and exactly one of two
 * writers holding the same version wins. Commits on different loads do not block each other.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>{@link #scanInState} is a full scan (O(N log N))</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryLoadStore implements LoadStore {

    private final ConcurrentHashMap<LoadId, Load> loads;
    private final ConcurrentHashMap<String, List<TransitionAuditRecord>> audits;
    private final AuditRecordJsonCodec auditCodec;

    public InMemoryLoadStore() {
        this(new AuditRecordJsonCodec());
    }

    public InMemoryLoadStore(AuditRecordJsonCodec auditCodec) {
        if (auditCodec == null) {
            throw new IllegalArgumentException("auditCodec cannot be null");
        }
        this.loads = new ConcurrentHashMap<>();
        this.audits = new ConcurrentHashMap<>();
        this.auditCodec = auditCodec;
    }

    @Override
    public Optional<Load> findById(LoadId loadId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        return Optional.ofNullable(loads.get(loadId));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>New load: stored as given</li>
     *   <li>Existing load: state, state-entry time, version, previous state and timers are kept</li>
     * </ul>
     */
    @Override
    public Load save(Load load) {
        if (load == null) {
            throw new IllegalArgumentException("load cannot be null");
        }
        return loads.compute(load.loadId(), (id, existing) -> {
            if (existing == null) {
                return load;
            }
            return new Load(
                id,
                existing.state(),
                existing.stateEnteredAt(),
                existing.version(),
                existing.previousState(),
                load.participants(),
                load.pickupLocation(),
                load.deliveryLocation(),
                load.rate(),
                load.pickupAt(),
                load.documents(),
                existing.activeTimers()
            );
        });
    }

    @Override
    public Load commitTransition(Load updated, long expectedVersion, TransitionAuditRecord record) {
        if (updated == null) {
            throw new IllegalArgumentException("updated cannot be null");
        }
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }

        return loads.compute(updated.loadId(), (id, existing) -> {
            if (existing == null) {
                throw new IllegalArgumentException("Load not found: " + id);
            }
            if (existing.version() != expectedVersion) {
                throw new StaleVersionException(id.getValue(), expectedVersion, existing.version());
            }
            auditsOf(record.entityId()).add(record);
            return updated.withVersion(expectedVersion + 1);
        });
    }

    @Override
    public void appendAudit(TransitionAuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        auditsOf(record.entityId()).add(record);
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Filters by state and state-entry time (exclusive cutoff)</li>
     *   <li>Orders by state-entry time (oldest first)</li>
     *   <li>Limits result to batchSize</li>
     * </ul>
     */
    @Override
    public List<Load> scanInState(LoadState state, Instant enteredBefore, int batchSize) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (enteredBefore == null) {
            throw new IllegalArgumentException("enteredBefore cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }

        return loads.values().stream()
            .filter(load -> load.state() == state)
            .filter(load -> load.stateEnteredAt().isBefore(enteredBefore))
            .sorted(Comparator.comparing(Load::stateEnteredAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public List<TransitionAuditRecord> auditTrail(LoadId loadId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        List<TransitionAuditRecord> trail = audits.get(loadId.getValue());
        return trail == null ? List.of() : List.copyOf(trail);
    }

    /**
     * Stores a snapshot as-is, bypassing the transition path.
     *
     * <p>This method is used to seed loads in arbitrary states for testing purposes.</p>
     *
     * @param load the snapshot
     * @throws IllegalArgumentException if load is null
     */
    public void seed(Load load) {
        if (load == null) {
            throw new IllegalArgumentException("load cannot be null");
        }
        loads.put(load.loadId(), load);
    }

    /**
     * Exports the audit trail in the persisted row layout, one JSON document per record.
     *
     * @param loadId the load ID
     * @return encoded rows in append order (empty if none)
     * @throws IllegalArgumentException if loadId is null or a record cannot be encoded
     */
    public List<String> exportAuditTrail(LoadId loadId) {
        return auditTrail(loadId).stream()
            .map(auditCodec::encode)
            .collect(Collectors.toList());
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        loads.clear();
        audits.clear();
    }

    private List<TransitionAuditRecord> auditsOf(String entityId) {
        return audits.computeIfAbsent(entityId, key -> new CopyOnWriteArrayList<>());
    }
}
