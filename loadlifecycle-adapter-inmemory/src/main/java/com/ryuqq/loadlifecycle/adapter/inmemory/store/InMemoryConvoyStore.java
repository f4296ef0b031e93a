package com.ryuqq.loadlifecycle.adapter.inmemory.store;

import com.ryuqq.loadlifecycle.adapter.inmemory.codec.AuditRecordJsonCodec;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.spi.ConvoyStore;
import com.ryuqq.loadlifecycle.core.spi.StaleVersionException;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link ConvoyStore} SPI for testing and reference purposes.
 *
 * <p>Version checks run inside {@link ConcurrentHashMap#compute} per convoy key.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryConvoyStore implements ConvoyStore {

    private final ConcurrentHashMap<ConvoyId, Convoy> convoys = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<TransitionAuditRecord>> audits = new ConcurrentHashMap<>();
    private final AuditRecordJsonCodec auditCodec;

    public InMemoryConvoyStore() {
        this(new AuditRecordJsonCodec());
    }

    public InMemoryConvoyStore(AuditRecordJsonCodec auditCodec) {
        if (auditCodec == null) {
            throw new IllegalArgumentException("auditCodec cannot be null");
        }
        this.auditCodec = auditCodec;
    }

    @Override
    public Optional<Convoy> findById(ConvoyId convoyId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        return Optional.ofNullable(convoys.get(convoyId));
    }

    @Override
    public Optional<Convoy> findActiveByLoad(LoadId loadId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        return convoys.values().stream()
            .filter(convoy -> convoy.loadId().equals(loadId))
            .filter(Convoy::isActive)
            .min(Comparator.comparing(Convoy::statusEnteredAt));
    }

    @Override
    public Convoy insert(Convoy convoy) {
        if (convoy == null) {
            throw new IllegalArgumentException("convoy cannot be null");
        }
        Convoy previous = convoys.putIfAbsent(convoy.convoyId(), convoy);
        if (previous != null) {
            throw new IllegalStateException("Convoy already exists: " + convoy.convoyId());
        }
        return convoy;
    }

    @Override
    public Convoy update(Convoy convoy, long expectedVersion) {
        if (convoy == null) {
            throw new IllegalArgumentException("convoy cannot be null");
        }
        return convoys.compute(convoy.convoyId(), (id, existing) -> {
            if (existing == null) {
                throw new IllegalArgumentException("Convoy not found: " + id);
            }
            if (existing.version() != expectedVersion) {
                throw new StaleVersionException(id.getValue(), expectedVersion, existing.version());
            }
            return convoy.withVersion(expectedVersion + 1);
        });
    }

    @Override
    public List<Convoy> scanActive(int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, but was: " + batchSize);
        }
        return convoys.values().stream()
            .filter(Convoy::isActive)
            .sorted(Comparator.comparing(Convoy::statusEnteredAt))
            .limit(batchSize)
            .collect(Collectors.toList());
    }

    @Override
    public void appendAudit(TransitionAuditRecord record) {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        audits.computeIfAbsent(record.entityId(), key -> new CopyOnWriteArrayList<>()).add(record);
    }

    @Override
    public List<TransitionAuditRecord> auditTrail(ConvoyId convoyId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        List<TransitionAuditRecord> trail = audits.get(convoyId.getValue());
        return trail == null ? List.of() : List.copyOf(trail);
    }

    /**
     * Exports the audit trail in the persisted row layout, one JSON document per record.
     *
     * @param convoyId the convoy ID
     * @return encoded rows in append order (empty if none)
     * @throws IllegalArgumentException if convoyId is null or a record cannot be encoded
     */
    public List<String> exportAuditTrail(ConvoyId convoyId) {
        return auditTrail(convoyId).stream()
            .map(auditCodec::encode)
            .collect(Collectors.toList());
    }

    /**
     * Clears all stored data.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        convoys.clear();
        audits.clear();
    }
}
