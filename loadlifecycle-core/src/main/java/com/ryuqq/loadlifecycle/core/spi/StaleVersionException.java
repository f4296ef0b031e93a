package com.ryuqq.loadlifecycle.core.spi;

/**
 * Thrown by a store when a compare-and-set on the entity version fails.
 *
 * <p>The caller read a snapshot that another writer has already replaced.
 * Nothing was written; the caller must re-read and retry.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class StaleVersionException extends RuntimeException {

    private final String entityId;
    private final long expectedVersion;
    private final long actualVersion;

    public StaleVersionException(String entityId, long expectedVersion, long actualVersion) {
        super("Stale version for " + entityId + " (expected: " + expectedVersion + ", actual: " + actualVersion + ")");
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getEntityId() {
        return entityId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
