/**
 * In-memory store implementations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryLoadStore} - Load snapshots and audit trail</li>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryConvoyStore} - Convoy snapshots and sync audit trail</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.adapter.inmemory.store;
