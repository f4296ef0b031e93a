/**
 * Service Provider Interface (SPI) package.
 *
 * <p>Interfaces implemented by infrastructure adapters to provide persistence, real-time
 * push, effect delivery and external checks to the lifecycle engine and convoy layer.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.LoadStore} - Load snapshots, atomic state commit, audit trail</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.ConvoyStore} - Convoy snapshots and sync audit trail</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.BroadcastChannel} - Channel broadcast and per-user notification</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.EffectDispatcher} - Fire-and-forget effect delivery</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.EffectHandler} - Delivery of one effect kind</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.HoursOfServiceService} - HOS lookup</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.ApprovalService} - Rate and payment limit checks</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.FinancialLedger} - Ledger writes</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.spi.OutboundGateway} - Email, SMS, document and integration calls</li>
 * </ul>
 *
 * <h2>Concurrency</h2>
 * <p>Stores serialize writes per entity with a version compare-and-set and report a lost
 * race as {@link com.ryuqq.loadlifecycle.core.spi.StaleVersionException}. Writes to
 * different entities must not block each other.</p>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.spi;
