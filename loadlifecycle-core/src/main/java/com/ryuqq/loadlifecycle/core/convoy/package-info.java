/**
 * Convoy model.
 *
 * <h2>Contents</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.core.convoy.Convoy} - Escort unit snapshot linked to one load</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.convoy.SyncPoints} - Ordered sync points between load and escort states</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.convoy.CargoExceptions} - Load states that pause the convoy</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.convoy.SeparationCheck} - Distance threshold evaluation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.convoy;
