/**
 * Load and escort state enumerations.
 *
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.core.statemachine.LoadState} - Primary lifecycle states</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.statemachine.EscortState} - Convoy-side states</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.statemachine.EscortTransitions} - Allowed escort moves</li>
 * </ul>
 *
 * <p>Load transitions are data, held by {@link com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog}.</p>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.statemachine;
