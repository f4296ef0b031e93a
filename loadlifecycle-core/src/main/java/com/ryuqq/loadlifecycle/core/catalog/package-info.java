/**
 * State and transition catalog.
 *
 * <p>The static definitions in {@link com.ryuqq.loadlifecycle.core.catalog.LoadLifecycleDefinitions}
 * are indexed once by {@link com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog} into an arena
 * plus a source-state index. Guards and effects are descriptors only; they are bound to
 * evaluators and handlers by the runner.</p>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.catalog;
