/**
 * Transition attempt outcome package.
 *
 * <p>Domain failures are returned as values, never thrown.</p>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.core.outcome.Committed} - State committed, effects handed to the dispatcher</li>
 *   <li>{@link com.ryuqq.loadlifecycle.core.outcome.Rejected} - Load unchanged, carries one {@link com.ryuqq.loadlifecycle.core.outcome.TransitionError}</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * TransitionOutcome outcome = lifecycle.attemptTransition(loadId, "LOADED_TO_IN_TRANSIT", driver, context);
 * if (outcome instanceof Rejected rejected
 *         &amp;&amp; rejected.code() == TransitionErrorCode.CONCURRENT_MODIFICATION) {
 *     // re-read and retry
 * }
 * </pre>
 *
 * @since 1.0.0
 * @author LoadLifecycle Team
 */
package com.ryuqq.loadlifecycle.core.outcome;
