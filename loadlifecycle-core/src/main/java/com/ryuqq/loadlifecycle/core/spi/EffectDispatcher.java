package com.ryuqq.loadlifecycle.core.spi;

import java.util.List;

/**
 * Fire-and-forget effect delivery boundary.
 *
 * <p>The engine calls {@link #dispatch} after a state commit. Implementations must not
 * block the caller on delivery and must never throw delivery failures back to it.
 * Requests of one call are submitted in list order; completion order is not guaranteed.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface EffectDispatcher {

    /**
     * Submits effects for asynchronous delivery.
     *
     * @param requests effects in declared order
     * @throws IllegalArgumentException if requests is null
     */
    void dispatch(List<EffectRequest> requests);
}
