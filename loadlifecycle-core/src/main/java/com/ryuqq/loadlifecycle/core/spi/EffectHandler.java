package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;

import java.util.Set;

/**
 * Delivers effects of one or more kinds.
 *
 * <p>A handler signals a delivery failure by throwing; the dispatcher retries and
 * eventually dead-letters the request.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface EffectHandler {

    /**
     * Effect kinds this handler delivers.
     *
     * @return non-empty set of kinds
     */
    Set<EffectKind> kinds();

    /**
     * Delivers one effect.
     *
     * @param request the effect request
     * @throws RuntimeException on delivery failure
     */
    void handle(EffectRequest request);
}
