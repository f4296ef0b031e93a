package com.ryuqq.loadlifecycle.core.spi;

/**
 * Gateway to external delivery systems.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface OutboundGateway {

    /**
     * Sends one message.
     *
     * @param message the message
     * @throws RuntimeException if the external system rejects or cannot be reached
     */
    void send(OutboundMessage message);
}
