package com.ryuqq.loadlifecycle.core.spi;

/**
 * Real-time push SPI.
 *
 * <p>Delivery is best-effort: callers treat a thrown exception as a notification failure
 * that never reverts an already committed state change.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface BroadcastChannel {

    /**
     * Publishes a message to every subscriber of a channel.
     *
     * @param channelKey the channel key (see {@link ChannelKeys})
     * @param message the message
     * @throws IllegalArgumentException if any argument is null
     * @throws IllegalStateException if the channel is not running
     */
    void broadcast(String channelKey, BroadcastMessage message);

    /**
     * Delivers a notification to one user.
     *
     * @param userId the recipient
     * @param notification the notification
     * @throws IllegalArgumentException if any argument is null
     * @throws IllegalStateException if the channel is not running
     */
    void notifyUser(String userId, UserNotification notification);
}
