package com.ryuqq.loadlifecycle.adapter.inmemory.broadcast;

import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Lifecycle-managed, in-process implementation of {@link BroadcastChannel}.
 *
 * <p>The hub owns its subscriber and connection registries. It is constructed, started,
 * handed to the engine and convoy layer, and stopped; there is no process-wide instance.</p>
 *
 * <p><strong>Registries:</strong></p>
 * <ul>
 *   <li><strong>channelSubscribers:</strong> channel key → subscribers</li>
 *   <li><strong>userConnections:</strong> user ID → connected clients</li>
 *   <li><strong>channelHistory / userHistory:</strong> every delivered message, for replay and assertions</li>
 * </ul>
 *
 * <p><strong>Lifecycle:</strong></p>
 * <pre>
 * InMemoryBroadcastHub hub = new InMemoryBroadcastHub();
 * hub.start();
 * hub.subscribe(ChannelKeys.load(loadId), message -&gt; ...);
 * ...
 * hub.stop();   // clears subscribers and connections; history is kept
 * </pre>
 *
 * <p>A subscriber that throws does not affect delivery to the others.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryBroadcastHub implements BroadcastChannel {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBroadcastHub.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final ConcurrentHashMap<String, List<Consumer<BroadcastMessage>>> channelSubscribers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Consumer<UserNotification>>> userConnections = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<BroadcastMessage>> channelHistory = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<UserNotification>> userHistory = new ConcurrentHashMap<>();

    /**
     * Starts accepting subscriptions and deliveries.
     *
     * @throws IllegalStateException if already running
     */
    public void start() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Broadcast hub is already running");
        }
        log.info("Broadcast hub started");
    }

    /**
     * Stops the hub and drops all subscribers and connections.
     */
    public void stop() {
        if (running.compareAndSet(true, false)) {
            int subscribers = channelSubscribers.values().stream().mapToInt(List::size).sum();
            int connections = userConnections.values().stream().mapToInt(List::size).sum();
            channelSubscribers.clear();
            userConnections.clear();
            log.info("Broadcast hub stopped: dropped {} subscribers, {} connections", subscribers, connections);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * Subscribes to a channel.
     *
     * @param channelKey the channel key
     * @param subscriber message consumer
     * @return handle that removes the subscription when closed
     * @throws IllegalStateException if the hub is not running
     */
    public Subscription subscribe(String channelKey, Consumer<BroadcastMessage> subscriber) {
        if (channelKey == null || channelKey.isBlank()) {
            throw new IllegalArgumentException("channelKey cannot be null or blank");
        }
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        ensureRunning();
        List<Consumer<BroadcastMessage>> subscribers =
            channelSubscribers.computeIfAbsent(channelKey, key -> new CopyOnWriteArrayList<>());
        subscribers.add(subscriber);
        return () -> subscribers.remove(subscriber);
    }

    /**
     * Connects a user client.
     *
     * @param userId the user ID
     * @param client notification consumer
     * @return handle that disconnects the client when closed
     * @throws IllegalStateException if the hub is not running
     */
    public Subscription connect(String userId, Consumer<UserNotification> client) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (client == null) {
            throw new IllegalArgumentException("client cannot be null");
        }
        ensureRunning();
        List<Consumer<UserNotification>> clients =
            userConnections.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>());
        clients.add(client);
        return () -> clients.remove(client);
    }

    @Override
    public void broadcast(String channelKey, BroadcastMessage message) {
        if (channelKey == null || channelKey.isBlank()) {
            throw new IllegalArgumentException("channelKey cannot be null or blank");
        }
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        ensureRunning();

        channelHistory.computeIfAbsent(channelKey, key -> new CopyOnWriteArrayList<>()).add(message);
        for (Consumer<BroadcastMessage> subscriber : channelSubscribers.getOrDefault(channelKey, List.of())) {
            try {
                subscriber.accept(message);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on channel {} for event {}", channelKey, message.event(), e);
            }
        }
    }

    @Override
    public void notifyUser(String userId, UserNotification notification) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId cannot be null or blank");
        }
        if (notification == null) {
            throw new IllegalArgumentException("notification cannot be null");
        }
        ensureRunning();

        userHistory.computeIfAbsent(userId, key -> new CopyOnWriteArrayList<>()).add(notification);
        for (Consumer<UserNotification> client : userConnections.getOrDefault(userId, List.of())) {
            try {
                client.accept(notification);
            } catch (RuntimeException e) {
                log.warn("Client failed for user {} on notification {}", userId, notification.type(), e);
            }
        }
    }

    /**
     * Messages delivered to a channel, in order.
     */
    public List<BroadcastMessage> messages(String channelKey) {
        List<BroadcastMessage> history = channelHistory.get(channelKey);
        return history == null ? List.of() : List.copyOf(history);
    }

    /**
     * Notifications delivered to a user, in order.
     */
    public List<UserNotification> notifications(String userId) {
        List<UserNotification> history = userHistory.get(userId);
        return history == null ? List.of() : List.copyOf(history);
    }

    public Set<String> activeChannels() {
        return Set.copyOf(channelHistory.keySet());
    }

    /**
     * Clears delivery history.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clearHistory() {
        channelHistory.clear();
        userHistory.clear();
    }

    private void ensureRunning() {
        if (!running.get()) {
            throw new IllegalStateException("Broadcast hub is not running");
        }
    }

    /**
     * Subscription handle.
     */
    @FunctionalInterface
    public interface Subscription extends AutoCloseable {

        @Override
        void close();
    }
}
