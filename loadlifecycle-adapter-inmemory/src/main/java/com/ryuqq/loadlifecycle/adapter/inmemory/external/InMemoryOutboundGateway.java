package com.ryuqq.loadlifecycle.adapter.inmemory.external;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.spi.OutboundGateway;
import com.ryuqq.loadlifecycle.core.spi.OutboundMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link OutboundGateway}.
 *
 * <p>Records every accepted message. {@link #failNext(int)} makes the next sends throw,
 * which is used to exercise dispatcher retries.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryOutboundGateway implements OutboundGateway {

    private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
    private final AtomicInteger pendingFailures = new AtomicInteger();

    @Override
    public void send(OutboundMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("message cannot be null");
        }
        if (pendingFailures.getAndUpdate(n -> n > 0 ? n - 1 : 0) > 0) {
            throw new IllegalStateException("Outbound gateway unavailable for " + message.kind() + ":" + message.action());
        }
        sent.add(message);
    }

    /**
     * Makes the next {@code count} sends fail.
     *
     * @param count number of failing sends
     */
    public void failNext(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative (current: " + count + ")");
        }
        pendingFailures.set(count);
    }

    public List<OutboundMessage> sent() {
        return List.copyOf(sent);
    }

    public List<OutboundMessage> sent(EffectKind kind) {
        return sent.stream().filter(message -> message.kind() == kind).collect(Collectors.toList());
    }
}
