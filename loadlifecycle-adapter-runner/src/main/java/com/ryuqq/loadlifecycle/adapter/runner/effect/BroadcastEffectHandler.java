package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.EffectHandler;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * BROADCAST 효과 핸들러.
 *
 * <p>Load 채널에 {@code load_state_changed} 이벤트를 방송하고,
 * 수신 역할이 지정된 경우 각 역할 채널에도 같은 메시지를 보냅니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class BroadcastEffectHandler implements EffectHandler {

    private final BroadcastChannel channel;
    private final Clock clock;

    public BroadcastEffectHandler(BroadcastChannel channel, Clock clock) {
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.channel = channel;
        this.clock = clock;
    }

    @Override
    public Set<EffectKind> kinds() {
        return Set.of(EffectKind.BROADCAST);
    }

    @Override
    public void handle(EffectRequest request) {
        Map<String, Object> data = new LinkedHashMap<>(request.effect().payload());
        data.put("action", request.effect().action());
        data.put("loadId", request.loadId().getValue());
        data.put("transitionId", request.transitionId());
        BroadcastMessage message = new BroadcastMessage(BroadcastMessage.LOAD_STATE_CHANGED, data, clock.instant());

        channel.broadcast(ChannelKeys.load(request.loadId()), message);
        for (ActorRole role : request.effect().recipients()) {
            channel.broadcast(ChannelKeys.role(role), message);
        }
    }
}
