package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.EffectHandler;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * NOTIFICATION 효과 핸들러.
 *
 * <p>수신 역할마다 Load에 배정된 사용자가 있으면 그 사용자에게 직접 알리고,
 * 없으면 역할 채널({@code role:<role>})로 방송합니다. 수신 역할이 없는 효과는
 * Load 채널로 방송합니다.</p>
 *
 * <p>우선순위는 효과 payload의 {@code priority} 값(없으면 MEDIUM)을 따릅니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class NotificationEffectHandler implements EffectHandler {

    private final BroadcastChannel channel;
    private final Clock clock;

    public NotificationEffectHandler(BroadcastChannel channel, Clock clock) {
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
        return Set.of(EffectKind.NOTIFICATION);
    }

    @Override
    public void handle(EffectRequest request) {
        String action = request.effect().action();
        Map<String, Object> data = new LinkedHashMap<>(request.effect().payload());
        data.put("loadId", request.loadId().getValue());
        data.put("transitionId", request.transitionId());

        if (request.effect().recipients().isEmpty()) {
            channel.broadcast(ChannelKeys.load(request.loadId()),
                new BroadcastMessage(action, data, clock.instant()));
            return;
        }

        for (ActorRole role : request.effect().recipients()) {
            String userId = request.participants().get(role);
            if (userId != null) {
                channel.notifyUser(userId, new UserNotification(
                    action,
                    titleOf(action),
                    "Load " + request.loadId().getValue() + ": " + action.replace('_', ' '),
                    priorityOf(request),
                    data,
                    clock.instant()
                ));
            } else {
                channel.broadcast(ChannelKeys.role(role), new BroadcastMessage(action, data, clock.instant()));
            }
        }
    }

    private static NotificationPriority priorityOf(EffectRequest request) {
        Object value = request.effect().payload().get("priority");
        if (value == null) {
            return NotificationPriority.MEDIUM;
        }
        return NotificationPriority.valueOf(value.toString().toUpperCase(Locale.ROOT));
    }

    /**
     * 액션 식별자를 제목으로 변환 (예: load_assigned → Load Assigned).
     */
    static String titleOf(String action) {
        StringBuilder title = new StringBuilder();
        for (String word : action.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0))).append(word.substring(1));
        }
        return title.toString();
    }
}
