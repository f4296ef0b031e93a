package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.adapter.inmemory.broadcast.InMemoryBroadcastHub;
import com.ryuqq.loadlifecycle.core.catalog.Effect;
import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * NotificationEffectHandler / BroadcastEffectHandler 유닛 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class NotificationEffectHandlerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final LoadId LOAD_ID = LoadId.of("load-1");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private InMemoryBroadcastHub hub;

    @BeforeEach
    void setUp() {
        hub = new InMemoryBroadcastHub();
        hub.start();
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    // ============================================================
    // 1. 알림
    // ============================================================

    @Test
    void handle_참여자가_있는_역할은_사용자에게_직접_알림() {
        // given
        NotificationEffectHandler handler = new NotificationEffectHandler(hub, clock);
        Effect effect = Effect.of(EffectKind.NOTIFICATION, "carrier_assigned", ActorRole.SHIPPER);

        // when
        handler.handle(request(effect, Map.of(ActorRole.SHIPPER, "shipper-1")));

        // then
        assertThat(hub.notifications("shipper-1")).singleElement().satisfies(notification -> {
            assertThat(notification.type()).isEqualTo("carrier_assigned");
            assertThat(notification.title()).isEqualTo("Carrier Assigned");
            assertThat(notification.message()).isEqualTo("Load load-1: carrier assigned");
            assertThat(notification.priority()).isEqualTo(NotificationPriority.MEDIUM);
            assertThat(notification.data()).containsEntry("loadId", "load-1")
                .containsEntry("transitionId", "ACCEPTED_TO_ASSIGNED");
            assertThat(notification.timestamp()).isEqualTo(NOW);
        });
    }

    @Test
    void handle_참여자가_없는_역할은_역할_채널로_방송() {
        // given
        NotificationEffectHandler handler = new NotificationEffectHandler(hub, clock);
        Effect effect = Effect.of(EffectKind.NOTIFICATION, "load_posted", ActorRole.CATALYST);

        // when
        handler.handle(request(effect, Map.of(ActorRole.SHIPPER, "shipper-1")));

        // then
        assertThat(hub.messages(ChannelKeys.role(ActorRole.CATALYST)))
            .extracting(BroadcastMessage::event)
            .containsExactly("load_posted");
        assertThat(hub.notifications("shipper-1")).isEmpty();
    }

    @Test
    void handle_수신자가_없으면_Load_채널로_방송() {
        // given
        NotificationEffectHandler handler = new NotificationEffectHandler(hub, clock);

        // when
        handler.handle(request(Effect.of(EffectKind.NOTIFICATION, "load_expired"), Map.of()));

        // then
        assertThat(hub.messages(ChannelKeys.load(LOAD_ID)))
            .extracting(BroadcastMessage::event)
            .containsExactly("load_expired");
    }

    @Test
    void handle_payload의_priority를_사용() {
        // given
        NotificationEffectHandler handler = new NotificationEffectHandler(hub, clock);
        Effect effect = new Effect(EffectKind.NOTIFICATION, "cargo_damage_reported",
            Set.of(ActorRole.SHIPPER), Map.of("priority", "critical"));

        // when
        handler.handle(request(effect, Map.of(ActorRole.SHIPPER, "shipper-1")));

        // then
        assertThat(hub.notifications("shipper-1"))
            .extracting(UserNotification::priority)
            .containsExactly(NotificationPriority.CRITICAL);
    }

    @Test
    void titleOf_밑줄을_공백으로_바꾸고_단어마다_대문자() {
        assertThat(NotificationEffectHandler.titleOf("pod_submitted")).isEqualTo("Pod Submitted");
        assertThat(NotificationEffectHandler.titleOf("load__posted_")).isEqualTo("Load Posted");
    }

    // ============================================================
    // 2. 방송
    // ============================================================

    @Test
    void broadcast_Load_채널과_수신_역할_채널에_상태변경_방송() {
        // given
        BroadcastEffectHandler handler = new BroadcastEffectHandler(hub, clock);
        Effect effect = Effect.of(EffectKind.BROADCAST, "broadcast_new_load", ActorRole.CATALYST);

        // when
        handler.handle(request(effect, Map.of()));

        // then
        assertThat(hub.messages(ChannelKeys.load(LOAD_ID))).singleElement().satisfies(message -> {
            assertThat(message.event()).isEqualTo(BroadcastMessage.LOAD_STATE_CHANGED);
            assertThat(message.data()).containsEntry("action", "broadcast_new_load")
                .containsEntry("loadId", "load-1");
        });
        assertThat(hub.messages(ChannelKeys.role(ActorRole.CATALYST))).hasSize(1);
    }

    private static EffectRequest request(Effect effect, Map<ActorRole, String> participants) {
        return new EffectRequest(effect, LOAD_ID, "ACCEPTED_TO_ASSIGNED", participants, NOW);
    }
}
