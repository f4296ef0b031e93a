package com.ryuqq.loadlifecycle.adapter.inmemory.broadcast;

import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryBroadcastHub 테스트.
 *
 * <ul>
 *   <li>start/stop 생명주기</li>
 *   <li>채널 구독과 사용자 연결</li>
 *   <li>구독자 예외 격리</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class InMemoryBroadcastHubTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    private InMemoryBroadcastHub hub;

    @BeforeEach
    void setUp() {
        hub = new InMemoryBroadcastHub();
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    @Test
    void broadcast_시작전이면_IllegalStateException() {
        assertThatThrownBy(() -> hub.broadcast("load:1", message("load_state_changed")))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not running");
    }

    @Test
    void start_두번_호출하면_IllegalStateException() {
        hub.start();

        assertThatThrownBy(hub::start).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void broadcast_구독자에게_전달하고_이력에_남김() {
        // given
        hub.start();
        List<BroadcastMessage> received = new ArrayList<>();
        hub.subscribe("load:1", received::add);

        // when
        hub.broadcast("load:1", message("load_state_changed"));
        hub.broadcast("load:2", message("load_state_changed"));

        // then
        assertThat(received).hasSize(1);
        assertThat(hub.messages("load:1")).hasSize(1);
        assertThat(hub.messages("load:2")).hasSize(1);
    }

    @Test
    void broadcast_구독자가_예외를_던져도_다른_구독자는_받음() {
        // given
        hub.start();
        List<BroadcastMessage> received = new ArrayList<>();
        hub.subscribe("load:1", message -> {
            throw new IllegalStateException("boom");
        });
        hub.subscribe("load:1", received::add);

        // when
        hub.broadcast("load:1", message("convoy_alert"));

        // then
        assertThat(received).hasSize(1);
    }

    @Test
    void subscribe_close하면_더이상_전달되지_않음() {
        // given
        hub.start();
        List<BroadcastMessage> received = new ArrayList<>();
        InMemoryBroadcastHub.Subscription subscription = hub.subscribe("load:1", received::add);

        // when
        subscription.close();
        hub.broadcast("load:1", message("convoy_alert"));

        // then
        assertThat(received).isEmpty();
    }

    @Test
    void notifyUser_연결된_클라이언트와_이력에_전달함() {
        // given
        hub.start();
        List<UserNotification> received = new ArrayList<>();
        hub.connect("user-1", received::add);
        UserNotification notification = new UserNotification(
            "convoy_hold", "Convoy On Hold", "paused", NotificationPriority.CRITICAL, Map.of(), NOW);

        // when
        hub.notifyUser("user-1", notification);

        // then
        assertThat(received).containsExactly(notification);
        assertThat(hub.notifications("user-1")).containsExactly(notification);
    }

    @Test
    void stop_이후에는_전달이_거부되지만_이력은_유지됨() {
        // given
        hub.start();
        hub.broadcast("load:1", message("load_state_changed"));

        // when
        hub.stop();

        // then
        assertThat(hub.isRunning()).isFalse();
        assertThat(hub.messages("load:1")).hasSize(1);
        assertThatThrownBy(() -> hub.broadcast("load:1", message("load_state_changed")))
            .isInstanceOf(IllegalStateException.class);
    }

    private static BroadcastMessage message(String event) {
        return new BroadcastMessage(event, Map.of("loadId", "1"), NOW);
    }
}
