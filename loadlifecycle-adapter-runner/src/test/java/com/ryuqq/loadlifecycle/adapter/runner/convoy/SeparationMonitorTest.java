package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.adapter.inmemory.broadcast.InMemoryBroadcastHub;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SeparationConfig;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * SeparationMonitor 유닛 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class SeparationMonitorTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final LoadId LOAD_ID = LoadId.of("load-1");

    private InMemoryBroadcastHub hub;
    private SeparationMonitor monitor;

    @BeforeEach
    void setUp() {
        hub = new InMemoryBroadcastHub();
        hub.start();
        monitor = new SeparationMonitor(new SeparationConfig(), hub, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    // ============================================================
    // 1. 판정 (부수 효과 없음)
    // ============================================================

    @Test
    void assess_선도_한계_초과시_경보_판정만_하고_방송하지_않음() {
        // when
        SeparationAssessment assessment = monitor.assess(convoy(), 1300.0, 400.0);

        // then
        assertThat(assessment.check().isAlert()).isTrue();
        assertThat(assessment.check().message()).isEqualTo("Separation alert: Lead escort 1300m away (max 1200m)");
        assertThat(assessment.notificationDue()).isTrue();
        assertThat(assessment.assessedAt()).isEqualTo(NOW);
        assertThat(assessment.convoy().consecutiveSeparationAlerts()).isEqualTo(1);
        assertThat(assessment.convoy().lastSeparationAlertAt()).isEqualTo(NOW);
        assertThat(assessment.convoy().leadDistanceMeters()).isEqualTo(1300.0);
        assertThat(hub.activeChannels()).isEmpty();
        assertThat(hub.notifications("escort-lead")).isEmpty();
    }

    @Test
    void assess_후미_한계_초과는_후미_메시지() {
        // when
        SeparationAssessment assessment = monitor.assess(convoy(), null, 900.0);

        // then
        assertThat(assessment.check().rearAlert()).isTrue();
        assertThat(assessment.check().leadAlert()).isFalse();
        assertThat(assessment.check().message()).isEqualTo("Separation alert: Rear escort 900m away (max 800m)");
    }

    @Test
    void assess_80퍼센트_초과는_주의이며_연속_경보를_초기화() {
        // when
        SeparationAssessment assessment = monitor.assess(convoy().withSeparationAlerts(2, NOW.minusSeconds(5)), 1000.0, null);

        // then
        assertThat(assessment.check().isWarning()).isTrue();
        assertThat(assessment.notificationDue()).isFalse();
        assertThat(assessment.convoy().consecutiveSeparationAlerts()).isZero();
    }

    @Test
    void assess_알림_간격_내_경보는_횟수만_증가() {
        // given
        Convoy recentlyAlerted = convoy().withSeparationAlerts(1, NOW.minusSeconds(10));

        // when
        SeparationAssessment assessment = monitor.assess(recentlyAlerted, 1300.0, null);

        // then
        assertThat(assessment.notificationDue()).isFalse();
        assertThat(assessment.check().autoHold()).isFalse();
        assertThat(assessment.convoy().consecutiveSeparationAlerts()).isEqualTo(2);
        assertThat(assessment.convoy().lastSeparationAlertAt()).isEqualTo(NOW.minusSeconds(10));
    }

    @Test
    void assess_세번째_연속_경보는_간격과_무관하게_알림_대상() {
        // given
        Convoy twiceAlerted = convoy().withSeparationAlerts(2, NOW.minusSeconds(10));

        // when
        SeparationAssessment assessment = monitor.assess(twiceAlerted, 1300.0, null);

        // then
        assertThat(assessment.check().consecutiveAlerts()).isEqualTo(3);
        assertThat(assessment.check().autoHold()).isTrue();
        assertThat(assessment.notificationDue()).isTrue();
    }

    @Test
    void assess_간격이_지나면_다시_알림_대상() {
        // given
        Convoy alertedLongAgo = convoy().withSeparationAlerts(1, NOW.minusSeconds(30));

        // when
        SeparationAssessment assessment = monitor.assess(alertedLongAgo, 1300.0, null);

        // then
        assertThat(assessment.notificationDue()).isTrue();
        assertThat(assessment.convoy().lastSeparationAlertAt()).isEqualTo(NOW);
    }

    // ============================================================
    // 2. 방송
    // ============================================================

    @Test
    void publish_경보는_참여자_알림과_Load_채널_경보() {
        // given
        SeparationAssessment assessment = monitor.assess(convoy(), 1300.0, 400.0);

        // when
        int failed = monitor.publish(assessment, assessment.convoy());

        // then
        assertThat(failed).isZero();
        for (String userId : new String[] {"escort-lead", "escort-rear", "driver-1"}) {
            assertThat(hub.notifications(userId)).singleElement().satisfies(notification -> {
                assertThat(notification.type()).isEqualTo("convoy_separation_alert");
                assertThat(notification.priority()).isEqualTo(NotificationPriority.HIGH);
            });
        }
        assertThat(hub.messages(ChannelKeys.load(LOAD_ID)))
            .extracting(BroadcastMessage::event)
            .containsExactly(BroadcastMessage.CONVOY_ALERT);
    }

    @Test
    void publish_주의는_Load_채널_업데이트만() {
        // given
        SeparationAssessment assessment = monitor.assess(convoy(), 1000.0, null);

        // when
        monitor.publish(assessment, assessment.convoy());

        // then
        assertThat(hub.notifications("escort-lead")).isEmpty();
        assertThat(hub.messages(ChannelKeys.load(LOAD_ID))).singleElement().satisfies(message -> {
            assertThat(message.event()).isEqualTo(BroadcastMessage.CONVOY_UPDATE);
            assertThat(message.data()).containsEntry("alertType", "separation_warning");
        });
    }

    @Test
    void publish_알림_간격_내_경보는_아무것도_보내지_않음() {
        // given
        SeparationAssessment assessment = monitor.assess(convoy().withSeparationAlerts(1, NOW.minusSeconds(10)), 1300.0, null);

        // when
        int failed = monitor.publish(assessment, assessment.convoy());

        // then
        assertThat(failed).isZero();
        assertThat(hub.activeChannels()).isEmpty();
        assertThat(hub.notifications("escort-lead")).isEmpty();
    }

    @Test
    void publish_정상_거리는_아무것도_방송하지_않음() {
        // given
        SeparationAssessment assessment = monitor.assess(convoy(), 300.0, 200.0);

        // when
        monitor.publish(assessment, assessment.convoy());

        // then
        assertThat(assessment.check().isAlert()).isFalse();
        assertThat(assessment.check().isWarning()).isFalse();
        assertThat(assessment.check().message()).isNull();
        assertThat(hub.activeChannels()).isEmpty();
    }

    @Test
    void publish_채널이_중단되어도_예외를_던지지_않고_실패_수를_반환() {
        // given
        SeparationAssessment assessment = monitor.assess(convoy(), 1300.0, null);
        hub.stop();

        // when
        int failed = monitor.publish(assessment, assessment.convoy());

        // then: Load 채널 경보 1 + 참여자 3
        assertThat(failed).isEqualTo(4);
    }

    private static Convoy convoy() {
        return Convoy.form(ConvoyId.of("convoy-1"), LOAD_ID, "escort-lead", "escort-rear", "driver-1",
            NOW.minusSeconds(3600));
    }
}
