package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.adapter.inmemory.broadcast.InMemoryBroadcastHub;
import com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryConvoyStore;
import com.ryuqq.loadlifecycle.adapter.runner.sweep.SweeperConfig;
import com.ryuqq.loadlifecycle.application.convoy.ConvoyCoordinator;
import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * ConvoySyncTimeoutSweeper 유닛 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ConvoySyncTimeoutSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final ConvoyId CONVOY_ID = ConvoyId.of("convoy-1");
    private static final LoadId LOAD_ID = LoadId.of("load-1");

    @Mock
    private ConvoyCoordinator coordinator;

    private InMemoryConvoyStore convoyStore;
    private InMemoryBroadcastHub hub;
    private ConvoySyncTimeoutSweeper sweeper;

    @BeforeEach
    void setUp() {
        convoyStore = new InMemoryConvoyStore();
        hub = new InMemoryBroadcastHub();
        hub.start();
        sweeper = new ConvoySyncTimeoutSweeper(convoyStore, coordinator, hub,
            Clock.fixed(NOW, ZoneOffset.UTC), new SweeperConfig());
    }

    @AfterEach
    void tearDown() {
        hub.stop();
    }

    // ============================================================
    // 1. 디스패치 에스컬레이션
    // ============================================================

    @Test
    void sweep_스테이징_완료_후_60분_초과시_디스패치에_에스컬레이션() {
        // given
        convoyStore.insert(convoyIn(EscortState.STAGING_COMPLETE, Duration.ofMinutes(61)));
        escalationsRecordedInStore();

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(1, 1, 0, 0));
        assertThat(hub.messages(ChannelKeys.DISPATCH_UPDATES)).singleElement().satisfies(message -> {
            assertThat(message.event()).isEqualTo(BroadcastMessage.DISPATCH_ESCALATION);
            assertThat(message.data())
                .containsEntry("convoyId", "convoy-1")
                .containsEntry("syncPointId", "SYNC_CONFIRMED")
                .containsEntry("escortStatus", "STAGING_COMPLETE")
                .containsEntry("waitedMinutes", 61L);
        });
        assertThat(convoyStore.findById(CONVOY_ID).orElseThrow().escalatedSyncPoints())
            .containsExactly("SYNC_CONFIRMED");
        verify(coordinator, never()).updateSeparation(any(), any(), any());
    }

    @Test
    void sweep_같은_대기_구간에서는_한번만_에스컬레이션() {
        // given
        convoyStore.insert(convoyIn(EscortState.STAGING_COMPLETE, Duration.ofMinutes(90)));
        escalationsRecordedInStore();
        sweeper.sweep();

        // when
        SweepReport second = sweeper.sweep();

        // then
        assertThat(second).isEqualTo(new SweepReport(1, 0, 1, 0));
        assertThat(hub.messages(ChannelKeys.DISPATCH_UPDATES)).hasSize(1);
    }

    @Test
    void sweep_표시_전에_Convoy가_진행했으면_건너뜀() {
        // given: 스캔 이후 다른 연산이 Convoy를 옮김
        convoyStore.insert(convoyIn(EscortState.STAGING_COMPLETE, Duration.ofMinutes(61)));
        when(coordinator.markEscalated(CONVOY_ID, "SYNC_CONFIRMED")).thenReturn(Optional.empty());

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(1, 0, 1, 0));
        assertThat(hub.activeChannels()).isEmpty();
    }

    @Test
    void sweep_제한_시간_전이면_건너뜀() {
        // given
        convoyStore.insert(convoyIn(EscortState.STAGING_COMPLETE, Duration.ofMinutes(30)));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(1, 0, 1, 0));
        assertThat(hub.activeChannels()).isEmpty();
        verifyNoInteractions(coordinator);
    }

    @Test
    void sweep_타임아웃이_없는_대기_상태는_건너뜀() {
        // given
        convoyStore.insert(convoyIn(EscortState.ESCORTING, Duration.ofHours(10)));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report.skipped()).isEqualTo(1);
        assertThat(report.applied()).isZero();
    }

    // ============================================================
    // 2. 간격 재판정
    // ============================================================

    @Test
    void sweep_편성_15분_초과시_마지막_거리로_간격_재판정() {
        // given
        convoyStore.insert(convoyIn(EscortState.CONVOY_FORMING, Duration.ofMinutes(16)).withDistances(1300.0, 500.0));
        escalationsRecordedInStore();

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report.applied()).isEqualTo(1);
        verify(coordinator).updateSeparation(CONVOY_ID, 1300.0, 500.0);
    }

    @Test
    void sweep_재판정_실패는_failed로_집계() {
        // given
        convoyStore.insert(convoyIn(EscortState.CONVOY_FORMING, Duration.ofMinutes(20)));
        escalationsRecordedInStore();
        when(coordinator.updateSeparation(eq(CONVOY_ID), any(), any()))
            .thenThrow(new IllegalStateException("Convoy convoy-1 is not active"));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(1, 0, 0, 1));
    }

    private void escalationsRecordedInStore() {
        when(coordinator.markEscalated(eq(CONVOY_ID), any())).thenAnswer(invocation -> {
            String syncPointId = invocation.getArgument(1);
            Convoy current = convoyStore.findById(CONVOY_ID).orElseThrow();
            return Optional.of(convoyStore.update(current.withEscalated(syncPointId), current.version()));
        });
    }

    private static Convoy convoyIn(EscortState status, Duration waited) {
        return Convoy.form(CONVOY_ID, LOAD_ID, "escort-lead", null, "driver-1", NOW.minus(Duration.ofDays(1)))
            .withStatus(status, NOW.minus(waited));
    }
}
