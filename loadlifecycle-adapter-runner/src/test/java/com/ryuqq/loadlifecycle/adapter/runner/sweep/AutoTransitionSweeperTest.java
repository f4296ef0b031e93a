package com.ryuqq.loadlifecycle.adapter.runner.sweep;

import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryApprovalService;
import com.ryuqq.loadlifecycle.adapter.inmemory.external.InMemoryHoursOfServiceService;
import com.ryuqq.loadlifecycle.adapter.inmemory.store.InMemoryLoadStore;
import com.ryuqq.loadlifecycle.adapter.runner.engine.EngineConfig;
import com.ryuqq.loadlifecycle.adapter.runner.engine.TransitionEngine;
import com.ryuqq.loadlifecycle.adapter.runner.guard.GeofenceConfig;
import com.ryuqq.loadlifecycle.adapter.runner.guard.StandardGuards;
import com.ryuqq.loadlifecycle.application.lifecycle.LoadLifecycle;
import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.Rejected;
import com.ryuqq.loadlifecycle.core.outcome.TransitionError;
import com.ryuqq.loadlifecycle.core.outcome.TransitionErrorCode;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * AutoTransitionSweeper 유닛 테스트.
 *
 * <p>실제 TransitionEngine과 InMemoryLoadStore로 시간 초과 전이를 검증합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class AutoTransitionSweeperTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private final TransitionCatalog catalog = TransitionCatalog.standard();

    private InMemoryLoadStore loadStore;
    private TransitionEngine engine;
    private AutoTransitionSweeper sweeper;

    @BeforeEach
    void setUp() {
        loadStore = new InMemoryLoadStore();
        engine = new TransitionEngine(
            catalog,
            loadStore,
            StandardGuards.registry(catalog, new InMemoryHoursOfServiceService(),
                new InMemoryApprovalService(), new GeofenceConfig()),
            requests -> { },
            List.of(),
            clock,
            new EngineConfig(0, 1)
        );
        sweeper = new AutoTransitionSweeper(engine, loadStore, catalog, clock, new SweeperConfig());
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        engine.shutdown();
    }

    // ============================================================
    // 1. 시간 초과 전이
    // ============================================================

    @Test
    void sweep_게시_72시간_경과시_EXPIRED() {
        // given
        loadStore.seed(loadIn("load-old", LoadState.POSTED, Duration.ofHours(73)));
        loadStore.seed(loadIn("load-fresh", LoadState.POSTED, Duration.ofHours(1)));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(1, 1, 0, 0));
        assertThat(stateOf("load-old")).isEqualTo(LoadState.EXPIRED);
        assertThat(stateOf("load-fresh")).isEqualTo(LoadState.POSTED);

        List<TransitionAuditRecord> trail = loadStore.auditTrail(LoadId.of("load-old"));
        assertThat(trail).singleElement().satisfies(record -> {
            assertThat(record.transitionId()).isEqualTo("POSTED_TO_EXPIRED");
            assertThat(record.triggerType()).isEqualTo("TIMEOUT");
            assertThat(record.actorRole()).isEqualTo(ActorRole.SYSTEM);
            assertThat(record.success()).isTrue();
        });
    }

    @Test
    void sweep_입찰중은_48시간_기준으로_EXPIRED() {
        // given
        loadStore.seed(loadIn("load-bidding", LoadState.BIDDING, Duration.ofHours(49)));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report.applied()).isEqualTo(1);
        assertThat(stateOf("load-bidding")).isEqualTo(LoadState.EXPIRED);
    }

    @Test
    void sweep_배정과_POD_대기_시간_초과를_함께_처리() {
        // given
        loadStore.seed(loadIn("load-awarded", LoadState.AWARDED, Duration.ofMinutes(121)));
        loadStore.seed(loadIn("load-assigned", LoadState.ASSIGNED, Duration.ofMinutes(61)));
        loadStore.seed(loadIn("load-pod", LoadState.POD_PENDING, Duration.ofHours(25)));

        // when
        SweepReport report = sweeper.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(3, 3, 0, 0));
        assertThat(stateOf("load-awarded")).isEqualTo(LoadState.LAPSED);
        assertThat(stateOf("load-assigned")).isEqualTo(LoadState.LAPSED);
        assertThat(stateOf("load-pod")).isEqualTo(LoadState.DELIVERED);
    }

    @Test
    void sweep_대상이_없으면_빈_보고서() {
        // given
        loadStore.seed(loadIn("load-draft", LoadState.DRAFT, Duration.ofDays(30)));

        // when & then
        assertThat(sweeper.sweep()).isEqualTo(SweepReport.EMPTY);
    }

    // ============================================================
    // 2. 거절과 실패
    // ============================================================

    @Test
    void sweep_거절은_skipped_예외는_failed로_집계() {
        // given
        LoadLifecycle lifecycle = mock(LoadLifecycle.class);
        loadStore.seed(loadIn("load-rejected", LoadState.POSTED, Duration.ofHours(80)));
        loadStore.seed(loadIn("load-broken", LoadState.AWARDED, Duration.ofHours(5)));
        when(lifecycle.attemptTransition(eq(LoadId.of("load-rejected")), eq("POSTED_TO_EXPIRED"), any(Actor.class), any(TransitionContext.class)))
            .thenReturn(new Rejected(LoadId.of("load-rejected"), "POSTED_TO_EXPIRED", LoadState.EXPIRED,
                TransitionError.of(TransitionErrorCode.CONCURRENT_MODIFICATION, "Load was modified concurrently"), List.of()));
        when(lifecycle.attemptTransition(eq(LoadId.of("load-broken")), eq("AWARDED_TO_LAPSED"), any(Actor.class), any(TransitionContext.class)))
            .thenThrow(new IllegalStateException("store unavailable"));
        AutoTransitionSweeper mocked = new AutoTransitionSweeper(lifecycle, loadStore, catalog, clock, new SweeperConfig());

        // when
        SweepReport report = mocked.sweep();

        // then
        assertThat(report).isEqualTo(new SweepReport(2, 0, 1, 1));
    }

    @Test
    void sweep_batchSize만큼만_처리() {
        // given
        loadStore.seed(loadIn("load-a", LoadState.POSTED, Duration.ofHours(90)));
        loadStore.seed(loadIn("load-b", LoadState.POSTED, Duration.ofHours(80)));
        AutoTransitionSweeper limited = new AutoTransitionSweeper(
            engine, loadStore, catalog, clock, new SweeperConfig().withBatchSize(1));

        // when
        SweepReport report = limited.sweep();

        // then
        assertThat(report.applied()).isEqualTo(1);
        assertThat(stateOf("load-a")).isEqualTo(LoadState.EXPIRED);
        assertThat(stateOf("load-b")).isEqualTo(LoadState.POSTED);
    }

    private LoadState stateOf(String loadId) {
        return loadStore.findById(LoadId.of(loadId)).orElseThrow().state();
    }

    private static Load loadIn(String loadId, LoadState state, Duration age) {
        return Load.draft(LoadId.of(loadId), "shipper-1", NOW.minus(Duration.ofDays(60)))
            .withState(state, NOW.minus(age));
    }
}
