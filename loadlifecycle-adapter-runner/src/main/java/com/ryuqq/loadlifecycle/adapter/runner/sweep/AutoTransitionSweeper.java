package com.ryuqq.loadlifecycle.adapter.runner.sweep;

import com.ryuqq.loadlifecycle.application.lifecycle.LoadLifecycle;
import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.application.sweep.Sweeper;
import com.ryuqq.loadlifecycle.core.catalog.AutoTransition;
import com.ryuqq.loadlifecycle.core.catalog.StateMetadata;
import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.Rejected;
import com.ryuqq.loadlifecycle.core.outcome.TransitionOutcome;
import com.ryuqq.loadlifecycle.core.spi.LoadStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 자동 전이(타임아웃) Sweeper.
 *
 * <p>자동 전이가 선언된 상태에 타임아웃 이상 머문 Load를 찾아
 * 선언된 전이를 시스템 행위자로 시도합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. statesWithAutoTransition() → [POSTED(72h), BIDDING(48h), AWARDED(2h), ASSIGNED(1h), POD_PENDING(24h)]
 * 2. For each state:
 *    a. scanInState(state, now - timeout, batchSize)
 *    b. For each Load:
 *       - attemptTransition(autoTransition.transitionId, Actor.system())
 *       - Committed → applied
 *       - Rejected  → skipped (DEBUG, 다음 스캔에서 재평가)
 *       - 예외      → failed (ERROR, 다음 항목 계속)
 * 3. SweepReport 반환 + 요약 로깅
 * </pre>
 *
 * <p>기준 시각은 저장된 상태 진입 시각이므로 재시작 후에도 누락 없이 처리됩니다.
 * 여러 인스턴스가 동시에 돌아도 엔진의 버전 비교로 한 번만 커밋됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class AutoTransitionSweeper implements Sweeper {

    private static final Logger log = LoggerFactory.getLogger(AutoTransitionSweeper.class);

    private final LoadLifecycle lifecycle;
    private final LoadStore loadStore;
    private final TransitionCatalog catalog;
    private final Clock clock;
    private final SweeperConfig config;

    /**
     * 생성자.
     *
     * @param lifecycle 전이를 시도할 생명주기 서비스
     * @param loadStore Load 저장소 (스캔용)
     * @param catalog 카탈로그
     * @param clock 시계
     * @param config 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public AutoTransitionSweeper(
        LoadLifecycle lifecycle,
        LoadStore loadStore,
        TransitionCatalog catalog,
        Clock clock,
        SweeperConfig config
    ) {
        if (lifecycle == null) {
            throw new IllegalArgumentException("lifecycle cannot be null");
        }
        if (loadStore == null) {
            throw new IllegalArgumentException("loadStore cannot be null");
        }
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.lifecycle = lifecycle;
        this.loadStore = loadStore;
        this.catalog = catalog;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public SweepReport sweep() {
        log.info("Auto-transition sweep started");

        Instant now = clock.instant();
        SweepReport report = SweepReport.EMPTY;
        for (StateMetadata metadata : catalog.statesWithAutoTransition()) {
            report = report.plus(sweepState(metadata, now));
        }

        log.info("Auto-transition sweep completed: {} applied, {} skipped, {} failed out of {} scanned",
            report.applied(), report.skipped(), report.failed(), report.scanned());
        return report;
    }

    private SweepReport sweepState(StateMetadata metadata, Instant now) {
        AutoTransition auto = metadata.autoTransition();
        List<Load> candidates;
        try {
            candidates = loadStore.scanInState(metadata.state(), now.minus(auto.timeout()), config.batchSize());
        } catch (Exception e) {
            log.error("Failed to scan loads in state {}", metadata.state(), e);
            return new SweepReport(0, 0, 0, 1);
        }

        int applied = 0;
        int skipped = 0;
        int failed = 0;
        for (Load load : candidates) {
            switch (tryApply(load, auto)) {
                case APPLIED -> applied++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }
        return new SweepReport(candidates.size(), applied, skipped, failed);
    }

    /**
     * 개별 Load 자동 전이 시도.
     *
     * <p>예외 발생 시에도 계속 진행하여 다른 항목 처리를 방해하지 않습니다.</p>
     */
    private Result tryApply(Load load, AutoTransition auto) {
        try {
            TransitionOutcome outcome = lifecycle.attemptTransition(
                load.loadId(), auto.transitionId(), Actor.system(), TransitionContext.empty());
            if (outcome.isSuccess()) {
                log.info("Auto-transition {} applied to load {} ({} -> {})",
                    auto.transitionId(), load.loadId().getValue(), load.state(), outcome.newState());
                return Result.APPLIED;
            }
            Rejected rejected = (Rejected) outcome;
            log.debug("Auto-transition {} skipped for load {}: {} - {}",
                auto.transitionId(), load.loadId().getValue(), rejected.code(), rejected.error().message());
            return Result.SKIPPED;
        } catch (Exception e) {
            log.error("Failed to apply auto-transition {} to load {}", auto.transitionId(), load.loadId().getValue(), e);
            return Result.FAILED;
        }
    }

    private enum Result {
        APPLIED,
        SKIPPED,
        FAILED
    }
}
