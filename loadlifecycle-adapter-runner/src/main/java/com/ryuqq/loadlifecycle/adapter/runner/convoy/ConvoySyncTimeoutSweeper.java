package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.adapter.runner.sweep.SweeperConfig;
import com.ryuqq.loadlifecycle.application.convoy.ConvoyCoordinator;
import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.application.sweep.Sweeper;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoint;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoints;
import com.ryuqq.loadlifecycle.core.convoy.SyncTimeout;
import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.ConvoyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 동기화 지점 대기 타임아웃 Sweeper.
 *
 * <p>Convoy가 동기화 지점 대기 상태에 제한 시간 이상 머물면 선언된 에스컬레이션을 수행합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * 1. scanActive(batchSize)
 * 2. For each Convoy:
 *    a. awaitingIn(status) → 대기 중인 지점과 타임아웃 확인
 *    b. statusEnteredAt + timeout 경과 && 아직 에스컬레이션하지 않음
 *    c. coordinator.markEscalated(convoyId, syncPointId)
 *       (Convoy 잠금 아래에서 재확인 후 저장, 이미 진행했으면 skipped)
 *    d. NOTIFY_DISPATCH  → dispatch:updates 채널에 dispatch_escalation 방송
 *       SEPARATION_CHECK → 마지막 보고 간격으로 updateSeparation 재판정
 * </pre>
 *
 * <p>에스컬레이션 기록은 상태가 바뀌면 초기화되므로 같은 대기 구간에서는 한 번만 수행됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ConvoySyncTimeoutSweeper implements Sweeper {

    private static final Logger log = LoggerFactory.getLogger(ConvoySyncTimeoutSweeper.class);

    private final ConvoyStore convoyStore;
    private final ConvoyCoordinator coordinator;
    private final BroadcastChannel channel;
    private final Clock clock;
    private final SweeperConfig config;

    public ConvoySyncTimeoutSweeper(
        ConvoyStore convoyStore,
        ConvoyCoordinator coordinator,
        BroadcastChannel channel,
        Clock clock,
        SweeperConfig config
    ) {
        if (convoyStore == null) {
            throw new IllegalArgumentException("convoyStore cannot be null");
        }
        if (coordinator == null) {
            throw new IllegalArgumentException("coordinator cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.convoyStore = convoyStore;
        this.coordinator = coordinator;
        this.channel = channel;
        this.clock = clock;
        this.config = config;
    }

    @Override
    public SweepReport sweep() {
        log.info("Convoy sync timeout sweep started");

        List<Convoy> convoys;
        try {
            convoys = convoyStore.scanActive(config.batchSize());
        } catch (Exception e) {
            log.error("Failed to scan active convoys", e);
            return new SweepReport(0, 0, 0, 1);
        }

        Instant now = clock.instant();
        int applied = 0;
        int skipped = 0;
        int failed = 0;
        for (Convoy convoy : convoys) {
            switch (tryEscalate(convoy, now)) {
                case APPLIED -> applied++;
                case SKIPPED -> skipped++;
                case FAILED -> failed++;
            }
        }

        log.info("Convoy sync timeout sweep completed: {} escalated, {} skipped, {} failed out of {} scanned",
            applied, skipped, failed, convoys.size());
        return new SweepReport(convoys.size(), applied, skipped, failed);
    }

    private Result tryEscalate(Convoy convoy, Instant now) {
        Optional<SyncPoint> awaiting = SyncPoints.awaitingIn(convoy.status());
        if (awaiting.isEmpty() || awaiting.get().findTimeout().isEmpty()) {
            return Result.SKIPPED;
        }
        SyncPoint point = awaiting.get();
        SyncTimeout timeout = point.timeout();
        if (convoy.escalatedSyncPoints().contains(point.id())) {
            return Result.SKIPPED;
        }
        if (Duration.between(convoy.statusEnteredAt(), now).compareTo(timeout.duration()) < 0) {
            return Result.SKIPPED;
        }

        Optional<Convoy> marked;
        try {
            marked = coordinator.markEscalated(convoy.convoyId(), point.id());
        } catch (Exception e) {
            log.error("Failed to mark escalation {} on convoy {}", point.id(), convoy.convoyId().getValue(), e);
            return Result.FAILED;
        }
        if (marked.isEmpty()) {
            log.debug("Convoy {} moved on before escalation of {}, skipping", convoy.convoyId().getValue(), point.id());
            return Result.SKIPPED;
        }
        Convoy escalated = marked.get();
        Duration waited = Duration.between(escalated.statusEnteredAt(), now);

        try {
            switch (timeout.escalation()) {
                case NOTIFY_DISPATCH -> notifyDispatch(escalated, point, waited, now);
                case SEPARATION_CHECK -> coordinator.updateSeparation(
                    escalated.convoyId(), escalated.leadDistanceMeters(), escalated.rearDistanceMeters());
            }
            log.warn("Convoy {} waited {}m at {}, escalated via {}",
                escalated.convoyId().getValue(), waited.toMinutes(), point.id(), timeout.escalation());
            return Result.APPLIED;
        } catch (Exception e) {
            log.error("Failed to escalate {} on convoy {}", point.id(), convoy.convoyId().getValue(), e);
            return Result.FAILED;
        }
    }

    private void notifyDispatch(Convoy convoy, SyncPoint point, Duration waited, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("convoyId", convoy.convoyId().getValue());
        data.put("loadId", convoy.loadId().getValue());
        data.put("syncPointId", point.id());
        data.put("syncPointName", point.name());
        data.put("escortStatus", convoy.status().name());
        data.put("waitedMinutes", waited.toMinutes());
        data.put("message", "Convoy waiting at " + point.name() + " for " + waited.toMinutes() + " minutes");
        channel.broadcast(ChannelKeys.DISPATCH_UPDATES,
            new BroadcastMessage(BroadcastMessage.DISPATCH_ESCALATION, data, now));
    }

    private enum Result {
        APPLIED,
        SKIPPED,
        FAILED
    }
}
