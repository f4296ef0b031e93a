package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.application.convoy.ConvoyCoordinator;
import com.ryuqq.loadlifecycle.application.convoy.LoadStateChange;
import com.ryuqq.loadlifecycle.application.convoy.LoadStateListener;
import com.ryuqq.loadlifecycle.application.convoy.SyncResult;
import com.ryuqq.loadlifecycle.core.catalog.Effect;
import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.convoy.CargoExceptions;
import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.HoldReason;
import com.ryuqq.loadlifecycle.core.convoy.SeparationCheck;
import com.ryuqq.loadlifecycle.core.convoy.SyncNotification;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoint;
import com.ryuqq.loadlifecycle.core.convoy.SyncPoints;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.ConvoyStore;
import com.ryuqq.loadlifecycle.core.spi.EffectDispatcher;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.LoadStore;
import com.ryuqq.loadlifecycle.core.spi.StaleVersionException;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import com.ryuqq.loadlifecycle.core.statemachine.EscortState;
import com.ryuqq.loadlifecycle.core.statemachine.EscortTransitions;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Convoy 동기화 서비스.
 *
 * <p>주 Load 생명주기와 호위(escort) 생명주기를 동기화 지점에서 맞춥니다.
 * Transition Engine의 {@link LoadStateListener}로 등록되어 Load 커밋마다 호출됩니다.</p>
 *
 * <p><strong>Load 상태 변경 처리:</strong></p>
 * <pre>
 * 1. Load의 활성 Convoy 조회 (없으면 종료)
 * 2. 화물 예외 상태 진입 → ESCORT_HOLD(CARGO_EXCEPTION) + CRITICAL 알림 + Load 채널 경보
 * 3. 화물 예외 상태 이탈 → 정지 전 상태로 복원
 * 4. 일치하는 동기화 지점이 없을 때까지 반복 실행
 * </pre>
 *
 * <p><strong>동기화 지점 실행:</strong> 호위 상태 전이와 감사 기록을 먼저 커밋하고,
 * 알림과 효과는 그 다음에 별도 실패 영역에서 처리합니다. 알림 실패는 전이를 되돌리지 않습니다.</p>
 *
 * <p><strong>동시성:</strong> Convoy별 잠금으로 같은 Convoy에 대한 변경을 직렬화하고,
 * 저장소의 버전 비교로 프로세스 간 충돌을 감지합니다. 시스템이 일으킨 변경(화물 예외 정지와 복귀,
 * 동기화 지점, 간격 판정, 에스컬레이션 표시)은 충돌 시 최신 상태를 다시 읽어 조건을 재확인한 뒤
 * 최대 {@value #MAX_COMMIT_ATTEMPTS}회까지 재시도합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ConvoySyncService implements ConvoyCoordinator, LoadStateListener {

    private static final Logger log = LoggerFactory.getLogger(ConvoySyncService.class);

    private static final Set<ActorRole> ESCORT_ROLES = EnumSet.of(
        ActorRole.ESCORT,
        ActorRole.DISPATCH,
        ActorRole.SAFETY_MANAGER,
        ActorRole.ADMIN,
        ActorRole.SUPER_ADMIN,
        ActorRole.SYSTEM
    );

    static final String SYNC_TRIGGER_EVENT = "convoy_sync_point";
    static final int MAX_COMMIT_ATTEMPTS = 3;

    private final ConvoyStore convoyStore;
    private final LoadStore loadStore;
    private final BroadcastChannel channel;
    private final EffectDispatcher effectDispatcher;
    private final SeparationMonitor separationMonitor;
    private final Clock clock;
    private final Supplier<ConvoyId> idGenerator;
    private final ConcurrentHashMap<ConvoyId, ReentrantLock> locks = new ConcurrentHashMap<>();

    /**
     * 생성자 (UUID 기반 Convoy ID).
     */
    public ConvoySyncService(
        ConvoyStore convoyStore,
        LoadStore loadStore,
        BroadcastChannel channel,
        EffectDispatcher effectDispatcher,
        SeparationMonitor separationMonitor,
        Clock clock
    ) {
        this(convoyStore, loadStore, channel, effectDispatcher, separationMonitor, clock,
            () -> ConvoyId.of("convoy-" + UUID.randomUUID()));
    }

    /**
     * 생성자 (Convoy ID 생성기 주입).
     *
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConvoySyncService(
        ConvoyStore convoyStore,
        LoadStore loadStore,
        BroadcastChannel channel,
        EffectDispatcher effectDispatcher,
        SeparationMonitor separationMonitor,
        Clock clock,
        Supplier<ConvoyId> idGenerator
    ) {
        if (convoyStore == null) {
            throw new IllegalArgumentException("convoyStore cannot be null");
        }
        if (loadStore == null) {
            throw new IllegalArgumentException("loadStore cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (effectDispatcher == null) {
            throw new IllegalArgumentException("effectDispatcher cannot be null");
        }
        if (separationMonitor == null) {
            throw new IllegalArgumentException("separationMonitor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (idGenerator == null) {
            throw new IllegalArgumentException("idGenerator cannot be null");
        }
        this.convoyStore = convoyStore;
        this.loadStore = loadStore;
        this.channel = channel;
        this.effectDispatcher = effectDispatcher;
        this.separationMonitor = separationMonitor;
        this.clock = clock;
        this.idGenerator = idGenerator;
    }

    @Override
    public Convoy createConvoy(LoadId loadId, String leadUserId, String rearUserId, String loadUserId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (loadStore.findById(loadId).isEmpty()) {
            throw new IllegalArgumentException("Load not found: " + loadId.getValue());
        }
        Optional<Convoy> existing = convoyStore.findActiveByLoad(loadId);
        if (existing.isPresent()) {
            throw new IllegalStateException("Load " + loadId.getValue() + " already has an active convoy: "
                + existing.get().convoyId().getValue());
        }

        Convoy convoy = convoyStore.insert(Convoy.form(idGenerator.get(), loadId, leadUserId, rearUserId, loadUserId,
            clock.instant()));
        log.info("Convoy {} formed for load {} (lead={}, rear={}, load={})",
            convoy.convoyId().getValue(), loadId.getValue(), leadUserId, rearUserId, loadUserId);
        return convoy;
    }

    @Override
    public Convoy transitionEscort(ConvoyId convoyId, EscortState target, Actor actor) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (!ESCORT_ROLES.contains(actor.role())) {
            throw new IllegalStateException("Role " + actor.role() + " is not allowed to change escort status");
        }

        Convoy updated;
        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            Convoy convoy = requireActive(convoyId);
            Instant now = clock.instant();
            String transitionId = "ESCORT_" + convoy.status() + "_TO_" + target;

            if (!EscortTransitions.isAllowed(convoy.status(), target)) {
                convoyStore.appendAudit(escortAudit(convoy, target, transitionId, "USER_ACTION", "escort_status_update",
                    actor, List.of(), Map.of(), "Invalid escort transition: " + convoy.status() + " -> " + target, now));
            }
            EscortTransitions.validate(convoy.status(), target);

            Convoy next = target == EscortState.ESCORT_HOLD
                ? convoy.withHold(HoldReason.MANUAL, now)
                : convoy.withStatus(target, now);
            updated = convoyStore.update(next, convoy.version());
            convoyStore.appendAudit(escortAudit(convoy, target, transitionId, "USER_ACTION", "escort_status_update",
                actor, List.of(), Map.of(), null, now));
            log.info("Convoy {} escort status {} -> {} by {} ({})",
                convoyId.getValue(), convoy.status(), target, actor.actorId(), actor.role());

            broadcastConvoyUpdate(updated, now);
            runSyncPoints(convoyId, updated.loadId());
        } finally {
            lock.unlock();
        }
        return convoyStore.findById(convoyId).orElse(updated);
    }

    @Override
    public Optional<SyncPoint> checkSyncPoints(ConvoyId convoyId, LoadId loadId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        Optional<Convoy> convoy = convoyStore.findById(convoyId);
        if (convoy.isEmpty() || !convoy.get().isActive()) {
            return Optional.empty();
        }
        Optional<Load> load = loadStore.findById(loadId);
        if (load.isEmpty() || CargoExceptions.isCargoException(load.get().state())) {
            return Optional.empty();
        }
        return SyncPoints.firstMatch(load.get().state(), convoy.get().status());
    }

    @Override
    public SyncResult executeSyncPoint(ConvoyId convoyId, SyncPoint syncPoint) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (syncPoint == null) {
            throw new IllegalArgumentException("syncPoint cannot be null");
        }

        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            return doExecuteSyncPoint(convoyId, syncPoint);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public SeparationCheck updateSeparation(ConvoyId convoyId, Double leadDistanceMeters, Double rearDistanceMeters) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }

        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            return commitWithRetry(requireActive(convoyId), convoy -> {
                ensureActive(convoy);
                SeparationAssessment assessment = separationMonitor.assess(convoy, leadDistanceMeters, rearDistanceMeters);
                Instant now = assessment.assessedAt();
                Convoy next = assessment.convoy();
                boolean hold = assessment.check().autoHold() && !next.isOnHold();
                if (hold) {
                    next = next.withHold(HoldReason.SEPARATION, now);
                }
                Convoy updated = convoyStore.update(next, convoy.version());

                if (hold) {
                    Map<String, Object> metadata = new LinkedHashMap<>();
                    metadata.put("holdReason", HoldReason.SEPARATION.name());
                    metadata.put("consecutiveAlerts", assessment.check().consecutiveAlerts());
                    convoyStore.appendAudit(escortAudit(convoy, EscortState.ESCORT_HOLD, "SEPARATION_AUTO_HOLD",
                        "SYSTEM", "separation_auto_hold", Actor.system(), List.of(), metadata, null, now));
                    log.warn("Convoy {} placed on ESCORT_HOLD after {} consecutive separation alerts",
                        convoyId.getValue(), assessment.check().consecutiveAlerts());
                }

                separationMonitor.publish(assessment, updated);
                if (hold) {
                    notifyHold(updated, "Convoy paused. Separation limit exceeded "
                        + assessment.check().consecutiveAlerts() + " times in a row", "separation", now);
                }
                return assessment.check();
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Convoy disband(ConvoyId convoyId, Actor actor) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (!ESCORT_ROLES.contains(actor.role())) {
            throw new IllegalStateException("Role " + actor.role() + " is not allowed to disband a convoy");
        }

        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            Convoy convoy = convoyStore.findById(convoyId)
                .orElseThrow(() -> new IllegalArgumentException("Convoy not found: " + convoyId.getValue()));
            if (convoy.disbanded()) {
                return convoy;
            }
            Instant now = clock.instant();
            Convoy updated = commitWithRetry(convoy, current -> {
                if (current.disbanded()) {
                    return current;
                }
                Convoy result = convoyStore.update(current.disband(), current.version());
                convoyStore.appendAudit(escortAudit(current, current.status(), "CONVOY_DISBANDED", "USER_ACTION",
                    "convoy_disbanded", actor, List.of(), Map.of(), null, now));
                log.info("Convoy {} disbanded by {} ({})", convoyId.getValue(), actor.actorId(), actor.role());
                broadcastConvoyUpdate(result, now);
                return result;
            });
            return updated;
        } finally {
            lock.unlock();
            locks.remove(convoyId, lock);
        }
    }

    @Override
    public Optional<Convoy> markEscalated(ConvoyId convoyId, String syncPointId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        if (syncPointId == null) {
            throw new IllegalArgumentException("syncPointId cannot be null");
        }

        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            Optional<Convoy> found = convoyStore.findById(convoyId);
            if (found.isEmpty()) {
                return Optional.empty();
            }
            return commitWithRetry(found.get(), convoy -> {
                boolean waiting = convoy.isActive() && SyncPoints.awaitingIn(convoy.status())
                    .map(SyncPoint::id)
                    .filter(syncPointId::equals)
                    .isPresent();
                if (!waiting || convoy.escalatedSyncPoints().contains(syncPointId)) {
                    return Optional.<Convoy>empty();
                }
                return Optional.of(convoyStore.update(convoy.withEscalated(syncPointId), convoy.version()));
            });
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<Convoy> findConvoy(ConvoyId convoyId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        return convoyStore.findById(convoyId);
    }

    @Override
    public List<TransitionAuditRecord> convoyHistory(ConvoyId convoyId) {
        if (convoyId == null) {
            throw new IllegalArgumentException("convoyId cannot be null");
        }
        return convoyStore.auditTrail(convoyId);
    }

    @Override
    public void onLoadStateChange(LoadStateChange change) {
        Optional<Convoy> active = convoyStore.findActiveByLoad(change.loadId());
        if (active.isEmpty()) {
            return;
        }
        ConvoyId convoyId = active.get().convoyId();

        ReentrantLock lock = lockFor(convoyId);
        lock.lock();
        try {
            Convoy convoy = convoyStore.findById(convoyId).orElse(active.get());
            if (!convoy.isActive()) {
                return;
            }
            Instant now = clock.instant();

            if (CargoExceptions.isCargoException(change.toState())) {
                holdForCargoException(convoy, change.toState(), now);
                return;
            }
            if (convoy.isOnHold() && convoy.holdReason() == HoldReason.CARGO_EXCEPTION
                && CargoExceptions.isCargoException(change.fromState())) {
                releaseCargoHold(convoy, change.fromState(), now);
            }
            runSyncPoints(convoyId, change.loadId());
        } finally {
            lock.unlock();
        }
    }

    private void holdForCargoException(Convoy convoy, LoadState cargoState, Instant now) {
        Convoy held = commitWithRetry(convoy, current -> {
            if (!current.isActive() || current.isOnHold()) {
                return current;
            }
            Convoy updated = convoyStore.update(current.withHold(HoldReason.CARGO_EXCEPTION, now), current.version());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("holdReason", HoldReason.CARGO_EXCEPTION.name());
            metadata.put("cargoState", cargoState.name());
            convoyStore.appendAudit(escortAudit(current, EscortState.ESCORT_HOLD, "CARGO_EXCEPTION_HOLD", "SYSTEM",
                "cargo_exception", Actor.system(), List.of(), metadata, null, now));
            return updated;
        });
        if (!held.isActive()) {
            return;
        }
        log.warn("Primary load {} entered {}, convoy {} on ESCORT_HOLD",
            convoy.loadId().getValue(), cargoState, convoy.convoyId().getValue());
        notifyHold(held, "Convoy paused. Primary load entered " + cargoState, "cargo_exception", now);
    }

    private void releaseCargoHold(Convoy convoy, LoadState cargoState, Instant now) {
        Optional<Convoy> released = commitWithRetry(convoy, current -> {
            if (!current.isActive() || !current.isOnHold() || current.holdReason() != HoldReason.CARGO_EXCEPTION) {
                return Optional.<Convoy>empty();
            }
            EscortState restored = current.statusBeforeHold() != null
                ? current.statusBeforeHold()
                : EscortState.ESCORTING;
            Convoy updated = convoyStore.update(current.withStatus(restored, now), current.version());
            Map<String, Object> metadata = new LinkedHashMap<>();
            metadata.put("holdReason", HoldReason.CARGO_EXCEPTION.name());
            metadata.put("resolvedCargoState", cargoState.name());
            convoyStore.appendAudit(escortAudit(current, restored, "CARGO_EXCEPTION_RELEASE", "SYSTEM",
                "cargo_exception_resolved", Actor.system(), List.of(), metadata, null, now));
            log.info("Convoy {} released from ESCORT_HOLD back to {}", current.convoyId().getValue(), restored);
            return Optional.of(updated);
        });
        released.ifPresent(updated -> broadcastConvoyUpdate(updated, now));
    }

    /**
     * 일치하는 동기화 지점이 없을 때까지 실행.
     *
     * <p>한 번의 상태 변경이 여러 지점을 연달아 만족시킬 수 있으므로 반복합니다.
     * 지점 수만큼만 반복해 순환을 막습니다.</p>
     */
    private void runSyncPoints(ConvoyId convoyId, LoadId loadId) {
        for (int i = 0; i < SyncPoints.ordered().size(); i++) {
            Optional<SyncPoint> point = checkSyncPoints(convoyId, loadId);
            if (point.isEmpty()) {
                return;
            }
            SyncResult result = doExecuteSyncPoint(convoyId, point.get());
            if (!result.success()) {
                log.warn("Sync point {} failed for convoy {}: {}",
                    point.get().id(), convoyId.getValue(), result.errorMessage());
                return;
            }
        }
    }

    private SyncResult doExecuteSyncPoint(ConvoyId convoyId, SyncPoint syncPoint) {
        Optional<Convoy> found = convoyStore.findById(convoyId);
        if (found.isEmpty()) {
            return SyncResult.failed(syncPoint.id(), null, "Convoy not found: " + convoyId.getValue());
        }
        try {
            return commitWithRetry(found.get(), convoy -> commitSyncPoint(convoy, syncPoint));
        } catch (StaleVersionException e) {
            return SyncResult.failed(syncPoint.id(), found.get().status(), e.getMessage());
        }
    }

    private SyncResult commitSyncPoint(Convoy convoy, SyncPoint syncPoint) {
        ConvoyId convoyId = convoy.convoyId();
        if (!convoy.isActive()) {
            return SyncResult.failed(syncPoint.id(), convoy.status(), "Convoy " + convoyId.getValue() + " is not active");
        }
        if (!syncPoint.escortStates().contains(convoy.status())
            || !EscortTransitions.isAllowed(convoy.status(), syncPoint.escortTransition())) {
            return SyncResult.failed(syncPoint.id(), convoy.status(),
                "Convoy status " + convoy.status() + " is not eligible for " + syncPoint.id());
        }

        // 1. 호위 상태 전이 + 감사 기록 커밋
        Instant now = clock.instant();
        Convoy updated = convoyStore.update(convoy.withStatus(syncPoint.escortTransition(), now), convoy.version());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("loadId", convoy.loadId().getValue());
        metadata.put("syncPointName", syncPoint.name());
        convoyStore.appendAudit(escortAudit(convoy, syncPoint.escortTransition(), syncPoint.id(), "SYSTEM",
            SYNC_TRIGGER_EVENT, Actor.system(), List.of(), metadata, null, now, syncPoint.effects()));
        log.info("Convoy {} executed sync point {} ({} -> {})",
            convoyId.getValue(), syncPoint.id(), convoy.status(), syncPoint.escortTransition());

        // 2. 알림과 효과 (전이와 별개의 실패 영역)
        int failedNotifications = sendSyncNotifications(updated, syncPoint, now);
        dispatchSyncEffects(updated, syncPoint, now);

        return new SyncResult(syncPoint.id(), true, updated.status(), syncPoint.effects(), failedNotifications, null);
    }

    /**
     * 버전 충돌 시 최신 Convoy로 다시 시도.
     *
     * <p>{@code attempt}는 넘겨받은 Convoy 기준으로 조건을 다시 확인해야 합니다.
     * 저장이 성공하기 전에 충돌이 나야 하므로 알림은 저장 뒤에 보냅니다.</p>
     *
     * @throws StaleVersionException {@value #MAX_COMMIT_ATTEMPTS}회 모두 충돌한 경우
     */
    private <T> T commitWithRetry(Convoy snapshot, Function<Convoy, T> attempt) {
        Convoy current = snapshot;
        for (int attemptNo = 1; ; attemptNo++) {
            try {
                return attempt.apply(current);
            } catch (StaleVersionException e) {
                if (attemptNo >= MAX_COMMIT_ATTEMPTS) {
                    log.error("Convoy {} kept changing concurrently, giving up after {} attempts",
                        snapshot.convoyId().getValue(), attemptNo);
                    throw e;
                }
                log.debug("Convoy {} changed concurrently, retrying ({}/{})",
                    snapshot.convoyId().getValue(), attemptNo, MAX_COMMIT_ATTEMPTS);
                current = convoyStore.findById(snapshot.convoyId()).orElseThrow(() -> e);
            }
        }
    }

    private int sendSyncNotifications(Convoy convoy, SyncPoint syncPoint, Instant now) {
        int failed = 0;
        for (String key : syncPoint.notifications()) {
            Optional<SyncNotification> notification = SyncNotification.lookup(key);
            if (notification.isEmpty()) {
                log.warn("Unknown sync notification key {} on {}", key, syncPoint.id());
                continue;
            }
            SyncNotification template = notification.get();
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("convoyId", convoy.convoyId().getValue());
            data.put("syncPointId", syncPoint.id());
            data.put("loadId", convoy.loadId().getValue());

            for (String userId : convoy.participants()) {
                try {
                    channel.notifyUser(userId, new UserNotification("convoy_sync", template.title(),
                        template.message(), template.priority(), data, now));
                } catch (Exception e) {
                    failed++;
                    log.warn("Failed to send {} to {} for convoy {}", key, userId, convoy.convoyId().getValue(), e);
                }
            }

            Map<String, Object> alert = new LinkedHashMap<>();
            alert.put("convoyId", convoy.convoyId().getValue());
            alert.put("syncPointId", syncPoint.id());
            alert.put("syncPointName", syncPoint.name());
            alert.put("notification", key);
            alert.put("message", template.message());
            try {
                channel.broadcast(ChannelKeys.load(convoy.loadId()),
                    new BroadcastMessage(BroadcastMessage.CONVOY_ALERT, alert, now));
            } catch (Exception e) {
                failed++;
                log.warn("Failed to broadcast {} for convoy {}", key, convoy.convoyId().getValue(), e);
            }
        }
        if (!broadcastConvoyUpdate(convoy, now)) {
            failed++;
        }
        return failed;
    }

    private void dispatchSyncEffects(Convoy convoy, SyncPoint syncPoint, Instant now) {
        if (syncPoint.effects().isEmpty()) {
            return;
        }
        Map<ActorRole, String> participants = new EnumMap<>(ActorRole.class);
        participants.put(ActorRole.ESCORT, convoy.leadUserId());
        participants.put(ActorRole.DRIVER, convoy.loadUserId());

        List<EffectRequest> requests = new ArrayList<>();
        for (String key : syncPoint.effects()) {
            requests.add(new EffectRequest(Effect.of(EffectKind.INTEGRATION, key), convoy.loadId(),
                syncPoint.id(), participants, now));
        }
        try {
            effectDispatcher.dispatch(requests);
        } catch (Exception e) {
            log.error("Failed to dispatch sync effects {} for convoy {}",
                syncPoint.effects(), convoy.convoyId().getValue(), e);
        }
    }

    private void notifyHold(Convoy convoy, String message, String alertType, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("convoyId", convoy.convoyId().getValue());
        data.put("loadId", convoy.loadId().getValue());
        data.put("alertType", alertType);
        data.put("message", message);

        try {
            channel.broadcast(ChannelKeys.load(convoy.loadId()),
                new BroadcastMessage(BroadcastMessage.CONVOY_ALERT, data, now));
        } catch (Exception e) {
            log.warn("Failed to broadcast hold alert for convoy {}", convoy.convoyId().getValue(), e);
        }
        for (String userId : convoy.participants()) {
            try {
                channel.notifyUser(userId, new UserNotification("convoy_hold", "Convoy On Hold", message,
                    NotificationPriority.CRITICAL, data, now));
            } catch (Exception e) {
                log.warn("Failed to notify {} of hold on convoy {}", userId, convoy.convoyId().getValue(), e);
            }
        }
    }

    private boolean broadcastConvoyUpdate(Convoy convoy, Instant now) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("convoyId", convoy.convoyId().getValue());
        data.put("loadId", convoy.loadId().getValue());
        data.put("status", convoy.status().name());
        data.put("disbanded", convoy.disbanded());
        try {
            channel.broadcast(ChannelKeys.convoy(convoy.convoyId()),
                new BroadcastMessage(BroadcastMessage.CONVOY_UPDATE, data, now));
            return true;
        } catch (Exception e) {
            log.warn("Failed to broadcast convoy update for {}", convoy.convoyId().getValue(), e);
            return false;
        }
    }

    private Convoy requireActive(ConvoyId convoyId) {
        Convoy convoy = convoyStore.findById(convoyId)
            .orElseThrow(() -> new IllegalArgumentException("Convoy not found: " + convoyId.getValue()));
        return ensureActive(convoy);
    }

    private static Convoy ensureActive(Convoy convoy) {
        if (!convoy.isActive()) {
            throw new IllegalStateException("Convoy " + convoy.convoyId().getValue() + " is not active (status: "
                + convoy.status() + ", disbanded: " + convoy.disbanded() + ")");
        }
        return convoy;
    }

    private ReentrantLock lockFor(ConvoyId convoyId) {
        return locks.computeIfAbsent(convoyId, id -> new ReentrantLock());
    }

    private static TransitionAuditRecord escortAudit(
        Convoy convoy,
        EscortState target,
        String transitionId,
        String triggerType,
        String triggerEvent,
        Actor actor,
        List<String> guardsPassed,
        Map<String, Object> metadata,
        String errorMessage,
        Instant now
    ) {
        return escortAudit(convoy, target, transitionId, triggerType, triggerEvent, actor, guardsPassed,
            metadata, errorMessage, now, List.of());
    }

    private static TransitionAuditRecord escortAudit(
        Convoy convoy,
        EscortState target,
        String transitionId,
        String triggerType,
        String triggerEvent,
        Actor actor,
        List<String> guardsPassed,
        Map<String, Object> metadata,
        String errorMessage,
        Instant now,
        List<String> effects
    ) {
        return new TransitionAuditRecord(
            convoy.convoyId().getValue(),
            convoy.status().name(),
            target.name(),
            transitionId,
            triggerType,
            triggerEvent,
            actor.actorId(),
            actor.role(),
            guardsPassed,
            effects,
            metadata,
            errorMessage == null,
            errorMessage,
            now
        );
    }
}
