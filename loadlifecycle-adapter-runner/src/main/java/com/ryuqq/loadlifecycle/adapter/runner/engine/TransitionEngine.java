package com.ryuqq.loadlifecycle.adapter.runner.engine;

import com.ryuqq.loadlifecycle.application.convoy.LoadStateChange;
import com.ryuqq.loadlifecycle.application.convoy.LoadStateListener;
import com.ryuqq.loadlifecycle.application.lifecycle.AvailableTransition;
import com.ryuqq.loadlifecycle.application.lifecycle.LoadLifecycle;
import com.ryuqq.loadlifecycle.application.lifecycle.TransitionValidation;
import com.ryuqq.loadlifecycle.core.catalog.Effect;
import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.catalog.Guard;
import com.ryuqq.loadlifecycle.core.catalog.StateMetadata;
import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.catalog.TransitionDefinition;
import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardRegistry;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.FinancialTimer;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.LoadId;
import com.ryuqq.loadlifecycle.core.model.TransitionAuditRecord;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;
import com.ryuqq.loadlifecycle.core.outcome.Committed;
import com.ryuqq.loadlifecycle.core.outcome.Rejected;
import com.ryuqq.loadlifecycle.core.outcome.TransitionError;
import com.ryuqq.loadlifecycle.core.outcome.TransitionErrorCode;
import com.ryuqq.loadlifecycle.core.outcome.TransitionOutcome;
import com.ryuqq.loadlifecycle.core.spi.EffectDispatcher;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.LoadStore;
import com.ryuqq.loadlifecycle.core.spi.StaleVersionException;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Transition Engine.
 *
 * <p>Load 상태를 변경하는 유일한 진입점입니다. 모든 시도는 성공이든 실패든
 * 감사 기록을 정확히 하나 남깁니다 (Load가 없는 경우 제외).</p>
 *
 * <p><strong>처리 흐름 (attemptTransition):</strong></p>
 * <pre>
 * 1. Load 조회            → 없으면 LOAD_NOT_FOUND (감사 기록 없음)
 * 2. 전이 정의 해석        → 미등록 id 또는 현재 상태가 from에 없으면 INVALID_TRANSITION
 * 3. 역할 확인            → allowedActors에 없으면 UNAUTHORIZED_ACTOR
 * 4. 가드 평가 (선언 순서) → 첫 실패에서 중단, GUARD_FAILED(check, message)
 * 5. 커밋 (CAS on version + 성공 감사 기록)
 *    → 버전 충돌 시 CONCURRENT_MODIFICATION + 실패 감사 기록
 * 6. 커밋 후: 효과 디스패치 (fire-and-forget), LoadStateListener 통지 (listenerExecutor)
 * </pre>
 *
 * <p><strong>가드 해석:</strong> 카탈로그가 선언한 모든 가드 식별자를 생성 시점에
 * {@link GuardRegistry}에서 한 번 해석합니다. 등록되지 않은 식별자가 있으면 생성이 실패합니다.</p>
 *
 * <p><strong>동시성:</strong> 같은 Load에 대한 동시 시도는 저장소의 버전 비교로
 * 정확히 하나만 커밋됩니다. 나머지는 CONCURRENT_MODIFICATION으로 거절됩니다.</p>
 *
 * <p><strong>리스너 통지:</strong> 리스너 호출은 커밋 이후 listenerExecutor에 리스너별 작업으로
 * 넘겨집니다. 별도 Executor를 주면 Convoy 잠금이나 알림 전송이 attemptTransition 반환을 늦추지 않습니다.
 * 기본값은 호출 스레드에서 바로 실행하는 Executor이며, 이때도 리스너 예외는 커밋 결과에 영향을 주지 않습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class TransitionEngine implements LoadLifecycle {

    private static final Logger log = LoggerFactory.getLogger(TransitionEngine.class);

    private final TransitionCatalog catalog;
    private final LoadStore loadStore;
    private final EffectDispatcher effectDispatcher;
    private final List<LoadStateListener> listeners;
    private final Executor listenerExecutor;
    private final Clock clock;
    private final Map<String, GuardEvaluator> evaluators;
    private final BoundedGuardInvoker guardInvoker;

    /**
     * 생성자.
     *
     * @param catalog 상태/전이 카탈로그
     * @param loadStore Load 저장소
     * @param guardRegistry 가드 평가기 레지스트리
     * @param effectDispatcher 효과 디스패처
     * @param listeners 커밋 후 통지받을 리스너 (Convoy 동기화 계층 등)
     * @param clock 시계
     * @param config 엔진 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws IllegalStateException 카탈로그의 가드 식별자가 레지스트리에 없는 경우
     */
    public TransitionEngine(
        TransitionCatalog catalog,
        LoadStore loadStore,
        GuardRegistry guardRegistry,
        EffectDispatcher effectDispatcher,
        List<LoadStateListener> listeners,
        Clock clock,
        EngineConfig config
    ) {
        this(catalog, loadStore, guardRegistry, effectDispatcher, listeners, Runnable::run, clock, config);
    }

    /**
     * 리스너 Executor를 지정하는 생성자.
     *
     * @param catalog 상태/전이 카탈로그
     * @param loadStore Load 저장소
     * @param guardRegistry 가드 평가기 레지스트리
     * @param effectDispatcher 효과 디스패처
     * @param listeners 커밋 후 통지받을 리스너
     * @param listenerExecutor 리스너 호출을 실행할 Executor (수명은 호출자가 관리)
     * @param clock 시계
     * @param config 엔진 설정
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws IllegalStateException 카탈로그의 가드 식별자가 레지스트리에 없는 경우
     */
    public TransitionEngine(
        TransitionCatalog catalog,
        LoadStore loadStore,
        GuardRegistry guardRegistry,
        EffectDispatcher effectDispatcher,
        List<LoadStateListener> listeners,
        Executor listenerExecutor,
        Clock clock,
        EngineConfig config
    ) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        if (loadStore == null) {
            throw new IllegalArgumentException("loadStore cannot be null");
        }
        if (guardRegistry == null) {
            throw new IllegalArgumentException("guardRegistry cannot be null");
        }
        if (effectDispatcher == null) {
            throw new IllegalArgumentException("effectDispatcher cannot be null");
        }
        if (listeners == null) {
            throw new IllegalArgumentException("listeners cannot be null");
        }
        if (listenerExecutor == null) {
            throw new IllegalArgumentException("listenerExecutor cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.catalog = catalog;
        this.loadStore = loadStore;
        this.effectDispatcher = effectDispatcher;
        this.listeners = List.copyOf(listeners);
        this.listenerExecutor = listenerExecutor;
        this.clock = clock;
        this.evaluators = resolveEvaluators(catalog, guardRegistry);
        this.guardInvoker = new BoundedGuardInvoker(config);
    }

    @Override
    public TransitionOutcome attemptTransition(LoadId loadId, String transitionId, Actor actor, TransitionContext context) {
        validateInput(loadId, transitionId, actor);
        TransitionContext request = context != null ? context : TransitionContext.empty();

        // 1. Load 조회
        Optional<Load> found = loadStore.findById(loadId);
        if (found.isEmpty()) {
            log.warn("Transition {} rejected: load {} not found", transitionId, loadId.getValue());
            return new Rejected(loadId, transitionId, null,
                TransitionError.of(TransitionErrorCode.LOAD_NOT_FOUND, "Load not found: " + loadId.getValue()),
                List.of());
        }
        Load load = found.get();
        Instant now = clock.instant();

        // 2. 전이 정의 해석
        Optional<TransitionDefinition> resolved = catalog.transitionById(transitionId);
        if (resolved.isEmpty()) {
            TransitionError error = TransitionError.of(TransitionErrorCode.INVALID_TRANSITION,
                "Unknown transition: " + transitionId);
            return reject(load, transitionId, null, actor, request, error, List.of(), now);
        }
        TransitionDefinition definition = resolved.get();
        Optional<TransitionError> structural = checkOrigin(load, definition);
        if (structural.isPresent()) {
            return reject(load, transitionId, definition, actor, request, structural.get(), List.of(), now);
        }

        // 3. 역할 확인
        Optional<TransitionError> unauthorized = checkActor(definition, actor);
        if (unauthorized.isPresent()) {
            return reject(load, transitionId, definition, actor, request, unauthorized.get(), List.of(), now);
        }

        // 4. 가드 평가 (첫 실패에서 중단)
        GuardRun run = runGuards(load, definition, actor, request, now, true);
        if (!run.errors().isEmpty()) {
            return reject(load, transitionId, definition, actor, request, run.errors().get(0), run.passed(), now);
        }

        // 5. 커밋
        return commit(load, definition, actor, request, run.passed(), now);
    }

    @Override
    public List<AvailableTransition> listAvailableTransitions(LoadId loadId, Actor actor, TransitionContext context) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        TransitionContext request = context != null ? context : TransitionContext.empty();

        Optional<Load> found = loadStore.findById(loadId);
        if (found.isEmpty()) {
            return List.of();
        }
        Load load = found.get();
        Instant now = clock.instant();

        List<AvailableTransition> available = new ArrayList<>();
        for (TransitionDefinition definition : catalog.transitionsFrom(load.state())) {
            if (!definition.permits(actor.role())) {
                continue;
            }
            GuardRun run = runGuards(load, definition, actor, request, now, false);
            List<String> blocked = run.errors().stream().map(TransitionError::message).toList();
            available.add(new AvailableTransition(definition, blocked.isEmpty(), blocked));
        }
        return available;
    }

    @Override
    public StateMetadata getStateMetadata(LoadState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return catalog.metadata(state);
    }

    @Override
    public List<TransitionAuditRecord> getStateHistory(LoadId loadId) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        return loadStore.auditTrail(loadId);
    }

    /**
     * {@inheritDoc}
     *
     * <p>전이 정의 해석 실패는 즉시 반환합니다. 역할 불일치는 기록하되
     * 가드는 모두 평가해 차단 사유를 함께 보여줍니다. 저장도 감사 기록도 하지 않습니다.</p>
     */
    @Override
    public TransitionValidation validateTransition(LoadId loadId, String transitionId, Actor actor, TransitionContext context) {
        validateInput(loadId, transitionId, actor);
        TransitionContext request = context != null ? context : TransitionContext.empty();

        Optional<Load> found = loadStore.findById(loadId);
        if (found.isEmpty()) {
            return invalid(transitionId, TransitionError.of(TransitionErrorCode.LOAD_NOT_FOUND,
                "Load not found: " + loadId.getValue()));
        }
        Load load = found.get();

        Optional<TransitionDefinition> resolved = catalog.transitionById(transitionId);
        if (resolved.isEmpty()) {
            return invalid(transitionId, TransitionError.of(TransitionErrorCode.INVALID_TRANSITION,
                "Unknown transition: " + transitionId));
        }
        TransitionDefinition definition = resolved.get();
        Optional<TransitionError> structural = checkOrigin(load, definition);
        if (structural.isPresent()) {
            return invalid(transitionId, structural.get());
        }

        List<TransitionError> errors = new ArrayList<>();
        checkActor(definition, actor).ifPresent(errors::add);
        GuardRun run = runGuards(load, definition, actor, request, clock.instant(), false);
        errors.addAll(run.errors());

        return new TransitionValidation(transitionId, errors.isEmpty(), errors, run.passed());
    }

    /**
     * 엔진 종료 (가드 평가 스레드 정리).
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        guardInvoker.shutdown();
    }

    private TransitionOutcome commit(
        Load load,
        TransitionDefinition definition,
        Actor actor,
        TransitionContext request,
        List<String> guardsPassed,
        Instant now
    ) {
        Load updated = nextSnapshot(load, definition, request, now);
        List<String> effectLabels = definition.effects().stream().map(Effect::label).toList();
        TransitionAuditRecord record = auditRecord(load, definition.id(), definition, actor, request,
            guardsPassed, effectLabels, null, now);

        Load committed;
        try {
            committed = loadStore.commitTransition(updated, load.version(), record);
        } catch (StaleVersionException e) {
            TransitionError error = TransitionError.of(TransitionErrorCode.CONCURRENT_MODIFICATION,
                "Load was modified concurrently: " + e.getMessage());
            return reject(load, definition.id(), definition, actor, request, error, guardsPassed, now);
        }

        log.info("Load {} transitioned {} -> {} via {} by {} ({})",
            load.loadId().getValue(), load.state(), definition.to(), definition.id(), actor.actorId(), actor.role());

        // 6. 커밋 후 처리 (실패해도 커밋은 유지)
        dispatchEffects(committed, definition, now);
        notifyListeners(new LoadStateChange(load.loadId(), load.state(), definition.to(), definition.id(), now));

        return new Committed(load.loadId(), definition.id(), load.state(), definition.to(), guardsPassed, effectLabels);
    }

    /**
     * 커밋할 Load 스냅샷 생성.
     *
     * <p>상태와 진입 시각, ON_HOLD 진입 시 직전 상태, 요청이 제출한 문서와 참여자 배정,
     * FINANCIAL 타이머 효과의 시작/종료를 반영합니다.</p>
     */
    private Load nextSnapshot(Load load, TransitionDefinition definition, TransitionContext request, Instant now) {
        Load updated = load.withState(definition.to(), now)
            .withPreviousState(definition.to() == LoadState.ON_HOLD ? load.state() : null)
            .withDocuments(request.documents());
        for (Map.Entry<ActorRole, String> assignment : request.assignments().entrySet()) {
            updated = updated.withParticipant(assignment.getKey(), assignment.getValue());
        }
        for (Effect effect : definition.effects()) {
            if (effect.kind() != EffectKind.FINANCIAL) {
                continue;
            }
            Optional<FinancialTimer> started = FinancialTimer.startedBy(effect.action());
            if (started.isPresent()) {
                updated = updated.withTimer(started.get(), true);
            }
            Optional<FinancialTimer> stopped = FinancialTimer.stoppedBy(effect.action());
            if (stopped.isPresent()) {
                updated = updated.withTimer(stopped.get(), false);
            }
        }
        return updated;
    }

    private void dispatchEffects(Load committed, TransitionDefinition definition, Instant now) {
        if (definition.effects().isEmpty()) {
            return;
        }
        List<EffectRequest> requests = new ArrayList<>();
        for (Effect effect : definition.effects()) {
            requests.add(new EffectRequest(effect, committed.loadId(), definition.id(), committed.participants(), now));
        }
        try {
            effectDispatcher.dispatch(requests);
        } catch (Exception e) {
            log.error("Failed to dispatch {} effects for load {} ({})",
                requests.size(), committed.loadId().getValue(), definition.id(), e);
        }
    }

    private void notifyListeners(LoadStateChange change) {
        for (LoadStateListener listener : listeners) {
            try {
                listenerExecutor.execute(() -> notifyListener(listener, change));
            } catch (RejectedExecutionException e) {
                log.error("Load state listener {} was not scheduled for load {} ({} -> {})",
                    listener.getClass().getSimpleName(), change.loadId().getValue(),
                    change.fromState(), change.toState(), e);
            }
        }
    }

    private static void notifyListener(LoadStateListener listener, LoadStateChange change) {
        try {
            listener.onLoadStateChange(change);
        } catch (Exception e) {
            log.error("Load state listener {} failed for load {} ({} -> {})",
                listener.getClass().getSimpleName(), change.loadId().getValue(),
                change.fromState(), change.toState(), e);
        }
    }

    /**
     * 가드 평가.
     *
     * @param stopAtFirstFailure true면 첫 실패에서 중단 (attemptTransition),
     *                           false면 모든 가드 평가 (validate, list)
     */
    private GuardRun runGuards(
        Load load,
        TransitionDefinition definition,
        Actor actor,
        TransitionContext request,
        Instant now,
        boolean stopAtFirstFailure
    ) {
        List<String> passed = new ArrayList<>();
        List<TransitionError> errors = new ArrayList<>();
        for (Guard guard : definition.guards()) {
            GuardContext guardContext = new GuardContext(load, definition, guard, actor, request, now);
            GuardVerdict verdict = guardInvoker.invoke(evaluators.get(guard.check()), guardContext);
            if (verdict.passed()) {
                passed.add(guard.check());
                continue;
            }
            String message = verdict.message() != null ? verdict.message() : guard.errorMessage();
            errors.add(TransitionError.guardFailed(guard.check(), message));
            if (stopAtFirstFailure) {
                break;
            }
        }
        return new GuardRun(passed, errors);
    }

    private Optional<TransitionError> checkOrigin(Load load, TransitionDefinition definition) {
        if (definition.originatesFrom(load.state())) {
            return Optional.empty();
        }
        return Optional.of(TransitionError.of(TransitionErrorCode.INVALID_TRANSITION,
            "Transition " + definition.id() + " is not valid from state " + load.state()));
    }

    private Optional<TransitionError> checkActor(TransitionDefinition definition, Actor actor) {
        if (definition.permits(actor.role())) {
            return Optional.empty();
        }
        return Optional.of(TransitionError.of(TransitionErrorCode.UNAUTHORIZED_ACTOR,
            "Role " + actor.role() + " is not allowed to perform " + definition.id()));
    }

    private Rejected reject(
        Load load,
        String transitionId,
        TransitionDefinition definition,
        Actor actor,
        TransitionContext request,
        TransitionError error,
        List<String> guardsPassed,
        Instant now
    ) {
        TransitionAuditRecord record = auditRecord(load, transitionId, definition, actor, request,
            guardsPassed, List.of(), error, now);
        try {
            loadStore.appendAudit(record);
        } catch (Exception e) {
            log.error("Failed to append failure audit for load {} ({})", load.loadId().getValue(), transitionId, e);
        }
        log.warn("Transition {} rejected for load {}: {} - {}",
            transitionId, load.loadId().getValue(), error.code(), error.message());
        return new Rejected(load.loadId(), transitionId, load.state(), error, guardsPassed);
    }

    private TransitionAuditRecord auditRecord(
        Load load,
        String transitionId,
        TransitionDefinition definition,
        Actor actor,
        TransitionContext request,
        List<String> guardsPassed,
        List<String> effectsExecuted,
        TransitionError error,
        Instant now
    ) {
        Map<String, Object> metadata = new LinkedHashMap<>(request.metadata());
        if (error != null) {
            metadata.put("errorCode", error.code().name());
            if (error.check() != null) {
                metadata.put("failedCheck", error.check());
            }
        }
        return new TransitionAuditRecord(
            load.loadId().getValue(),
            load.state().name(),
            definition != null ? definition.to().name() : null,
            transitionId,
            definition != null ? definition.trigger().name() : null,
            definition != null ? definition.triggerEvent() : null,
            actor.actorId(),
            actor.role(),
            guardsPassed,
            effectsExecuted,
            metadata,
            error == null,
            error != null ? error.message() : null,
            now
        );
    }

    private static TransitionValidation invalid(String transitionId, TransitionError error) {
        return new TransitionValidation(transitionId, false, List.of(error), List.of());
    }

    private static Map<String, GuardEvaluator> resolveEvaluators(TransitionCatalog catalog, GuardRegistry registry) {
        Map<String, GuardEvaluator> resolved = new HashMap<>();
        for (TransitionDefinition definition : catalog.allTransitions()) {
            for (Guard guard : definition.guards()) {
                resolved.computeIfAbsent(guard.check(), registry::resolve);
            }
        }
        return Map.copyOf(resolved);
    }

    private static void validateInput(LoadId loadId, String transitionId, Actor actor) {
        if (loadId == null) {
            throw new IllegalArgumentException("loadId cannot be null");
        }
        if (transitionId == null || transitionId.isBlank()) {
            throw new IllegalArgumentException("transitionId cannot be null or blank");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
    }

    /**
     * 가드 평가 결과.
     *
     * @param passed 통과한 가드 식별자 (평가 순서)
     * @param errors 실패한 가드 오류
     */
    private record GuardRun(List<String> passed, List<TransitionError> errors) {
    }
}
