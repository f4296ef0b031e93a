package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.spi.EffectDispatcher;
import com.ryuqq.loadlifecycle.core.spi.EffectHandler;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 비동기 Effect Dispatcher.
 *
 * <p>커밋된 전이의 효과를 워커 풀에서 실행합니다. 호출자(Transition Engine)는
 * 결과를 기다리지 않으며, 효과 실패는 커밋을 되돌리지 않습니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * dispatch([req1, req2, ...])   (선언 순서대로 제출)
 *   ↓
 * For each request:
 *   1. kind에 해당하는 EffectHandler 조회 (생성 시점에 해석된 표)
 *   2. handler.handle(request)
 *   3. 실패 시:
 *      - attempt &lt; maxAttempts → config.retryDelayMs(attempt) 후 재시도 예약
 *      - 소진 → ERROR 로그 (kind/action/entity/transition) + Dead Letter 기록
 * </pre>
 *
 * <p>핸들러가 없는 kind의 효과는 재시도 없이 바로 Dead Letter로 기록됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class AsyncEffectDispatcher implements EffectDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AsyncEffectDispatcher.class);
    private static final long DEFAULT_POLLING_INTERVAL_MS = 10;

    private final Map<EffectKind, EffectHandler> handlers;
    private final EffectDispatchConfig config;
    private final Clock clock;
    private final ScheduledExecutorService workerExecutor;
    private final List<DeadLetter> deadLetters = new CopyOnWriteArrayList<>();
    private final AtomicInteger inFlight = new AtomicInteger();

    /**
     * 생성자.
     *
     * @param handlers 효과 핸들러 목록 (kind 중복 불가)
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     * @throws IllegalStateException 두 핸들러가 같은 kind를 처리하는 경우
     */
    public AsyncEffectDispatcher(List<EffectHandler> handlers, EffectDispatchConfig config, Clock clock) {
        if (handlers == null) {
            throw new IllegalArgumentException("handlers cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }

        Map<EffectKind, EffectHandler> resolved = new EnumMap<>(EffectKind.class);
        for (EffectHandler handler : handlers) {
            for (EffectKind kind : handler.kinds()) {
                EffectHandler previous = resolved.putIfAbsent(kind, handler);
                if (previous != null) {
                    throw new IllegalStateException("Duplicate effect handler for kind " + kind + ": "
                        + previous.getClass().getSimpleName() + ", " + handler.getClass().getSimpleName());
                }
            }
        }

        this.handlers = resolved;
        this.config = config;
        this.clock = clock;
        this.workerExecutor = Executors.newScheduledThreadPool(config.concurrency());
    }

    @Override
    public void dispatch(List<EffectRequest> requests) {
        if (requests == null) {
            throw new IllegalArgumentException("requests cannot be null");
        }
        for (EffectRequest request : requests) {
            inFlight.incrementAndGet();
            try {
                workerExecutor.execute(() -> attempt(request, 1));
            } catch (RejectedExecutionException e) {
                inFlight.decrementAndGet();
                log.error("Effect dispatcher is shut down, dropping {}", request, e);
                recordDeadLetter(request, 0, "Dispatcher shut down");
            }
        }
    }

    /**
     * 진행 중인 효과(재시도 대기 포함)가 모두 끝날 때까지 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 시간 내에 모두 끝났으면 true
     */
    public boolean awaitIdle(Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (inFlight.get() > 0) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                Thread.sleep(DEFAULT_POLLING_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return inFlight.get() == 0;
            }
        }
        return true;
    }

    /**
     * Dead Letter 목록 조회.
     *
     * @return 기록된 Dead Letter (기록 순서)
     */
    public List<DeadLetter> deadLetters() {
        return List.copyOf(deadLetters);
    }

    /**
     * Dispatcher 종료 (리소스 정리).
     *
     * <p>대기 중인 재시도는 실행되지 않습니다.</p>
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        workerExecutor.shutdown();
        if (!workerExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            workerExecutor.shutdownNow();
        }
    }

    private void attempt(EffectRequest request, int attempt) {
        EffectHandler handler = handlers.get(request.effect().kind());
        if (handler == null) {
            log.warn("No effect handler registered for kind {}: {}", request.effect().kind(), request);
            recordDeadLetter(request, 0, "No handler registered for kind " + request.effect().kind());
            inFlight.decrementAndGet();
            return;
        }

        try {
            handler.handle(request);
            log.debug("Effect {} handled (attempt {})", request, attempt);
            inFlight.decrementAndGet();
        } catch (Exception e) {
            if (attempt < config.maxAttempts()) {
                long delay = config.retryDelayMs(attempt);
                log.warn("Effect {} failed (attempt {}/{}), retrying in {}ms: {}",
                    request, attempt, config.maxAttempts(), delay, e.getMessage());
                scheduleRetry(request, attempt + 1, delay);
                return;
            }
            log.error("Effect exhausted after {} attempts: kind={}, action={}, load={}, transition={}",
                attempt, request.effect().kind(), request.effect().action(),
                request.loadId().getValue(), request.transitionId(), e);
            recordDeadLetter(request, attempt, e.getMessage());
            inFlight.decrementAndGet();
        }
    }

    private void scheduleRetry(EffectRequest request, int nextAttempt, long delayMs) {
        try {
            workerExecutor.schedule(() -> attempt(request, nextAttempt), delayMs, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.error("Effect dispatcher is shut down, abandoning retry of {}", request, e);
            recordDeadLetter(request, nextAttempt - 1, "Dispatcher shut down");
            inFlight.decrementAndGet();
        }
    }

    private void recordDeadLetter(EffectRequest request, int attempts, String errorMessage) {
        if (config.deadLettersEnabled()) {
            deadLetters.add(new DeadLetter(request, attempts, errorMessage, clock.instant()));
        }
    }
}
