package com.ryuqq.loadlifecycle.adapter.runner.engine;

import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 시간 제한이 있는 가드 호출기.
 *
 * <p>평가기 예외, 시간 초과, 인터럽트는 모두 실패 판정으로 변환합니다.
 * 실패 메시지는 가드에 선언된 메시지에 원인을 덧붙입니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
final class BoundedGuardInvoker {

    private static final Logger log = LoggerFactory.getLogger(BoundedGuardInvoker.class);

    private final EngineConfig config;
    private final ExecutorService guardExecutor;

    BoundedGuardInvoker(EngineConfig config) {
        this.config = config;
        this.guardExecutor = config.isGuardTimeoutEnabled()
            ? Executors.newFixedThreadPool(config.guardConcurrency())
            : null;
    }

    GuardVerdict invoke(GuardEvaluator evaluator, GuardContext context) {
        String declared = context.guard().errorMessage();
        if (guardExecutor == null) {
            try {
                return nonNull(evaluator.evaluate(context));
            } catch (RuntimeException e) {
                log.warn("Guard {} threw during evaluation", context.guard().check(), e);
                return GuardVerdict.fail(declared + " (guard evaluation error: " + e.getMessage() + ")");
            }
        }

        Future<GuardVerdict> future = guardExecutor.submit(() -> evaluator.evaluate(context));
        try {
            return nonNull(future.get(config.guardTimeoutMs(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Guard {} timed out after {}ms", context.guard().check(), config.guardTimeoutMs());
            return GuardVerdict.fail(declared + " (guard timed out after " + config.guardTimeoutMs() + "ms)");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Guard {} threw during evaluation", context.guard().check(), cause);
            return GuardVerdict.fail(declared + " (guard evaluation error: " + cause.getMessage() + ")");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return GuardVerdict.fail(declared + " (guard evaluation interrupted)");
        }
    }

    void shutdown() throws InterruptedException {
        if (guardExecutor == null) {
            return;
        }
        guardExecutor.shutdown();
        if (!guardExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            guardExecutor.shutdownNow();
        }
    }

    private static GuardVerdict nonNull(GuardVerdict verdict) {
        return verdict != null ? verdict : GuardVerdict.fail(null);
    }
}
