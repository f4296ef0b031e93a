package com.ryuqq.loadlifecycle.adapter.runner.sweep;

import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.application.sweep.Sweeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * 고정 주기로 Sweeper를 실행하는 Runner.
 *
 * <p>등록된 Sweeper를 순서대로 실행합니다. 한 Sweeper의 예외는 로깅만 하고
 * 다음 Sweeper와 다음 주기를 막지 않습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ScheduledSweepRunner {

    private static final Logger log = LoggerFactory.getLogger(ScheduledSweepRunner.class);

    private final List<Sweeper> sweepers;
    private final long intervalMs;
    private final ScheduledExecutorService scheduler;
    private ScheduledFuture<?> task;

    /**
     * 생성자.
     *
     * @param sweepers 실행할 Sweeper 목록
     * @param intervalMs 실행 주기 (밀리초, 양수)
     * @throws IllegalArgumentException sweepers가 비었거나 intervalMs가 양수가 아닌 경우
     */
    public ScheduledSweepRunner(List<Sweeper> sweepers, long intervalMs) {
        if (sweepers == null || sweepers.isEmpty()) {
            throw new IllegalArgumentException("sweepers cannot be null or empty");
        }
        if (intervalMs <= 0) {
            throw new IllegalArgumentException("intervalMs must be positive (current: " + intervalMs + ")");
        }
        this.sweepers = List.copyOf(sweepers);
        this.intervalMs = intervalMs;
        this.scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    /**
     * 주기 실행 시작 (첫 실행은 즉시).
     *
     * @throws IllegalStateException 이미 시작된 경우
     */
    public synchronized void start() {
        if (task != null) {
            throw new IllegalStateException("Sweep runner already started");
        }
        task = scheduler.scheduleWithFixedDelay(this::runOnce, 0, intervalMs, TimeUnit.MILLISECONDS);
        log.info("Sweep runner started: {} sweepers every {}ms", sweepers.size(), intervalMs);
    }

    /**
     * 모든 Sweeper를 한 번 실행.
     *
     * @return 합산 결과
     */
    public SweepReport runOnce() {
        SweepReport total = SweepReport.EMPTY;
        for (Sweeper sweeper : sweepers) {
            try {
                total = total.plus(sweeper.sweep());
            } catch (Exception e) {
                log.error("Sweeper {} failed", sweeper.getClass().getSimpleName(), e);
            }
        }
        return total;
    }

    public synchronized boolean isRunning() {
        return task != null && !task.isCancelled();
    }

    /**
     * 주기 실행 중지 (리소스 정리).
     *
     * @throws InterruptedException shutdown 대기 중 인터럽트 발생 시
     */
    public synchronized void stop() throws InterruptedException {
        if (task != null) {
            task.cancel(false);
        }
        scheduler.shutdown();
        if (!scheduler.awaitTermination(60, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
        log.info("Sweep runner stopped");
    }
}
