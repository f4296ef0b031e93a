package com.ryuqq.loadlifecycle.adapter.runner.sweep;

import com.ryuqq.loadlifecycle.application.sweep.SweepReport;
import com.ryuqq.loadlifecycle.application.sweep.Sweeper;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ScheduledSweepRunner 유닛 테스트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
class ScheduledSweepRunnerTest {

    @Test
    void runOnce_모든_Sweeper_결과를_합산() throws InterruptedException {
        // given
        ScheduledSweepRunner runner = new ScheduledSweepRunner(List.of(
            () -> new SweepReport(3, 2, 1, 0),
            () -> new SweepReport(1, 0, 0, 1)
        ), 1000);

        // when
        SweepReport total = runner.runOnce();

        // then
        assertThat(total).isEqualTo(new SweepReport(4, 2, 1, 1));
        runner.stop();
    }

    @Test
    void runOnce_한_Sweeper가_예외를_던져도_나머지는_실행() throws InterruptedException {
        // given
        Sweeper broken = () -> {
            throw new IllegalStateException("scan failed");
        };
        ScheduledSweepRunner runner = new ScheduledSweepRunner(List.of(broken, () -> new SweepReport(2, 2, 0, 0)), 1000);

        // when
        SweepReport total = runner.runOnce();

        // then
        assertThat(total).isEqualTo(new SweepReport(2, 2, 0, 0));
        runner.stop();
    }

    @Test
    void start_주기적으로_sweep_실행() throws InterruptedException {
        // given
        CountDownLatch latch = new CountDownLatch(3);
        ScheduledSweepRunner runner = new ScheduledSweepRunner(List.of(() -> {
            latch.countDown();
            return SweepReport.EMPTY;
        }), 10);

        // when
        runner.start();

        // then
        assertThat(latch.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(runner.isRunning()).isTrue();
        runner.stop();
        assertThat(runner.isRunning()).isFalse();
    }

    @Test
    void start_두번_호출하면_예외() throws InterruptedException {
        // given
        ScheduledSweepRunner runner = new ScheduledSweepRunner(List.of(() -> SweepReport.EMPTY), 60_000);
        runner.start();

        // when & then
        assertThatThrownBy(runner::start)
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("already started");
        runner.stop();
    }

    @Test
    void 생성자_잘못된_파라미터는_거부() {
        assertThatThrownBy(() -> new ScheduledSweepRunner(List.of(), 1000))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ScheduledSweepRunner(List.of(() -> SweepReport.EMPTY), 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("intervalMs must be positive");
        assertThatThrownBy(() -> new SweeperConfig(60_000, 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("batchSize must be positive");
    }
}
