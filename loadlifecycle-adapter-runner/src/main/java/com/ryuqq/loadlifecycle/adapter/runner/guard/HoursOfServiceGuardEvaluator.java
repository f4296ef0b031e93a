package com.ryuqq.loadlifecycle.adapter.runner.guard;

import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.spi.HoursOfServiceService;

import java.time.Duration;

/**
 * 운행시간(HOS) 가드 평가기.
 *
 * <p>운전자는 Load에 배정된 DRIVER, 없으면 이번 요청의 DRIVER 배정에서 찾습니다.
 * 남은 운행 가능 시간이 0보다 커야 통과합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class HoursOfServiceGuardEvaluator implements GuardEvaluator {

    private final HoursOfServiceService hoursOfService;

    public HoursOfServiceGuardEvaluator(HoursOfServiceService hoursOfService) {
        if (hoursOfService == null) {
            throw new IllegalArgumentException("hoursOfService cannot be null");
        }
        this.hoursOfService = hoursOfService;
    }

    @Override
    public GuardVerdict evaluate(GuardContext context) {
        String driverId = context.load().participant(ActorRole.DRIVER)
            .orElse(context.request().assignments().get(ActorRole.DRIVER));
        if (driverId == null) {
            return GuardVerdict.fail(context.guard().errorMessage() + ": no driver assigned");
        }

        Duration remaining = hoursOfService.remainingDriveTime(driverId);
        if (remaining != null && remaining.compareTo(Duration.ZERO) > 0) {
            return GuardVerdict.pass();
        }
        return GuardVerdict.fail(context.guard().errorMessage() + ": driver " + driverId + " has no drive time remaining");
    }
}
