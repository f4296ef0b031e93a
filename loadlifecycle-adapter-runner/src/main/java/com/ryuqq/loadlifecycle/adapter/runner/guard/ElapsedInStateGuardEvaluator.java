package com.ryuqq.loadlifecycle.adapter.runner.guard;

import com.ryuqq.loadlifecycle.core.catalog.AutoTransition;
import com.ryuqq.loadlifecycle.core.catalog.TransitionCatalog;
import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;

import java.time.Duration;
import java.util.Optional;

/**
 * 시간 경과 가드 평가기 (past_deadline, award_expired_2hr, confirmation_window_elapsed, pod_24h_elapsed).
 *
 * <p>현재 상태에 머문 시간이 그 상태의 자동 전이 타임아웃 이상이면 통과합니다.
 * 기준 시각은 저장된 {@code stateEnteredAt}이므로 프로세스 재시작과 무관합니다.</p>
 *
 * <p>현재 상태에 자동 전이가 선언되지 않았으면 실패합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ElapsedInStateGuardEvaluator implements GuardEvaluator {

    private final TransitionCatalog catalog;

    public ElapsedInStateGuardEvaluator(TransitionCatalog catalog) {
        if (catalog == null) {
            throw new IllegalArgumentException("catalog cannot be null");
        }
        this.catalog = catalog;
    }

    @Override
    public GuardVerdict evaluate(GuardContext context) {
        Optional<AutoTransition> auto = catalog.metadata(context.load().state()).findAutoTransition();
        if (auto.isEmpty()) {
            return GuardVerdict.fail(null);
        }
        Duration elapsed = Duration.between(context.load().stateEnteredAt(), context.now());
        return GuardVerdict.of(elapsed.compareTo(auto.get().timeout()) >= 0);
    }
}
