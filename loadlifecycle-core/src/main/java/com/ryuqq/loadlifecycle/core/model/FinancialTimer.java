package com.ryuqq.loadlifecycle.core.model;

import java.util.Optional;

/**
 * 청구 가능한 대기 시간을 표시하는 재무 타이머.
 *
 * <p>전이의 FINANCIAL 효과 중 {@code start_<name>_timer} / {@code stop_<name>_timer}
 * 액션이 타이머의 시작과 종료를 나타냅니다. 요율 계산은 이 모듈의 범위가 아닙니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum FinancialTimer {
    DETENTION,
    DEMURRAGE,
    LAYOVER;

    private String startAction() {
        return "start_" + name().toLowerCase() + "_timer";
    }

    private String stopAction() {
        return "stop_" + name().toLowerCase() + "_timer";
    }

    /**
     * 시작 액션에 해당하는 타이머 조회.
     *
     * @param action 효과 액션 식별자
     * @return 시작 액션이면 해당 타이머, 아니면 empty
     */
    public static Optional<FinancialTimer> startedBy(String action) {
        for (FinancialTimer timer : values()) {
            if (timer.startAction().equals(action)) {
                return Optional.of(timer);
            }
        }
        return Optional.empty();
    }

    /**
     * 종료 액션에 해당하는 타이머 조회.
     *
     * @param action 효과 액션 식별자
     * @return 종료 액션이면 해당 타이머, 아니면 empty
     */
    public static Optional<FinancialTimer> stoppedBy(String action) {
        for (FinancialTimer timer : values()) {
            if (timer.stopAction().equals(action)) {
                return Optional.of(timer);
            }
        }
        return Optional.empty();
    }
}
