package com.ryuqq.loadlifecycle.core.convoy;

import com.ryuqq.loadlifecycle.core.statemachine.LoadState;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Convoy 진행을 멈추는 화물 예외 상태.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class CargoExceptions {

    private static final Set<LoadState> STATES = Collections.unmodifiableSet(EnumSet.of(
        LoadState.TEMP_EXCURSION,
        LoadState.REEFER_BREAKDOWN,
        LoadState.CONTAMINATION_REJECT,
        LoadState.SEAL_BREACH,
        LoadState.WEIGHT_VIOLATION
    ));

    private CargoExceptions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static boolean isCargoException(LoadState state) {
        return state != null && STATES.contains(state);
    }

    public static Set<LoadState> states() {
        return STATES;
    }
}
