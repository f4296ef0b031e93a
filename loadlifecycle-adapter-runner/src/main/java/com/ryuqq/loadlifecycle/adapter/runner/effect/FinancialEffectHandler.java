package com.ryuqq.loadlifecycle.adapter.runner.effect;

import com.ryuqq.loadlifecycle.core.catalog.EffectKind;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.spi.EffectHandler;
import com.ryuqq.loadlifecycle.core.spi.EffectRequest;
import com.ryuqq.loadlifecycle.core.spi.FinancialLedger;
import com.ryuqq.loadlifecycle.core.spi.LedgerEntry;
import com.ryuqq.loadlifecycle.core.spi.LoadStore;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.Set;

/**
 * FINANCIAL 효과 핸들러.
 *
 * <p>효과마다 원장 항목을 하나 기록합니다. 에스크로, 청구, 정산 액션은 Load 운임을
 * 금액으로 싣고, 타이머와 수수료 액션은 금액 없이 기록합니다 (요율 계산은 원장 소비자의 몫).</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class FinancialEffectHandler implements EffectHandler {

    private static final Set<String> RATE_BEARING_ACTIONS = Set.of(
        "capture_escrow",
        "release_escrow",
        "generate_invoice",
        "process_settlement"
    );

    private final LoadStore loadStore;
    private final FinancialLedger ledger;
    private final Clock clock;

    public FinancialEffectHandler(LoadStore loadStore, FinancialLedger ledger, Clock clock) {
        if (loadStore == null) {
            throw new IllegalArgumentException("loadStore cannot be null");
        }
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.loadStore = loadStore;
        this.ledger = ledger;
        this.clock = clock;
    }

    @Override
    public Set<EffectKind> kinds() {
        return Set.of(EffectKind.FINANCIAL);
    }

    @Override
    public void handle(EffectRequest request) {
        String action = request.effect().action();
        BigDecimal amount = null;
        if (RATE_BEARING_ACTIONS.contains(action)) {
            amount = loadStore.findById(request.loadId()).map(Load::rate).orElse(null);
        }
        ledger.record(new LedgerEntry(request.loadId(), action, request.transitionId(), amount, clock.instant()));
    }
}
