package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.Load;

import java.math.BigDecimal;

/**
 * Approval and financial limit checks.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public interface ApprovalService {

    /**
     * Whether the approver may commit to a rate without escalation.
     *
     * @param approver the acting user
     * @param amount the rate being committed
     * @return true if within the approver's limit
     */
    boolean isWithinApprovalLimit(Actor approver, BigDecimal amount);

    /**
     * Whether a received payment matches what was invoiced for the load.
     *
     * @param load the load
     * @param amount the received amount
     * @return true if the payment is acceptable
     */
    boolean isPaymentValid(Load load, BigDecimal amount);
}
