package com.ryuqq.loadlifecycle.adapter.inmemory.external;

import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.spi.ApprovalService;

import java.math.BigDecimal;
import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ApprovalService}.
 *
 * <p>Approval limits are kept per role, with optional per-user overrides. Roles without
 * a limit are unlimited. A payment is valid when it equals the load rate.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public class InMemoryApprovalService implements ApprovalService {

    private final Map<ActorRole, BigDecimal> roleLimits = new EnumMap<>(ActorRole.class);
    private final ConcurrentHashMap<String, BigDecimal> userLimits = new ConcurrentHashMap<>();

    @Override
    public boolean isWithinApprovalLimit(Actor approver, BigDecimal amount) {
        if (approver == null) {
            throw new IllegalArgumentException("approver cannot be null");
        }
        if (amount == null) {
            return false;
        }
        BigDecimal limit = userLimits.get(approver.actorId());
        if (limit == null) {
            synchronized (roleLimits) {
                limit = roleLimits.get(approver.role());
            }
        }
        return limit == null || amount.compareTo(limit) <= 0;
    }

    @Override
    public boolean isPaymentValid(Load load, BigDecimal amount) {
        if (load == null) {
            throw new IllegalArgumentException("load cannot be null");
        }
        if (amount == null || amount.signum() <= 0 || load.rate() == null) {
            return false;
        }
        return amount.compareTo(load.rate()) == 0;
    }

    public void setRoleLimit(ActorRole role, BigDecimal limit) {
        if (role == null || limit == null) {
            throw new IllegalArgumentException("role and limit cannot be null");
        }
        synchronized (roleLimits) {
            roleLimits.put(role, limit);
        }
    }

    public void setUserLimit(String userId, BigDecimal limit) {
        if (userId == null || limit == null) {
            throw new IllegalArgumentException("userId and limit cannot be null");
        }
        userLimits.put(userId, limit);
    }
}
