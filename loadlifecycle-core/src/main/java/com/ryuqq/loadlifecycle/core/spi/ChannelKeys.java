package com.ryuqq.loadlifecycle.core.spi;

import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.ConvoyId;
import com.ryuqq.loadlifecycle.core.model.LoadId;

/**
 * Deterministic broadcast channel keys.
 *
 * <p>Entity-scoped keys are derived from identity ({@code load:42}); system-wide keys are fixed.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class ChannelKeys {

    public static final String EMERGENCY_OPS = "emergency:ops";
    public static final String DISPATCH_UPDATES = "dispatch:updates";
    public static final String SAFETY_ALERTS = "safety:alerts";
    public static final String ESCORT_JOBS = "escort:jobs";

    private ChannelKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    public static String load(LoadId loadId) {
        return "load:" + loadId.getValue();
    }

    public static String user(String userId) {
        return "user:" + userId;
    }

    public static String company(String companyId) {
        return "company:" + companyId;
    }

    public static String driver(String driverId) {
        return "driver:" + driverId;
    }

    public static String convoy(ConvoyId convoyId) {
        return "convoy:" + convoyId.getValue();
    }

    /**
     * Role-wide channel (e.g. {@code role:dispatch}).
     */
    public static String role(ActorRole role) {
        return "role:" + role.name().toLowerCase();
    }
}
