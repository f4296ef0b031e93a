package com.ryuqq.loadlifecycle.adapter.runner.guard;

import com.ryuqq.loadlifecycle.core.guard.GuardContext;
import com.ryuqq.loadlifecycle.core.guard.GuardEvaluator;
import com.ryuqq.loadlifecycle.core.guard.GuardVerdict;
import com.ryuqq.loadlifecycle.core.model.GeoPoint;
import com.ryuqq.loadlifecycle.core.model.Load;

import java.util.Locale;

/**
 * 위치 가드 평가기.
 *
 * <p>요청 GPS 좌표와 Load의 상차지(또는 하차지) 사이 거리가 반경 이내인지 판정합니다.
 * 거리는 {@link GeoPoint#distanceMilesTo(GeoPoint)} (Haversine, R=3958.8mi)로 계산합니다.</p>
 *
 * <p><strong>실패 메시지:</strong></p>
 * <ul>
 *   <li>요청 좌표 없음: "GPS location required for pickup check-in"</li>
 *   <li>대상 좌표 없음: "Pickup location coordinates unavailable"</li>
 *   <li>반경 밖: 선언된 메시지 + " (0.80 mi away, must be within 0.25 mi)"</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class GeofenceGuardEvaluator implements GuardEvaluator {

    /**
     * 판정 대상 시설.
     */
    public enum Facility {
        PICKUP("pickup"),
        DELIVERY("delivery");

        private final String label;

        Facility(String label) {
            this.label = label;
        }

        GeoPoint locationOf(Load load) {
            return this == PICKUP ? load.pickupLocation() : load.deliveryLocation();
        }
    }

    private final Facility facility;
    private final GeofenceConfig config;

    public GeofenceGuardEvaluator(Facility facility, GeofenceConfig config) {
        if (facility == null) {
            throw new IllegalArgumentException("facility cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.facility = facility;
        this.config = config;
    }

    @Override
    public GuardVerdict evaluate(GuardContext context) {
        GeoPoint actual = context.request().location();
        if (actual == null) {
            return GuardVerdict.fail("GPS location required for " + facility.label + " check-in");
        }

        GeoPoint target = facility.locationOf(context.load());
        if (target == null) {
            String label = facility.label.substring(0, 1).toUpperCase(Locale.ROOT) + facility.label.substring(1);
            return GuardVerdict.fail(label + " location coordinates unavailable");
        }

        double distance = actual.distanceMilesTo(target);
        if (distance <= config.radiusMiles()) {
            return GuardVerdict.pass();
        }
        return GuardVerdict.fail(String.format(Locale.ROOT, "%s (%.2f mi away, must be within %s mi)",
            context.guard().errorMessage(), distance, config.radiusMiles()));
    }
}
