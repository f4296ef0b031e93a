package com.ryuqq.loadlifecycle.adapter.runner.guard;

/**
 * 지오펜스 가드 설정 (불변 record).
 *
 * <p>상차지/하차지 도착 판정에 사용하는 반경입니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 * @param radiusMiles 지오펜스 반경 (마일, 양수여야 함)
 */
public record GeofenceConfig(double radiusMiles) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: radiusMiles=0.25</p>
     */
    public GeofenceConfig() {
        this(0.25);
    }

    public GeofenceConfig {
        if (radiusMiles <= 0.0) {
            throw new IllegalArgumentException(
                "radiusMiles must be positive (current: " + radiusMiles + ")"
            );
        }
    }

    /**
     * radiusMiles만 변경한 새 인스턴스 생성.
     */
    public GeofenceConfig withRadiusMiles(double radiusMiles) {
        return new GeofenceConfig(radiusMiles);
    }
}
