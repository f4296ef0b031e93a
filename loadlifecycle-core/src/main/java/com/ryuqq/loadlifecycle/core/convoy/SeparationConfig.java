package com.ryuqq.loadlifecycle.core.convoy;

/**
 * 호송 간격 감시 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxLeadDistanceMeters: 선도 차량 최대 간격 (기본 1200m, 약 0.75mi)</li>
 *   <li>maxRearDistanceMeters: 후미 차량 최대 간격 (기본 800m, 약 0.5mi)</li>
 *   <li>warningThresholdPct: 경고 시작 비율 (기본 0.8 = 최대치의 80%)</li>
 *   <li>alertIntervalSeconds: 참여자 경보 알림 최소 간격 (기본 30초)</li>
 *   <li>autoHoldAfterAlerts: 자동 정지까지의 연속 경보 횟수 (기본 3)</li>
 * </ul>
 *
 * @param maxLeadDistanceMeters 선도 최대 간격 (양수)
 * @param maxRearDistanceMeters 후미 최대 간격 (양수)
 * @param warningThresholdPct 경고 비율 (0 초과 1 이하)
 * @param alertIntervalSeconds 경보 알림 최소 간격 (0 이상)
 * @param autoHoldAfterAlerts 자동 정지 기준 (1 이상)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SeparationConfig(
    double maxLeadDistanceMeters,
    double maxRearDistanceMeters,
    double warningThresholdPct,
    long alertIntervalSeconds,
    int autoHoldAfterAlerts
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: 1200m, 800m, 0.8, 30초, 3회</p>
     */
    public SeparationConfig() {
        this(1200, 800, 0.8, 30, 3);
    }

    public SeparationConfig {
        if (maxLeadDistanceMeters <= 0) {
            throw new IllegalArgumentException(
                "maxLeadDistanceMeters must be positive (current: " + maxLeadDistanceMeters + ")"
            );
        }
        if (maxRearDistanceMeters <= 0) {
            throw new IllegalArgumentException(
                "maxRearDistanceMeters must be positive (current: " + maxRearDistanceMeters + ")"
            );
        }
        if (warningThresholdPct <= 0 || warningThresholdPct > 1) {
            throw new IllegalArgumentException(
                "warningThresholdPct must be in (0, 1] (current: " + warningThresholdPct + ")"
            );
        }
        if (alertIntervalSeconds < 0) {
            throw new IllegalArgumentException(
                "alertIntervalSeconds cannot be negative (current: " + alertIntervalSeconds + ")"
            );
        }
        if (autoHoldAfterAlerts <= 0) {
            throw new IllegalArgumentException(
                "autoHoldAfterAlerts must be positive (current: " + autoHoldAfterAlerts + ")"
            );
        }
    }

    public SeparationConfig withMaxLeadDistanceMeters(double maxLeadDistanceMeters) {
        return new SeparationConfig(maxLeadDistanceMeters, maxRearDistanceMeters, warningThresholdPct,
            alertIntervalSeconds, autoHoldAfterAlerts);
    }

    public SeparationConfig withMaxRearDistanceMeters(double maxRearDistanceMeters) {
        return new SeparationConfig(maxLeadDistanceMeters, maxRearDistanceMeters, warningThresholdPct,
            alertIntervalSeconds, autoHoldAfterAlerts);
    }

    public SeparationConfig withWarningThresholdPct(double warningThresholdPct) {
        return new SeparationConfig(maxLeadDistanceMeters, maxRearDistanceMeters, warningThresholdPct,
            alertIntervalSeconds, autoHoldAfterAlerts);
    }

    public SeparationConfig withAlertIntervalSeconds(long alertIntervalSeconds) {
        return new SeparationConfig(maxLeadDistanceMeters, maxRearDistanceMeters, warningThresholdPct,
            alertIntervalSeconds, autoHoldAfterAlerts);
    }

    public SeparationConfig withAutoHoldAfterAlerts(int autoHoldAfterAlerts) {
        return new SeparationConfig(maxLeadDistanceMeters, maxRearDistanceMeters, warningThresholdPct,
            alertIntervalSeconds, autoHoldAfterAlerts);
    }
}
