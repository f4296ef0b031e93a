package com.ryuqq.loadlifecycle.core.convoy;

import java.util.ArrayList;
import java.util.List;

/**
 * 간격 판정 결과.
 *
 * <p>거리는 Convoy에 저장된 마지막 보고값이며, 이 판정은 측지 거리를 계산하지 않습니다.</p>
 *
 * @param leadDistanceMeters 선도 간격 (없으면 null)
 * @param rearDistanceMeters 후미 간격 (없으면 null)
 * @param leadAlert 선도 최대치 초과
 * @param rearAlert 후미 최대치 초과
 * @param leadWarning 선도 경고 구간 (초과 아님)
 * @param rearWarning 후미 경고 구간 (초과 아님)
 * @param consecutiveAlerts 이번 판정을 반영한 연속 경보 횟수
 * @param autoHold 자동 정지 기준 도달 여부
 * @param message 사람이 읽는 요약 (경보/경고가 없으면 null)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SeparationCheck(
    Double leadDistanceMeters,
    Double rearDistanceMeters,
    boolean leadAlert,
    boolean rearAlert,
    boolean leadWarning,
    boolean rearWarning,
    int consecutiveAlerts,
    boolean autoHold,
    String message
) {

    /**
     * 간격 판정.
     *
     * @param config 감시 설정
     * @param leadDistanceMeters 선도 간격 (null이면 판정 제외)
     * @param rearDistanceMeters 후미 간격 (null이면 판정 제외)
     * @param priorConsecutiveAlerts 직전까지의 연속 경보 횟수
     * @return 판정 결과
     */
    public static SeparationCheck evaluate(
        SeparationConfig config,
        Double leadDistanceMeters,
        Double rearDistanceMeters,
        int priorConsecutiveAlerts
    ) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        double leadMax = config.maxLeadDistanceMeters();
        double rearMax = config.maxRearDistanceMeters();
        boolean leadAlert = leadDistanceMeters != null && leadDistanceMeters > leadMax;
        boolean rearAlert = rearDistanceMeters != null && rearDistanceMeters > rearMax;
        boolean leadWarning = !leadAlert && leadDistanceMeters != null
            && leadDistanceMeters > leadMax * config.warningThresholdPct();
        boolean rearWarning = !rearAlert && rearDistanceMeters != null
            && rearDistanceMeters > rearMax * config.warningThresholdPct();

        boolean alert = leadAlert || rearAlert;
        int consecutive = alert ? priorConsecutiveAlerts + 1 : 0;
        boolean autoHold = alert && consecutive >= config.autoHoldAfterAlerts();

        String message = null;
        if (alert) {
            List<String> parts = new ArrayList<>();
            if (leadAlert) {
                parts.add("Lead escort " + Math.round(leadDistanceMeters) + "m away (max " + Math.round(leadMax) + "m)");
            }
            if (rearAlert) {
                parts.add("Rear escort " + Math.round(rearDistanceMeters) + "m away (max " + Math.round(rearMax) + "m)");
            }
            message = "Separation alert: " + String.join("; ", parts);
        } else if (leadWarning || rearWarning) {
            List<String> parts = new ArrayList<>();
            if (leadWarning) {
                parts.add("Lead escort " + Math.round(leadDistanceMeters) + "m away (max " + Math.round(leadMax) + "m)");
            }
            if (rearWarning) {
                parts.add("Rear escort " + Math.round(rearDistanceMeters) + "m away (max " + Math.round(rearMax) + "m)");
            }
            message = "Separation warning: " + String.join("; ", parts);
        }

        return new SeparationCheck(leadDistanceMeters, rearDistanceMeters, leadAlert, rearAlert,
            leadWarning, rearWarning, consecutive, autoHold, message);
    }

    public boolean isAlert() {
        return leadAlert || rearAlert;
    }

    public boolean isWarning() {
        return !isAlert() && (leadWarning || rearWarning);
    }
}
