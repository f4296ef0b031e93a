package com.ryuqq.loadlifecycle.adapter.runner.convoy;

import com.ryuqq.loadlifecycle.core.convoy.Convoy;
import com.ryuqq.loadlifecycle.core.convoy.SeparationCheck;
import com.ryuqq.loadlifecycle.core.convoy.SeparationConfig;
import com.ryuqq.loadlifecycle.core.model.NotificationPriority;
import com.ryuqq.loadlifecycle.core.spi.BroadcastChannel;
import com.ryuqq.loadlifecycle.core.spi.BroadcastMessage;
import com.ryuqq.loadlifecycle.core.spi.ChannelKeys;
import com.ryuqq.loadlifecycle.core.spi.UserNotification;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Convoy 이격 거리 모니터.
 *
 * <p><strong>판정 (기본값):</strong></p>
 * <ul>
 *   <li>경보: 선도 &gt; 1200m 또는 후미 &gt; 800m</li>
 *   <li>주의: 경보가 아니면서 한계의 80% 초과</li>
 *   <li>자동 정지: 연속 경보 3회</li>
 * </ul>
 *
 * <p><strong>알림:</strong></p>
 * <ul>
 *   <li>경보: 모든 참여자에게 HIGH "Convoy Separation Alert" + Load 채널 {@code convoy_alert}.
 *       직전 알림 후 {@code alertIntervalSeconds}가 지나지 않았으면 생략 (자동 정지 경보는 항상 발송)</li>
 *   <li>주의: Load 채널에 {@code convoy_update}만 방송</li>
 * </ul>
 *
 * <p>연속 경보 횟수는 알림 생략 여부와 관계없이 경보마다 증가하고, 정상 판정에서 0으로 돌아갑니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class SeparationMonitor {

    private static final Logger log = LoggerFactory.getLogger(SeparationMonitor.class);

    private final SeparationConfig config;
    private final BroadcastChannel channel;
    private final Clock clock;

    public SeparationMonitor(SeparationConfig config, BroadcastChannel channel, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (channel == null) {
            throw new IllegalArgumentException("channel cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.config = config;
        this.channel = channel;
        this.clock = clock;
    }

    /**
     * 새 거리로 이격 상태 평가.
     *
     * <p>부수 효과가 없습니다. 저장과 알림은 호출자가 결과를 커밋한 뒤
     * {@link #publish(SeparationAssessment, Convoy)}로 수행합니다.</p>
     *
     * @param convoy 현재 Convoy
     * @param leadDistanceMeters 선도 차량 거리 (미터, 없으면 null)
     * @param rearDistanceMeters 후미 차량 거리 (미터, 없으면 null)
     * @return 판정과 갱신된 Convoy
     */
    public SeparationAssessment assess(Convoy convoy, Double leadDistanceMeters, Double rearDistanceMeters) {
        if (convoy == null) {
            throw new IllegalArgumentException("convoy cannot be null");
        }
        Instant now = clock.instant();
        SeparationCheck check = SeparationCheck.evaluate(
            config, leadDistanceMeters, rearDistanceMeters, convoy.consecutiveSeparationAlerts());
        Convoy updated = convoy.withDistances(leadDistanceMeters, rearDistanceMeters);

        if (!check.isAlert()) {
            return new SeparationAssessment(check,
                updated.withSeparationAlerts(0, convoy.lastSeparationAlertAt()), false, now);
        }

        boolean due = check.autoHold() || isNotificationDue(convoy.lastSeparationAlertAt(), now);
        Instant lastAlertAt = due ? now : convoy.lastSeparationAlertAt();
        return new SeparationAssessment(check,
            updated.withSeparationAlerts(check.consecutiveAlerts(), lastAlertAt), due, now);
    }

    /**
     * 커밋된 평가 결과를 방송.
     *
     * <p>주의는 Load 채널 {@code convoy_update}, 알림 대상 경보는 Load 채널 {@code convoy_alert}와
     * 참여자 알림입니다. 전송 실패는 기록만 하고 호출자에게 전파하지 않습니다.</p>
     *
     * @param assessment 평가 결과
     * @param committed 저장된 Convoy
     * @return 실패한 전송 수
     */
    public int publish(SeparationAssessment assessment, Convoy committed) {
        if (assessment == null) {
            throw new IllegalArgumentException("assessment cannot be null");
        }
        if (committed == null) {
            throw new IllegalArgumentException("committed cannot be null");
        }
        SeparationCheck check = assessment.check();
        Instant now = assessment.assessedAt();

        if (!check.isAlert()) {
            if (!check.isWarning()) {
                return 0;
            }
            return broadcast(committed, new BroadcastMessage(BroadcastMessage.CONVOY_UPDATE,
                alertData(committed, check, "separation_warning"), now)) ? 0 : 1;
        }

        log.warn("Convoy {} separation alert #{}: {}",
            committed.convoyId().getValue(), check.consecutiveAlerts(), check.message());
        if (!assessment.notificationDue()) {
            return 0;
        }

        int failed = broadcast(committed, new BroadcastMessage(BroadcastMessage.CONVOY_ALERT,
            alertData(committed, check, "separation"), now)) ? 0 : 1;
        for (String userId : committed.participants()) {
            try {
                channel.notifyUser(userId, new UserNotification(
                    "convoy_separation_alert",
                    "Convoy Separation Alert",
                    check.message(),
                    NotificationPriority.HIGH,
                    alertData(committed, check, "separation"),
                    now
                ));
            } catch (Exception e) {
                failed++;
                log.warn("Failed to notify {} of separation alert for convoy {}",
                    userId, committed.convoyId().getValue(), e);
            }
        }
        return failed;
    }

    public SeparationConfig config() {
        return config;
    }

    private boolean broadcast(Convoy convoy, BroadcastMessage message) {
        try {
            channel.broadcast(ChannelKeys.load(convoy.loadId()), message);
            return true;
        } catch (Exception e) {
            log.warn("Failed to broadcast {} for convoy {}", message.event(), convoy.convoyId().getValue(), e);
            return false;
        }
    }

    private boolean isNotificationDue(Instant lastAlertAt, Instant now) {
        if (lastAlertAt == null) {
            return true;
        }
        return Duration.between(lastAlertAt, now).getSeconds() >= config.alertIntervalSeconds();
    }

    private static Map<String, Object> alertData(Convoy convoy, SeparationCheck check, String alertType) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("convoyId", convoy.convoyId().getValue());
        data.put("loadId", convoy.loadId().getValue());
        data.put("alertType", alertType);
        data.put("leadDistance", check.leadDistanceMeters());
        data.put("rearDistance", check.rearDistanceMeters());
        data.put("leadAlert", check.leadAlert());
        data.put("rearAlert", check.rearAlert());
        data.put("message", check.message());
        return data;
    }
}
