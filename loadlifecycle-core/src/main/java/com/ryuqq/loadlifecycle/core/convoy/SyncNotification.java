package com.ryuqq.loadlifecycle.core.convoy;

import com.ryuqq.loadlifecycle.core.model.NotificationPriority;

import java.util.Map;
import java.util.Optional;

/**
 * 동기화 알림 키별 표시 문구.
 *
 * @param key 알림 키
 * @param title 제목
 * @param message 본문
 * @param priority 우선순위
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SyncNotification(
    String key,
    String title,
    String message,
    NotificationPriority priority
) {

    private static final Map<String, SyncNotification> CATALOG = Map.of(
        "convoy_ready_to_depart", new SyncNotification("convoy_ready_to_depart",
            "Convoy Ready", "Both primary and escort confirmed. Convoy ready to depart.",
            NotificationPriority.HIGH),
        "convoy_departing", new SyncNotification("convoy_departing",
            "Convoy Departing", "Convoy is forming and departing from pickup.",
            NotificationPriority.HIGH),
        "convoy_formed_all_positions", new SyncNotification("convoy_formed_all_positions",
            "Convoy Formed", "All positions confirmed. Convoy is in transit.",
            NotificationPriority.MEDIUM),
        "convoy_arrived_at_delivery", new SyncNotification("convoy_arrived_at_delivery",
            "Convoy Arrived", "Convoy has arrived at the delivery location.",
            NotificationPriority.MEDIUM),
        "escort_mission_complete", new SyncNotification("escort_mission_complete",
            "Escort Complete", "Escort mission is complete. Thank you for your service.",
            NotificationPriority.LOW)
    );

    public SyncNotification {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key cannot be null or blank");
        }
        if (priority == null) {
            throw new IllegalArgumentException("priority cannot be null");
        }
    }

    /**
     * 알림 키 조회.
     *
     * @param key 알림 키
     * @return 등록된 문구 (없으면 empty)
     */
    public static Optional<SyncNotification> lookup(String key) {
        return Optional.ofNullable(CATALOG.get(key));
    }
}
