package com.ryuqq.loadlifecycle.core.model;

/**
 * 사용자 알림 우선순위.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum NotificationPriority {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
