package com.ryuqq.loadlifecycle.core.catalog;

/**
 * 효과 유형.
 *
 * <p>{@link #BROADCAST}는 실시간 푸시 채널로 전달되는 효과입니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum EffectKind {
    NOTIFICATION,
    EMAIL,
    SMS,
    BROADCAST,
    DATABASE,
    FINANCIAL,
    DOCUMENT,
    INTEGRATION
}
