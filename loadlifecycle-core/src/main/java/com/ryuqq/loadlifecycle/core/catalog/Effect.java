package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.model.ActorRole;

import java.util.Map;
import java.util.Set;

/**
 * 선언적 부수 효과.
 *
 * <p>Effect는 전이가 커밋된 뒤 {@link com.ryuqq.loadlifecycle.core.spi.EffectDispatcher}로
 * 전달될 뿐, 조건으로 평가되지 않습니다.</p>
 *
 * @param kind 효과 유형
 * @param action 액션 식별자 (예: load_posted, start_detention_timer)
 * @param recipients 수신 역할 (없으면 빈 집합)
 * @param payload 부가 데이터 (없으면 빈 맵)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Effect(
    EffectKind kind,
    String action,
    Set<ActorRole> recipients,
    Map<String, Object> payload
) {

    public Effect {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action cannot be null or blank");
        }
        recipients = recipients == null ? Set.of() : Set.copyOf(recipients);
        payload = payload == null ? Map.of() : Map.copyOf(payload);
    }

    public static Effect of(EffectKind kind, String action, ActorRole... recipients) {
        return new Effect(kind, action, Set.of(recipients), Map.of());
    }

    /**
     * 감사 기록에 남기는 표기 ("kind:action").
     *
     * @return 예: notification:load_posted
     */
    public String label() {
        return kind.name().toLowerCase() + ":" + action;
    }
}
