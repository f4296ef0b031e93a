package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import com.ryuqq.loadlifecycle.core.statemachine.TriggerType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 불변 전이 정의.
 *
 * <p>{@code from}은 여러 상태일 수 있으며 {@code to}는 항상 하나입니다.
 * 허용 역할은 {@link EnumSet}으로 보관되어 멤버십 검사만으로 권한을 판정합니다.</p>
 *
 * <p><strong>정렬:</strong> {@code priority}가 낮을수록 먼저 표시됩니다.
 * 실행 우선순위에는 영향을 주지 않습니다.</p>
 *
 * @param id 전이 ID (예: DRAFT_TO_POSTED)
 * @param from 출발 상태 집합
 * @param to 도착 상태
 * @param trigger 트리거 유형
 * @param triggerEvent 트리거 이벤트 이름 (예: publish_load)
 * @param allowedActors 허용 역할
 * @param guards 선언 순서대로 평가되는 가드
 * @param effects 선언 순서대로 전달되는 효과
 * @param priority 표시 우선순위
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record TransitionDefinition(
    String id,
    Set<LoadState> from,
    LoadState to,
    TriggerType trigger,
    String triggerEvent,
    Set<ActorRole> allowedActors,
    List<Guard> guards,
    List<Effect> effects,
    int priority
) {

    public TransitionDefinition {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        if (from == null || from.isEmpty()) {
            throw new IllegalArgumentException("from cannot be null or empty (transition: " + id + ")");
        }
        if (to == null) {
            throw new IllegalArgumentException("to cannot be null (transition: " + id + ")");
        }
        if (trigger == null) {
            throw new IllegalArgumentException("trigger cannot be null (transition: " + id + ")");
        }
        if (allowedActors == null || allowedActors.isEmpty()) {
            throw new IllegalArgumentException("allowedActors cannot be null or empty (transition: " + id + ")");
        }
        from = Collections.unmodifiableSet(EnumSet.copyOf(from));
        allowedActors = Collections.unmodifiableSet(EnumSet.copyOf(allowedActors));
        guards = guards == null ? List.of() : List.copyOf(guards);
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    /**
     * 주어진 상태에서 출발하는 전이인지 확인.
     *
     * @param state 현재 상태
     * @return from 집합에 포함되면 true
     */
    public boolean originatesFrom(LoadState state) {
        return from.contains(state);
    }

    /**
     * 주어진 역할이 이 전이를 요청할 수 있는지 확인.
     *
     * @param role 행위자 역할
     * @return 허용 역할이면 true
     */
    public boolean permits(ActorRole role) {
        return allowedActors.contains(role);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * 카탈로그 선언용 빌더.
     */
    public static final class Builder {

        private final String id;
        private final EnumSet<LoadState> from = EnumSet.noneOf(LoadState.class);
        private LoadState to;
        private TriggerType trigger = TriggerType.USER_ACTION;
        private String triggerEvent;
        private final EnumSet<ActorRole> actors = EnumSet.noneOf(ActorRole.class);
        private final List<Guard> guards = new ArrayList<>();
        private final List<Effect> effects = new ArrayList<>();
        private int priority = 1;

        private Builder(String id) {
            this.id = id;
        }

        public Builder from(LoadState... states) {
            from.addAll(Arrays.asList(states));
            return this;
        }

        public Builder to(LoadState state) {
            this.to = state;
            return this;
        }

        public Builder trigger(TriggerType trigger, String event) {
            this.trigger = trigger;
            this.triggerEvent = event;
            return this;
        }

        public Builder actors(ActorRole... roles) {
            actors.addAll(Arrays.asList(roles));
            return this;
        }

        public Builder guard(GuardKind kind, String check, String errorMessage) {
            guards.add(Guard.of(kind, check, errorMessage));
            return this;
        }

        public Builder effect(EffectKind kind, String action, ActorRole... recipients) {
            effects.add(Effect.of(kind, action, recipients));
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public TransitionDefinition build() {
            return new TransitionDefinition(id, from, to, trigger, triggerEvent, actors, guards, effects, priority);
        }
    }
}
