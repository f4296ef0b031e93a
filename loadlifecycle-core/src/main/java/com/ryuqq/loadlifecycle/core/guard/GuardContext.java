package com.ryuqq.loadlifecycle.core.guard;

import com.ryuqq.loadlifecycle.core.catalog.Guard;
import com.ryuqq.loadlifecycle.core.catalog.TransitionDefinition;
import com.ryuqq.loadlifecycle.core.model.Actor;
import com.ryuqq.loadlifecycle.core.model.Load;
import com.ryuqq.loadlifecycle.core.model.TransitionContext;

import java.time.Instant;

/**
 * 가드 평가 입력.
 *
 * @param load 평가 시점의 Load 스냅샷
 * @param transition 시도 중인 전이 정의
 * @param guard 평가 중인 가드 선언
 * @param actor 요청 행위자
 * @param request 요청 컨텍스트
 * @param now 평가 기준 시각
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record GuardContext(
    Load load,
    TransitionDefinition transition,
    Guard guard,
    Actor actor,
    TransitionContext request,
    Instant now
) {

    public GuardContext {
        if (load == null) {
            throw new IllegalArgumentException("load cannot be null");
        }
        if (transition == null) {
            throw new IllegalArgumentException("transition cannot be null");
        }
        if (guard == null) {
            throw new IllegalArgumentException("guard cannot be null");
        }
        if (actor == null) {
            throw new IllegalArgumentException("actor cannot be null");
        }
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
    }
}
