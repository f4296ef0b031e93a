package com.ryuqq.loadlifecycle.core.model;

/**
 * 전이를 요청한 행위자.
 *
 * @param actorId 행위자 식별자 (사용자 ID 또는 시스템 컴포넌트 이름)
 * @param role 행위자 역할
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Actor(
    String actorId,
    ActorRole role
) {

    private static final Actor SYSTEM = new Actor("system", ActorRole.SYSTEM);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException actorId가 비어있거나 role이 null인 경우
     */
    public Actor {
        if (actorId == null || actorId.isBlank()) {
            throw new IllegalArgumentException("actorId cannot be null or blank");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
    }

    /**
     * Actor 생성.
     *
     * @param actorId 행위자 식별자
     * @param role 행위자 역할
     * @return Actor 인스턴스
     */
    public static Actor of(String actorId, ActorRole role) {
        return new Actor(actorId, role);
    }

    /**
     * 스케줄러와 동기화 계층이 사용하는 시스템 행위자.
     *
     * @return SYSTEM 역할의 Actor
     */
    public static Actor system() {
        return SYSTEM;
    }
}
