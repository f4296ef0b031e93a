package com.ryuqq.loadlifecycle.core.model;

/**
 * 전이를 요청할 수 있는 행위자 역할.
 *
 * <p>전이 정의의 허용 역할 목록은 {@link java.util.EnumSet}으로 보관되며,
 * 권한 검사는 문자열 비교가 아닌 집합 멤버십 검사로 수행됩니다.</p>
 *
 * <p>{@link #SYSTEM}은 스케줄러와 Convoy 동기화 계층이 사용하는 내부 역할입니다.
 * 사람이 이 역할로 요청하는 경우는 없습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public enum ActorRole {
    SHIPPER,
    BROKER,
    CATALYST,
    DRIVER,
    DISPATCH,
    ESCORT,
    TERMINAL_MANAGER,
    FACTORING,
    COMPLIANCE_OFFICER,
    SAFETY_MANAGER,
    ADMIN,
    SUPER_ADMIN,
    SYSTEM
}
