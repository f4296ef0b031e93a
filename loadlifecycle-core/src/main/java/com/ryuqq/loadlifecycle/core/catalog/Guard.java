package com.ryuqq.loadlifecycle.core.catalog;

/**
 * 선언적 전이 전제 조건.
 *
 * <p>Guard는 데이터일 뿐 실행 코드를 갖지 않습니다. 엔진은 기동 시점에
 * {@code check} 식별자를 {@link com.ryuqq.loadlifecycle.core.guard.GuardEvaluator}로
 * 한 번 해석하고, 이후에는 해석된 평가기만 호출합니다.</p>
 *
 * @param kind 가드 유형
 * @param check 검사 식별자 (예: has_pickup_location)
 * @param errorMessage 실패 시 호출자에게 반환할 메시지
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record Guard(
    GuardKind kind,
    String check,
    String errorMessage
) {

    public Guard {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (check == null || check.isBlank()) {
            throw new IllegalArgumentException("check cannot be null or blank");
        }
        if (errorMessage == null || errorMessage.isBlank()) {
            throw new IllegalArgumentException("errorMessage cannot be null or blank");
        }
    }

    public static Guard of(GuardKind kind, String check, String errorMessage) {
        return new Guard(kind, check, errorMessage);
    }
}
