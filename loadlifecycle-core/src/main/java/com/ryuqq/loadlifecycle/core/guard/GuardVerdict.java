package com.ryuqq.loadlifecycle.core.guard;

/**
 * 가드 평가 결과.
 *
 * @param passed 통과 여부
 * @param message 실패 시 메시지 (통과이면 null, 실패인데 null이면 가드 선언 메시지 사용)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record GuardVerdict(boolean passed, String message) {

    private static final GuardVerdict PASS = new GuardVerdict(true, null);

    public static GuardVerdict pass() {
        return PASS;
    }

    public static GuardVerdict fail(String message) {
        return new GuardVerdict(false, message);
    }

    /**
     * 조건식으로 결과 생성.
     *
     * @param condition 통과 조건
     * @return 조건이 참이면 pass, 거짓이면 메시지 없는 fail
     */
    public static GuardVerdict of(boolean condition) {
        return condition ? PASS : new GuardVerdict(false, null);
    }
}
