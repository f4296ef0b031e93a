package com.ryuqq.loadlifecycle.core.outcome;

/**
 * 전이 거부 상세.
 *
 * @param code 거부 사유 코드
 * @param message 호출자에게 그대로 노출되는 메시지
 * @param check 실패한 가드 식별자 (GUARD_FAILED가 아니면 null)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record TransitionError(
    TransitionErrorCode code,
    String message,
    String check
) {

    public TransitionError {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        if (code == TransitionErrorCode.GUARD_FAILED && (check == null || check.isBlank())) {
            throw new IllegalArgumentException("check is required for GUARD_FAILED");
        }
    }

    public static TransitionError of(TransitionErrorCode code, String message) {
        return new TransitionError(code, message, null);
    }

    public static TransitionError guardFailed(String check, String message) {
        return new TransitionError(TransitionErrorCode.GUARD_FAILED, message, check);
    }
}
