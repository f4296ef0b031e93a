package com.ryuqq.loadlifecycle.application.convoy;

/**
 * Load 상태 커밋 수신자.
 *
 * <p>엔진은 커밋 이후 리스너를 순서대로 호출하며, 리스너 예외는 로그만 남기고
 * 커밋을 되돌리지 않습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface LoadStateListener {

    void onLoadStateChange(LoadStateChange change);
}
