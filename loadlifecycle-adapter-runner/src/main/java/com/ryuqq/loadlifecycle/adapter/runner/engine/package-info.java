/**
 * Transition Engine.
 *
 * <p>인증, 가드 평가, 버전 비교 커밋, 감사 기록, 효과 전달 순서로 전이를 수행합니다.
 * 가드는 {@link com.ryuqq.loadlifecycle.adapter.runner.engine.EngineConfig#guardTimeoutMs()} 안에
 * 끝나지 않으면 실패로 판정됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.adapter.runner.engine;
