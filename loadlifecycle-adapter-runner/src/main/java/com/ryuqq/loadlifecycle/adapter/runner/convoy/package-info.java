/**
 * Convoy 동기화.
 *
 * <p>{@link com.ryuqq.loadlifecycle.adapter.runner.convoy.ConvoySyncService}는 Load 상태 변경을 받아
 * 동기화 지점을 실행하고, {@link com.ryuqq.loadlifecycle.adapter.runner.convoy.ConvoySyncTimeoutSweeper}는
 * 대기 시간이 초과된 지점을 에스컬레이션합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.adapter.runner.convoy;
