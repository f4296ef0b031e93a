/**
 * Convoy 동기화 API와 Load 상태 변경 통지 포트.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.application.convoy;
