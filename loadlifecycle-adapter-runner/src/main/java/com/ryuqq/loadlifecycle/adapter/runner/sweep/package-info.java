/**
 * 자동 전이 Sweeper와 주기 실행기.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.adapter.runner.sweep;
