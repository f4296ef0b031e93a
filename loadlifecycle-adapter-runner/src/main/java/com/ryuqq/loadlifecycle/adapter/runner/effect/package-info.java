/**
 * 비동기 효과 전달.
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.adapter.runner.effect;
