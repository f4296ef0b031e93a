/**
 * 카탈로그 가드 평가기.
 *
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.runner.guard.StandardGuards} - 카탈로그가 참조하는 모든 검사 등록</li>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.runner.guard.GeofenceGuardEvaluator} - 상차지/하차지 반경 검사</li>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.runner.guard.HoursOfServiceGuardEvaluator} - 운전 가능 시간 검사</li>
 *   <li>{@link com.ryuqq.loadlifecycle.adapter.runner.guard.ElapsedInStateGuardEvaluator} - 상태 체류 시간 검사</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.adapter.runner.guard;
