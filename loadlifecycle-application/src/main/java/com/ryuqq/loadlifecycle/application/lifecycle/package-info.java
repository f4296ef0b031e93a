/**
 * Load Lifecycle Application Layer - 전이 요청 API.
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.loadlifecycle.application.lifecycle.LoadLifecycle} - 전이 시도, 조회, 사전 검증</li>
 *   <li>{@link com.ryuqq.loadlifecycle.application.lifecycle.AvailableTransition} - 전이 후보</li>
 *   <li>{@link com.ryuqq.loadlifecycle.application.lifecycle.TransitionValidation} - 사전 검증 결과</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-runner 모듈에 위치</li>
 * </ul>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
package com.ryuqq.loadlifecycle.application.lifecycle;
