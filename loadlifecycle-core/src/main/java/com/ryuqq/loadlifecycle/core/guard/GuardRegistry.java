package com.ryuqq.loadlifecycle.core.guard;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * 가드 식별자 → 평가기 디스패치 테이블.
 *
 * <p>엔진은 기동 시점에 카탈로그의 모든 가드를 이 테이블로 해석합니다.
 * 호출 시점에는 문자열 분기를 하지 않습니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class GuardRegistry {

    private final Map<String, GuardEvaluator> evaluators = new HashMap<>();

    /**
     * 평가기 등록.
     *
     * @param check 가드 식별자
     * @param evaluator 평가기
     * @return this (체이닝용)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 이미 등록된 식별자인 경우
     */
    public GuardRegistry register(String check, GuardEvaluator evaluator) {
        if (check == null || check.isBlank()) {
            throw new IllegalArgumentException("check cannot be null or blank");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        if (evaluators.putIfAbsent(check, evaluator) != null) {
            throw new IllegalStateException("Guard evaluator already registered: " + check);
        }
        return this;
    }

    /**
     * 기존 평가기 교체 (테스트 또는 배포 환경별 재정의용).
     *
     * @param check 가드 식별자
     * @param evaluator 평가기
     * @return this (체이닝용)
     */
    public GuardRegistry override(String check, GuardEvaluator evaluator) {
        if (check == null || check.isBlank()) {
            throw new IllegalArgumentException("check cannot be null or blank");
        }
        if (evaluator == null) {
            throw new IllegalArgumentException("evaluator cannot be null");
        }
        evaluators.put(check, evaluator);
        return this;
    }

    /**
     * 평가기 해석.
     *
     * @param check 가드 식별자
     * @return 평가기
     * @throws IllegalStateException 등록되지 않은 식별자인 경우
     */
    public GuardEvaluator resolve(String check) {
        GuardEvaluator evaluator = evaluators.get(check);
        if (evaluator == null) {
            throw new IllegalStateException("No guard evaluator registered for check: " + check);
        }
        return evaluator;
    }

    public Set<String> registeredChecks() {
        return Collections.unmodifiableSet(evaluators.keySet());
    }
}
