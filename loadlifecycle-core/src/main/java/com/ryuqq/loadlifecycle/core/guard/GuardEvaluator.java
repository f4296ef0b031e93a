package com.ryuqq.loadlifecycle.core.guard;

/**
 * 가드 평가기 SPI.
 *
 * <p>평가기는 원격 호출(HOS 조회, 승인 한도 조회 등)을 포함할 수 있으며,
 * 엔진은 평가 시간을 타임아웃으로 제한합니다. 제한 시간 내에 끝나지 않거나
 * 예외를 던진 평가는 실패로 간주됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface GuardEvaluator {

    /**
     * 가드 평가.
     *
     * @param context 평가 입력
     * @return 평가 결과
     */
    GuardVerdict evaluate(GuardContext context);
}
