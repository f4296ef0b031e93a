package com.ryuqq.loadlifecycle.adapter.runner.sweep;

/**
 * Sweeper 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>scanIntervalMs: 스캔 주기 (기본 60000ms = 1분)</li>
 *   <li>batchSize: 상태 하나당 한 번에 처리할 항목 수 (기본 100)</li>
 * </ul>
 *
 * <p>자동 전이 타임아웃은 시간 단위(1h~72h)이므로 1분 주기로 충분합니다.
 * 배치를 다 채운 상태는 다음 스캔에서 이어서 처리됩니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 * @param scanIntervalMs 스캔 주기 (밀리초, 양수여야 함)
 * @param batchSize 배치 크기 (1 이상이어야 함)
 */
public record SweeperConfig(
    long scanIntervalMs,
    int batchSize
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: scanIntervalMs=60000ms (1분), batchSize=100</p>
     */
    public SweeperConfig() {
        this(60000, 100);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public SweeperConfig {
        if (scanIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "scanIntervalMs must be positive (current: " + scanIntervalMs + ")"
            );
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException(
                "batchSize must be positive (current: " + batchSize + ")"
            );
        }
    }

    /**
     * scanIntervalMs만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withScanIntervalMs(long scanIntervalMs) {
        return new SweeperConfig(scanIntervalMs, batchSize);
    }

    /**
     * batchSize만 변경한 새 인스턴스 생성.
     */
    public SweeperConfig withBatchSize(int batchSize) {
        return new SweeperConfig(scanIntervalMs, batchSize);
    }
}
