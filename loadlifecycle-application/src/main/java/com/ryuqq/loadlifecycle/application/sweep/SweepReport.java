package com.ryuqq.loadlifecycle.application.sweep;

/**
 * 스윕 1회 결과.
 *
 * @param scanned 조회한 후보 수
 * @param applied 처리 완료 수 (커밋 또는 에스컬레이션)
 * @param skipped 조건 불충족으로 건너뛴 수 (다음 스윕에서 재시도)
 * @param failed 예외로 실패한 수
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SweepReport(int scanned, int applied, int skipped, int failed) {

    public static final SweepReport EMPTY = new SweepReport(0, 0, 0, 0);

    public SweepReport plus(SweepReport other) {
        return new SweepReport(
            scanned + other.scanned,
            applied + other.applied,
            skipped + other.skipped,
            failed + other.failed
        );
    }
}
