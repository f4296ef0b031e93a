package com.ryuqq.loadlifecycle.application.convoy;

import com.ryuqq.loadlifecycle.core.statemachine.EscortState;

import java.util.List;

/**
 * 동기화 지점 실행 결과.
 *
 * <p>상태 커밋이 성공했으면 알림 실패가 있더라도 {@code success}는 true입니다.
 * 알림과 상태 커밋은 서로 독립된 실패 영역입니다.</p>
 *
 * @param syncPointId 실행한 지점 ID
 * @param success 호송 상태 커밋 성공 여부
 * @param status 실행 후 호송 상태 (실패 시 변경 전 상태, Convoy가 없으면 null)
 * @param effects 실행 기록 ("escort_state:..." 및 효과 키)
 * @param failedNotifications 전달하지 못한 알림 수
 * @param errorMessage 커밋 실패 사유 (성공이면 null)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record SyncResult(
    String syncPointId,
    boolean success,
    EscortState status,
    List<String> effects,
    int failedNotifications,
    String errorMessage
) {

    public SyncResult {
        effects = effects == null ? List.of() : List.copyOf(effects);
    }

    public static SyncResult failed(String syncPointId, EscortState status, String errorMessage) {
        return new SyncResult(syncPointId, false, status, List.of(), 0, errorMessage);
    }
}
