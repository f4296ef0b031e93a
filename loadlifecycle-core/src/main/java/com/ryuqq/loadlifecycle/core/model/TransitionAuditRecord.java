package com.ryuqq.loadlifecycle.core.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 전이 감사 기록 (append-only).
 *
 * <p>시도된 전이마다 성공/실패와 관계없이 한 건 생성되며, 기록 후 변경되지 않습니다.
 * Convoy 동기화 기록도 같은 형식을 사용하며, 이 경우 {@code entityId}는 Convoy ID입니다.</p>
 *
 * <p><strong>영속 레이아웃:</strong></p>
 * <pre>
 * {entityId, fromState, toState, transitionId, triggerType, triggerEvent,
 *  actorId, actorRole, guardsPassed[], effectsExecuted[], metadata(json),
 *  success, errorMessage, timestamp}
 * </pre>
 *
 * @param entityId Load 또는 Convoy ID
 * @param fromState 전이 전 상태
 * @param toState 전이 후 상태 (알 수 없는 전이 요청이면 null)
 * @param transitionId 요청된 전이 ID
 * @param triggerType 트리거 유형 이름
 * @param triggerEvent 트리거 이벤트 이름
 * @param actorId 행위자 ID
 * @param actorRole 행위자 역할
 * @param guardsPassed 통과한 가드 식별자 (평가 순서)
 * @param effectsExecuted 전달된 효과 ("kind:action")
 * @param metadata 부가 정보
 * @param success 성공 여부
 * @param errorMessage 실패 메시지 (성공이면 null)
 * @param timestamp 기록 시각
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record TransitionAuditRecord(
    String entityId,
    String fromState,
    String toState,
    String transitionId,
    String triggerType,
    String triggerEvent,
    String actorId,
    ActorRole actorRole,
    List<String> guardsPassed,
    List<String> effectsExecuted,
    Map<String, Object> metadata,
    boolean success,
    String errorMessage,
    Instant timestamp
) {

    public TransitionAuditRecord {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (fromState == null) {
            throw new IllegalArgumentException("fromState cannot be null");
        }
        if (transitionId == null) {
            throw new IllegalArgumentException("transitionId cannot be null");
        }
        if (actorRole == null) {
            throw new IllegalArgumentException("actorRole cannot be null");
        }
        if (timestamp == null) {
            throw new IllegalArgumentException("timestamp cannot be null");
        }
        guardsPassed = guardsPassed == null ? List.of() : List.copyOf(guardsPassed);
        effectsExecuted = effectsExecuted == null ? List.of() : List.copyOf(effectsExecuted);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        if (!success && (errorMessage == null || errorMessage.isBlank())) {
            throw new IllegalArgumentException("errorMessage is required for a failed record");
        }
    }
}
