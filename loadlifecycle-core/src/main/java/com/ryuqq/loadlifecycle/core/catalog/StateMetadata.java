package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.model.ActorRole;
import com.ryuqq.loadlifecycle.core.model.LoadDocument;
import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import com.ryuqq.loadlifecycle.core.statemachine.StateCategory;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * 상태별 메타데이터.
 *
 * <p><strong>불변식:</strong> {@code isFinal}인 상태에서 출발하는 전이 정의는
 * 카탈로그에 존재하지 않아야 합니다 ({@link TransitionCatalog#closureViolations()}).</p>
 *
 * @param state 상태
 * @param category 분류
 * @param displayName 표시 이름
 * @param description 설명
 * @param primaryActors 주 행위자 역할
 * @param allowedActors 상태를 조회/조작할 수 있는 역할
 * @param gpsRequired GPS 위치 보고 필수 여부
 * @param documentsRequired 필수 문서
 * @param financialImpact 재무 영향 설명 (없으면 null)
 * @param autoTransition 자동 전이 (없으면 null)
 * @param isFinal 종료 상태 여부
 * @param isException 예외 상태 여부
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record StateMetadata(
    LoadState state,
    StateCategory category,
    String displayName,
    String description,
    Set<ActorRole> primaryActors,
    Set<ActorRole> allowedActors,
    boolean gpsRequired,
    List<LoadDocument> documentsRequired,
    String financialImpact,
    AutoTransition autoTransition,
    boolean isFinal,
    boolean isException
) {

    public StateMetadata {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (displayName == null || displayName.isBlank()) {
            throw new IllegalArgumentException("displayName cannot be null or blank");
        }
        primaryActors = Set.copyOf(primaryActors);
        allowedActors = Set.copyOf(allowedActors);
        documentsRequired = List.copyOf(documentsRequired);
        if (autoTransition != null && isFinal) {
            throw new IllegalArgumentException("final state " + state + " cannot declare an auto transition");
        }
    }

    /**
     * 자동 전이 조회.
     *
     * @return 자동 전이 (선언되지 않았으면 empty)
     */
    public Optional<AutoTransition> findAutoTransition() {
        return Optional.ofNullable(autoTransition);
    }
}
