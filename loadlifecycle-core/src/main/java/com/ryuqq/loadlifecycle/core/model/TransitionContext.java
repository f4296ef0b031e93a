package com.ryuqq.loadlifecycle.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 전이 요청과 함께 전달되는 컨텍스트.
 *
 * <p>가드는 저장된 Load와 이 컨텍스트를 함께 읽습니다. 전이가 커밋되면
 * {@code documents}와 {@code assignments}는 Load 스냅샷에 반영되고,
 * {@code metadata}는 감사 기록에 남습니다.</p>
 *
 * @param location 요청 시점 행위자 GPS 좌표 (없으면 null)
 * @param documents 이번 요청으로 제출된 문서
 * @param assignments 이번 요청으로 지정된 참여자 (예: CATALYST, DRIVER)
 * @param data 가드 입력값 (예: bidId, weight, sealNumbers, paymentAmount)
 * @param metadata 감사 기록용 부가 정보 (예: reason)
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public record TransitionContext(
    GeoPoint location,
    Set<LoadDocument> documents,
    Map<ActorRole, String> assignments,
    Map<String, Object> data,
    Map<String, Object> metadata
) {

    private static final TransitionContext EMPTY =
        new TransitionContext(null, Set.of(), Map.of(), Map.of(), Map.of());

    public TransitionContext {
        documents = documents == null || documents.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(documents));
        assignments = assignments == null || assignments.isEmpty()
            ? Map.of()
            : Collections.unmodifiableMap(new EnumMap<>(assignments));
        data = data == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(data));
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new HashMap<>(metadata));
    }

    /**
     * 빈 컨텍스트 (스케줄러 등 시스템 요청용).
     *
     * @return 빈 TransitionContext
     */
    public static TransitionContext empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * 데이터 값 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<Object> dataValue(String key) {
        return Optional.ofNullable(data.get(key));
    }

    /**
     * TransitionContext 빌더.
     */
    public static final class Builder {

        private GeoPoint location;
        private final EnumSet<LoadDocument> documents = EnumSet.noneOf(LoadDocument.class);
        private final Map<ActorRole, String> assignments = new EnumMap<>(ActorRole.class);
        private final Map<String, Object> data = new HashMap<>();
        private final Map<String, Object> metadata = new HashMap<>();

        private Builder() {
        }

        public Builder location(GeoPoint location) {
            this.location = location;
            return this;
        }

        public Builder document(LoadDocument document) {
            documents.add(document);
            return this;
        }

        public Builder assign(ActorRole role, String userId) {
            assignments.put(role, userId);
            return this;
        }

        public Builder data(String key, Object value) {
            data.put(key, value);
            return this;
        }

        public Builder metadata(String key, Object value) {
            metadata.put(key, value);
            return this;
        }

        public TransitionContext build() {
            return new TransitionContext(location, documents, assignments, data, metadata);
        }
    }
}
