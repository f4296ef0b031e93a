package com.ryuqq.loadlifecycle.core.catalog;

import com.ryuqq.loadlifecycle.core.statemachine.LoadState;
import com.ryuqq.loadlifecycle.core.statemachine.StateCategory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 상태 및 전이 카탈로그.
 *
 * <p>정적 선언을 기동 시점에 한 번 인덱싱하며, 이후 변경되지 않습니다.</p>
 *
 * <p><strong>인덱스 구조:</strong></p>
 * <ul>
 *   <li>arena: 전이 정의 배열 (선언 순서)</li>
 *   <li>bySource: 출발 상태 → arena 인덱스 배열 (priority 오름차순, 동순위는 선언 순서)</li>
 *   <li>byId: 전이 ID → 전이 정의</li>
 *   <li>metadata: 상태 → 상태 메타데이터</li>
 * </ul>
 *
 * <p><strong>기동 시 검증:</strong></p>
 * <ul>
 *   <li>모든 {@link LoadState}에 메타데이터가 존재</li>
 *   <li>전이 ID 중복 없음</li>
 *   <li>자동 전이가 참조하는 전이가 존재하고, 해당 상태에서 출발하며, 목표 상태로 도착</li>
 * </ul>
 *
 * <p>검증에 실패하면 {@link IllegalStateException}이 발생합니다.</p>
 *
 * @author LoadLifecycle Team
 * @since 1.0.0
 */
public final class TransitionCatalog {

    private static final int[] NO_TRANSITIONS = new int[0];

    private final TransitionDefinition[] arena;
    private final EnumMap<LoadState, int[]> bySource;
    private final Map<String, TransitionDefinition> byId;
    private final EnumMap<LoadState, StateMetadata> metadata;
    private final List<LoadState> displayOrder;

    /**
     * 카탈로그 생성.
     *
     * @param states 상태 메타데이터 (표시 순서)
     * @param transitions 전이 정의 (선언 순서)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws IllegalStateException 카탈로그 구성이 일관되지 않은 경우
     */
    public TransitionCatalog(List<StateMetadata> states, List<TransitionDefinition> transitions) {
        if (states == null) {
            throw new IllegalArgumentException("states cannot be null");
        }
        if (transitions == null) {
            throw new IllegalArgumentException("transitions cannot be null");
        }

        this.metadata = new EnumMap<>(LoadState.class);
        List<LoadState> order = new ArrayList<>();
        for (StateMetadata meta : states) {
            if (metadata.put(meta.state(), meta) != null) {
                throw new IllegalStateException("Duplicate state metadata: " + meta.state());
            }
            order.add(meta.state());
        }
        for (LoadState state : LoadState.values()) {
            if (!metadata.containsKey(state)) {
                throw new IllegalStateException("Missing state metadata: " + state);
            }
        }
        this.displayOrder = List.copyOf(order);

        this.arena = transitions.toArray(new TransitionDefinition[0]);
        this.byId = new HashMap<>();
        for (TransitionDefinition definition : arena) {
            if (byId.put(definition.id(), definition) != null) {
                throw new IllegalStateException("Duplicate transition id: " + definition.id());
            }
        }

        this.bySource = new EnumMap<>(LoadState.class);
        for (LoadState state : LoadState.values()) {
            List<Integer> indices = new ArrayList<>();
            for (int i = 0; i < arena.length; i++) {
                if (arena[i].originatesFrom(state)) {
                    indices.add(i);
                }
            }
            // 안정 정렬: 동순위는 선언 순서 유지
            indices.sort(Comparator.comparingInt(i -> arena[i].priority()));
            bySource.put(state, indices.stream().mapToInt(Integer::intValue).toArray());
        }

        verifyAutoTransitions();
    }

    /**
     * 정적 선언으로 구성한 표준 카탈로그.
     *
     * @return 표준 카탈로그
     */
    public static TransitionCatalog standard() {
        return new TransitionCatalog(LoadLifecycleDefinitions.states(), LoadLifecycleDefinitions.transitions());
    }

    /**
     * 주어진 상태에서 출발하는 전이 목록 (priority 오름차순).
     *
     * @param state 출발 상태
     * @return 전이 정의 목록 (없으면 빈 목록)
     */
    public List<TransitionDefinition> transitionsFrom(LoadState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        int[] indices = bySource.getOrDefault(state, NO_TRANSITIONS);
        List<TransitionDefinition> result = new ArrayList<>(indices.length);
        for (int index : indices) {
            result.add(arena[index]);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 전이 ID로 조회.
     *
     * @param transitionId 전이 ID
     * @return 전이 정의 (없으면 empty)
     */
    public Optional<TransitionDefinition> transitionById(String transitionId) {
        return Optional.ofNullable(byId.get(transitionId));
    }

    /**
     * from → to 전이가 카탈로그에 존재하는지 확인.
     *
     * @param from 출발 상태
     * @param to 도착 상태
     * @return from에서 출발하여 to로 도착하는 전이 정의가 하나라도 있으면 true
     */
    public boolean isValidTransition(LoadState from, LoadState to) {
        if (from == null || to == null) {
            return false;
        }
        for (int index : bySource.getOrDefault(from, NO_TRANSITIONS)) {
            if (arena[index].to() == to) {
                return true;
            }
        }
        return false;
    }

    public boolean isFinal(LoadState state) {
        return metadata(state).isFinal();
    }

    public boolean isException(LoadState state) {
        return metadata(state).isException();
    }

    public StateCategory category(LoadState state) {
        return metadata(state).category();
    }

    /**
     * 상태 메타데이터 조회.
     *
     * @param state 상태
     * @return 메타데이터
     * @throws IllegalArgumentException state가 null인 경우
     */
    public StateMetadata metadata(LoadState state) {
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        return metadata.get(state);
    }

    /**
     * 분류에 속한 상태 목록 (표시 순서).
     *
     * @param category 분류
     * @return 상태 목록
     */
    public List<LoadState> statesIn(StateCategory category) {
        List<LoadState> result = new ArrayList<>();
        for (LoadState state : displayOrder) {
            if (metadata.get(state).category() == category) {
                result.add(state);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 상태 표시 순서.
     *
     * @return 선언된 메타데이터 순서
     */
    public List<LoadState> displayOrder() {
        return displayOrder;
    }

    /**
     * 자동 전이가 선언된 상태의 메타데이터.
     *
     * @return 자동 전이 보유 상태 메타데이터 목록
     */
    public List<StateMetadata> statesWithAutoTransition() {
        List<StateMetadata> result = new ArrayList<>();
        for (LoadState state : displayOrder) {
            StateMetadata meta = metadata.get(state);
            if (meta.autoTransition() != null) {
                result.add(meta);
            }
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * 모든 전이 정의 (선언 순서).
     *
     * @return 전이 정의 목록
     */
    public List<TransitionDefinition> allTransitions() {
        return List.of(arena);
    }

    /**
     * 종료 상태에서 출발하는 전이 목록.
     *
     * <p>정상 카탈로그에서는 항상 비어 있어야 합니다.</p>
     *
     * @return 폐쇄성 위반 "전이ID: 종료상태" 목록
     */
    public List<String> closureViolations() {
        List<String> violations = new ArrayList<>();
        for (TransitionDefinition definition : arena) {
            for (LoadState source : definition.from()) {
                if (metadata.get(source).isFinal()) {
                    violations.add(definition.id() + ": " + source);
                }
            }
        }
        return violations;
    }

    private void verifyAutoTransitions() {
        for (StateMetadata meta : metadata.values()) {
            AutoTransition auto = meta.autoTransition();
            if (auto == null) {
                continue;
            }
            TransitionDefinition definition = byId.get(auto.transitionId());
            if (definition == null) {
                throw new IllegalStateException(
                    "Auto transition of " + meta.state() + " references unknown transition: " + auto.transitionId()
                );
            }
            if (!definition.originatesFrom(meta.state()) || definition.to() != auto.target()) {
                throw new IllegalStateException(
                    String.format("Auto transition %s does not connect %s → %s (declared from: %s, to: %s)",
                        auto.transitionId(), meta.state(), auto.target(),
                        Arrays.toString(definition.from().toArray()), definition.to())
                );
            }
        }
    }
}
