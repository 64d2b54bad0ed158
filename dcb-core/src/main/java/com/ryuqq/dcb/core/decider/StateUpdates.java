package com.ryuqq.dcb.core.decider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 엔티티 ID별 상태 변경분.
 *
 * <p>Decider가 변경하기로 결정한 엔티티만 포함하며, 삽입 순서를 유지합니다.
 * 실행 엔진은 이 순서 그대로 변경분을 적용합니다.</p>
 *
 * @param <U> 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class StateUpdates<U> {

    private final Map<String, U> updates;

    private StateUpdates(LinkedHashMap<String, U> updates) {
        this.updates = Collections.unmodifiableMap(updates);
    }

    /**
     * 빈 변경분.
     *
     * @param <U> 변경분 타입
     * @return 빈 StateUpdates
     */
    public static <U> StateUpdates<U> empty() {
        return new StateUpdates<>(new LinkedHashMap<>());
    }

    /**
     * 단일 엔티티 변경분.
     *
     * @param entityId 엔티티 ID
     * @param update 변경분
     * @param <U> 변경분 타입
     * @return StateUpdates
     */
    public static <U> StateUpdates<U> of(String entityId, U update) {
        return StateUpdates.<U>builder().put(entityId, update).build();
    }

    public static <U> Builder<U> builder() {
        return new Builder<>();
    }

    /**
     * 삽입 순서를 유지하는 읽기 전용 맵.
     *
     * @return 엔티티 ID → 변경분
     */
    public Map<String, U> asMap() {
        return updates;
    }

    /**
     * 변경 대상 엔티티 ID 목록 (삽입 순서).
     *
     * @return 엔티티 ID 목록
     */
    public List<String> entityIds() {
        return List.copyOf(updates.keySet());
    }

    public U get(String entityId) {
        return updates.get(entityId);
    }

    public boolean contains(String entityId) {
        return updates.containsKey(entityId);
    }

    public int size() {
        return updates.size();
    }

    public boolean isEmpty() {
        return updates.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StateUpdates<?> that = (StateUpdates<?>) o;
        return updates.equals(that.updates);
    }

    @Override
    public int hashCode() {
        return updates.hashCode();
    }

    @Override
    public String toString() {
        return "StateUpdates{" + updates.keySet() + '}';
    }

    /**
     * StateUpdates 빌더.
     *
     * @param <U> 변경분 타입
     */
    public static final class Builder<U> {

        private final LinkedHashMap<String, U> updates = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * 변경분 추가.
         *
         * @param entityId 엔티티 ID
         * @param update 변경분
         * @return this
         * @throws IllegalArgumentException entityId가 비어 있거나 update가 null이거나 중복 ID인 경우
         */
        public Builder<U> put(String entityId, U update) {
            if (entityId == null || entityId.isBlank()) {
                throw new IllegalArgumentException("entityId cannot be null or blank");
            }
            if (update == null) {
                throw new IllegalArgumentException("update cannot be null");
            }
            if (updates.containsKey(entityId)) {
                throw new IllegalArgumentException("Duplicate entityId in state updates: " + entityId);
            }
            updates.put(entityId, update);
            return this;
        }

        public StateUpdates<U> build() {
            return new StateUpdates<>(new LinkedHashMap<>(updates));
        }
    }
}
