package com.ryuqq.dcb.core.decider;

import com.ryuqq.dcb.core.scope.ScopeKey;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * DCB Decider 입력 집계 상태.
 *
 * <p>Scope에 참여하는 모든 엔티티의 스냅샷을 담습니다. 로딩은 전부 아니면 전무이므로,
 * Decider는 일부만 채워진 상태를 관찰하지 않습니다.</p>
 *
 * @param <S> 엔티티 스냅샷 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class AggregatedState<S> {

    private final ScopeKey scopeKey;
    private final long scopeVersion;
    private final Map<String, S> entities;

    private AggregatedState(ScopeKey scopeKey, long scopeVersion, LinkedHashMap<String, S> entities) {
        this.scopeKey = scopeKey;
        this.scopeVersion = scopeVersion;
        this.entities = Collections.unmodifiableMap(entities);
    }

    /**
     * AggregatedState 생성.
     *
     * @param scopeKey Scope Key
     * @param scopeVersion 결정 기준 Scope 버전 (expectedVersion)
     * @param entities 엔티티 ID → 스냅샷 (순서 유지)
     * @param <S> 스냅샷 타입
     * @return AggregatedState 인스턴스
     * @throws IllegalArgumentException scopeKey 또는 entities가 null이거나 scopeVersion이 음수인 경우
     */
    public static <S> AggregatedState<S> of(ScopeKey scopeKey, long scopeVersion, Map<String, S> entities) {
        if (scopeKey == null) {
            throw new IllegalArgumentException("scopeKey cannot be null");
        }
        if (scopeVersion < 0) {
            throw new IllegalArgumentException("scopeVersion must be non-negative (current: " + scopeVersion + ")");
        }
        if (entities == null) {
            throw new IllegalArgumentException("entities cannot be null");
        }
        return new AggregatedState<>(scopeKey, scopeVersion, new LinkedHashMap<>(entities));
    }

    public ScopeKey scopeKey() {
        return scopeKey;
    }

    public long scopeVersion() {
        return scopeVersion;
    }

    public Map<String, S> entities() {
        return entities;
    }

    /**
     * 엔티티 스냅샷 조회.
     *
     * @param entityId 엔티티 ID
     * @return 스냅샷
     * @throws IllegalArgumentException 집계 상태에 없는 엔티티인 경우
     */
    public S get(String entityId) {
        S snapshot = entities.get(entityId);
        if (snapshot == null) {
            throw new IllegalArgumentException("Entity not in aggregated state: " + entityId);
        }
        return snapshot;
    }

    public boolean contains(String entityId) {
        return entities.containsKey(entityId);
    }

    public List<String> entityIds() {
        return List.copyOf(entities.keySet());
    }

    public int size() {
        return entities.size();
    }

    @Override
    public String toString() {
        return "AggregatedState{scopeKey=" + scopeKey.getValue()
            + ", scopeVersion=" + scopeVersion
            + ", entities=" + entities.keySet() + '}';
    }
}
