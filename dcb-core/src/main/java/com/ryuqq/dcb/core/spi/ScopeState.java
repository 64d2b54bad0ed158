package com.ryuqq.dcb.core.spi;

import com.ryuqq.dcb.core.scope.ScopeKey;

import java.time.Instant;
import java.util.List;

/**
 * Persisted scope state.
 *
 * <p>Timestamps are optional: stores that do not track them leave both {@code null}.</p>
 *
 * @param scopeKey the scope key
 * @param currentVersion the committed version (0 for a created but never committed scope)
 * @param tenantId tenant segment of the key
 * @param scopeType type segment of the key
 * @param scopeId id segment of the key
 * @param entityIds entity ids ever committed under this scope
 * @param createdAt when the scope row was first written, or null
 * @param lastUpdatedAt when the scope row was last written, or null
 * @author DCB Team
 * @since 1.0.0
 */
public record ScopeState(
    ScopeKey scopeKey,
    long currentVersion,
    String tenantId,
    String scopeType,
    String scopeId,
    List<String> entityIds,
    Instant createdAt,
    Instant lastUpdatedAt
) {

    public ScopeState {
        if (scopeKey == null) {
            throw new IllegalArgumentException("scopeKey cannot be null");
        }
        if (currentVersion < 0) {
            throw new IllegalArgumentException("currentVersion must be non-negative (current: " + currentVersion + ")");
        }
        if (createdAt != null && lastUpdatedAt != null && lastUpdatedAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("lastUpdatedAt cannot be before createdAt");
        }
        entityIds = entityIds == null ? List.of() : List.copyOf(entityIds);
    }

    /**
     * Creates an untimestamped state whose segments are taken from the key.
     *
     * @param scopeKey the scope key
     * @param currentVersion the version
     * @param entityIds tracked entity ids
     * @return the scope state
     */
    public static ScopeState of(ScopeKey scopeKey, long currentVersion, List<String> entityIds) {
        return of(scopeKey, currentVersion, entityIds, null, null);
    }

    /**
     * Creates a state whose segments are taken from the key.
     *
     * @param scopeKey the scope key
     * @param currentVersion the version
     * @param entityIds tracked entity ids
     * @param createdAt creation time, or null
     * @param lastUpdatedAt last write time, or null
     * @return the scope state
     */
    public static ScopeState of(
        ScopeKey scopeKey,
        long currentVersion,
        List<String> entityIds,
        Instant createdAt,
        Instant lastUpdatedAt
    ) {
        if (scopeKey == null) {
            throw new IllegalArgumentException("scopeKey cannot be null");
        }
        return new ScopeState(
            scopeKey,
            currentVersion,
            scopeKey.getTenantId(),
            scopeKey.getScopeType(),
            scopeKey.getScopeId(),
            entityIds,
            createdAt,
            lastUpdatedAt
        );
    }
}
