package com.ryuqq.dcb.core.spi;

import java.time.Instant;

/**
 * A single entity update handed to {@link UpdateApplier}.
 *
 * @param entityId the entity id
 * @param snapshot the snapshot the decider observed
 * @param update the partial update decided for this entity
 * @param scopeVersion the scope version this update belongs to (expected version + 1)
 * @param appliedAt decision time
 * @param <S> entity snapshot type
 * @param <U> update type
 * @author DCB Team
 * @since 1.0.0
 */
public record EntityUpdate<S, U>(
    String entityId,
    S snapshot,
    U update,
    long scopeVersion,
    Instant appliedAt
) {

    public EntityUpdate {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        if (scopeVersion < 1) {
            throw new IllegalArgumentException("scopeVersion must be positive (current: " + scopeVersion + ")");
        }
        if (appliedAt == null) {
            throw new IllegalArgumentException("appliedAt cannot be null");
        }
    }
}
