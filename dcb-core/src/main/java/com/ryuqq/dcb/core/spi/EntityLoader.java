package com.ryuqq.dcb.core.spi;

import java.util.Optional;

/**
 * Entity snapshot loading SPI.
 *
 * <p>The execution engine calls {@link #load(String)} once per requested entity id, sequentially
 * and in request order. An empty result marks the entity as missing; if any entity is missing the
 * whole execution is rejected before the decider runs.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Return {@link Optional#empty()} for an unknown id, never {@code null}</li>
 *   <li>Infrastructure failures should be thrown; the engine propagates them unchanged</li>
 * </ul>
 *
 * @param <S> entity snapshot type
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EntityLoader<S> {

    /**
     * Loads the current snapshot of an entity.
     *
     * @param entityId the entity id
     * @return the snapshot, or empty if the entity does not exist
     */
    Optional<S> load(String entityId);
}
