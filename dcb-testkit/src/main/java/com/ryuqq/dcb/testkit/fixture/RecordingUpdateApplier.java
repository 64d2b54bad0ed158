package com.ryuqq.dcb.testkit.fixture;

import com.ryuqq.dcb.core.spi.EntityUpdate;
import com.ryuqq.dcb.core.spi.UpdateApplier;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * {@link UpdateApplier} test double that records every update in call order.
 *
 * <p>Optionally fails on a given entity id to exercise collaborator failure propagation.</p>
 *
 * @param <S> entity snapshot type
 * @param <U> update type
 * @author DCB Team
 * @since 1.0.0
 */
public class RecordingUpdateApplier<S, U> implements UpdateApplier<S, U> {

    private final List<EntityUpdate<S, U>> applied = Collections.synchronizedList(new ArrayList<>());
    private volatile String failOnEntityId;

    @Override
    public void apply(EntityUpdate<S, U> update) {
        if (update.entityId().equals(failOnEntityId)) {
            throw new IllegalStateException("Simulated apply failure for entity: " + update.entityId());
        }
        applied.add(update);
    }

    /**
     * Makes the next apply for the given entity throw {@link IllegalStateException}.
     *
     * @param entityId the entity id
     * @return this
     */
    public RecordingUpdateApplier<S, U> failOn(String entityId) {
        this.failOnEntityId = entityId;
        return this;
    }

    public List<EntityUpdate<S, U>> applied() {
        synchronized (applied) {
            return List.copyOf(applied);
        }
    }

    public List<String> appliedEntityIds() {
        List<String> ids = new ArrayList<>();
        for (EntityUpdate<S, U> update : applied()) {
            ids.add(update.entityId());
        }
        return ids;
    }

    public int count() {
        return applied.size();
    }

    public void clear() {
        applied.clear();
        failOnEntityId = null;
    }
}
