package com.ryuqq.dcb.adapter.inmemory.entity;

import com.ryuqq.dcb.core.spi.EntityLoader;
import com.ryuqq.dcb.core.spi.EntityUpdate;
import com.ryuqq.dcb.core.spi.UpdateApplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BiFunction;

/**
 * In-memory entity repository implementing both {@link EntityLoader} and {@link UpdateApplier}.
 *
 * <p>Updates are folded into the stored snapshot with a caller-supplied merge function; the scope
 * version of the last applied update is recorded per entity.</p>
 *
 * <pre>
 * InMemoryEntityStore&lt;Stock, StockChange&gt; stocks =
 *     new InMemoryEntityStore&lt;&gt;((stock, change) -&gt; stock.apply(change));
 * stocks.put("product_1", new Stock(10, 0));
 * </pre>
 *
 * @param <S> entity snapshot type
 * @param <U> update type
 * @author DCB Team
 * @since 1.0.0
 */
public class InMemoryEntityStore<S, U> implements EntityLoader<S>, UpdateApplier<S, U> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEntityStore.class);

    private final ConcurrentHashMap<String, S> entities = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Long> versions = new ConcurrentHashMap<>();
    private final BiFunction<S, U, S> merger;

    /**
     * Creates an empty store.
     *
     * @param merger (current snapshot, update) to new snapshot
     * @throws IllegalArgumentException if merger is null
     */
    public InMemoryEntityStore(BiFunction<S, U, S> merger) {
        if (merger == null) {
            throw new IllegalArgumentException("merger cannot be null");
        }
        this.merger = merger;
    }

    /**
     * Seeds or replaces an entity snapshot.
     *
     * @param entityId the entity id
     * @param snapshot the snapshot
     */
    public void put(String entityId, S snapshot) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (snapshot == null) {
            throw new IllegalArgumentException("snapshot cannot be null");
        }
        entities.put(entityId, snapshot);
    }

    @Override
    public Optional<S> load(String entityId) {
        if (entityId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(entities.get(entityId));
    }

    /**
     * {@inheritDoc}
     *
     * @throws IllegalStateException if the entity was removed after it was loaded
     */
    @Override
    public void apply(EntityUpdate<S, U> update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        entities.compute(update.entityId(), (id, current) -> {
            if (current == null) {
                throw new IllegalStateException("Cannot apply update to missing entity: " + id);
            }
            S next = merger.apply(current, update.update());
            if (next == null) {
                throw new IllegalStateException("merger returned null for entity: " + id);
            }
            return next;
        });
        versions.put(update.entityId(), update.scopeVersion());
        log.debug("Entity updated: entityId={}, scopeVersion={}", update.entityId(), update.scopeVersion());
    }

    /**
     * Scope version of the last update applied to an entity.
     *
     * @param entityId the entity id
     * @return the version, or 0 if never updated
     */
    public long versionOf(String entityId) {
        return versions.getOrDefault(entityId, 0L);
    }

    public int size() {
        return entities.size();
    }

    public void clear() {
        entities.clear();
        versions.clear();
    }
}
