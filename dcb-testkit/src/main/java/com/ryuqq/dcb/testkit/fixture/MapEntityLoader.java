package com.ryuqq.dcb.testkit.fixture;

import com.ryuqq.dcb.core.spi.EntityLoader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed {@link EntityLoader} test double that records requested ids in call order.
 *
 * <pre>
 * MapEntityLoader&lt;Stock&gt; loader = new MapEntityLoader&lt;Stock&gt;()
 *     .with("product_1", new Stock(10))
 *     .with("product_2", new Stock(5));
 * </pre>
 *
 * @param <S> entity snapshot type
 * @author DCB Team
 * @since 1.0.0
 */
public class MapEntityLoader<S> implements EntityLoader<S> {

    private final Map<String, S> entities = new ConcurrentHashMap<>();
    private final List<String> requested = Collections.synchronizedList(new ArrayList<>());

    public MapEntityLoader<S> with(String entityId, S snapshot) {
        entities.put(entityId, snapshot);
        return this;
    }

    @Override
    public Optional<S> load(String entityId) {
        requested.add(entityId);
        return Optional.ofNullable(entities.get(entityId));
    }

    /**
     * Ids passed to {@link #load(String)}, in call order.
     *
     * @return requested ids
     */
    public List<String> requestedIds() {
        synchronized (requested) {
            return List.copyOf(requested);
        }
    }
}
