/**
 * Service Provider Interfaces for the DCB execution engine.
 *
 * <p>The engine owns orchestration only. Persistence of entity snapshots, entity updates and
 * scope versions is delegated to the host through these interfaces:</p>
 *
 * <ul>
 *   <li>{@link com.ryuqq.dcb.core.spi.EntityLoader} - snapshot lookup by id</li>
 *   <li>{@link com.ryuqq.dcb.core.spi.UpdateApplier} - per-entity update write</li>
 *   <li>{@link com.ryuqq.dcb.core.spi.ScopeOperations} - scope version read and atomic commit</li>
 * </ul>
 *
 * <p>Reference in-memory implementations live in the {@code dcb-adapter-inmemory} module; the
 * {@code dcb-testkit} module provides a contract test base for custom scope stores.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.spi;
