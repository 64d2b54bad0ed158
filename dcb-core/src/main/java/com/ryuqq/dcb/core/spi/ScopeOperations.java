package com.ryuqq.dcb.core.spi;

import com.ryuqq.dcb.core.scope.ScopeKey;

import java.util.List;
import java.util.Optional;

/**
 * Scope version store SPI for optimistic concurrency control.
 *
 * <p>A scope is an ad-hoc consistency boundary over several entities. Its version counter is the
 * only synchronization point between concurrent executions on the same scope.</p>
 *
 * <p><strong>Two-phase OCC:</strong></p>
 * <pre>
 * 1. getScope(key)                          → pre-check against expectedVersion
 * 2. ... load, decide, apply ...
 * 3. commitScope(key, ids, expectedVersion) → compare-and-increment
 * </pre>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomicity: commitScope must compare and increment in one atomic step per key</li>
 *   <li>Creation: committing with expectedVersion 0 on an absent scope creates it at version 1</li>
 *   <li>Monotonicity: versions only increase, by exactly 1 per successful commit</li>
 *   <li>Thread-safe: all methods may be called concurrently</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public interface ScopeOperations {

    /**
     * Reads the current scope state.
     *
     * @param scopeKey the scope key
     * @return the scope state, or empty if the scope has never been committed
     */
    Optional<ScopeState> getScope(ScopeKey scopeKey);

    /**
     * Atomically commits a new scope version.
     *
     * <p>Succeeds only if the stored version equals {@code expectedVersion} (an absent scope counts
     * as version 0). The committed entity ids are merged into the scope's tracked ids.</p>
     *
     * @param scopeKey the scope key
     * @param entityIds the entity ids updated by this execution
     * @param expectedVersion the version the execution decided against
     * @return {@link ScopeCommitResult.Committed} with the new version, or
     *         {@link ScopeCommitResult.Conflict} with the actual version
     */
    ScopeCommitResult commitScope(ScopeKey scopeKey, List<String> entityIds, long expectedVersion);
}
