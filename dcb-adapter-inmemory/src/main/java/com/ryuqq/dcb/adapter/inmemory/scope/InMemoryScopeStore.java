package com.ryuqq.dcb.adapter.inmemory.scope;

import com.ryuqq.dcb.core.scope.ScopeKey;
import com.ryuqq.dcb.core.scope.ScopeKeys;
import com.ryuqq.dcb.core.spi.ScopeCommitResult;
import com.ryuqq.dcb.core.spi.ScopeOperations;
import com.ryuqq.dcb.core.spi.ScopeState;
import com.ryuqq.dcb.core.spi.ScopeVersionCheck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory implementation of {@link ScopeOperations} SPI for testing and reference purposes.
 *
 * <p>Each scope is a single {@link ConcurrentHashMap} entry. {@link #commitScope} performs its
 * compare-and-increment inside {@link ConcurrentHashMap#compute}, so commits on the same key are
 * serialized and at most one of two racing commits with the same expected version succeeds.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>scopes:</strong> ConcurrentHashMap&lt;ScopeKey, ScopeEntry&gt; - version and tracked entity ids (O(1) access)</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryScopeStore scopes = new InMemoryScopeStore();
 * ScopeKey key = ScopeKey.of("t1", "reservation", "res_1");
 *
 * scopes.commitScope(key, List.of("product_1"), 0);   // Committed(1)
 * scopes.commitScope(key, List.of("product_1"), 0);   // Conflict(1)
 * scopes.checkVersion(key, 1);                        // MATCH
 * scopes.listScopesByTenant("t1", "reservation", 10); // [key]
 * </pre>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public class InMemoryScopeStore implements ScopeOperations {

    private static final Logger log = LoggerFactory.getLogger(InMemoryScopeStore.class);

    /** Default page size of {@link #listScopesByTenant}. */
    public static final int DEFAULT_LIST_LIMIT = 100;

    /** Upper bound applied to any requested page size. */
    public static final int MAX_LIST_LIMIT = 1000;

    private final ConcurrentHashMap<ScopeKey, ScopeEntry> scopes = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Creates a store stamping rows with the UTC system clock.
     */
    public InMemoryScopeStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store stamping rows with the given clock.
     *
     * @param clock source of createdAt / lastUpdatedAt
     * @throws IllegalArgumentException if clock is null
     */
    public InMemoryScopeStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<ScopeState> getScope(ScopeKey scopeKey) {
        requireKey(scopeKey);
        ScopeEntry entry = scopes.get(scopeKey);
        return entry == null ? Optional.empty() : Optional.of(entry.toState(scopeKey));
    }

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Absent scope is treated as version 0</li>
     *   <li>Entity ids are merged in first-seen order</li>
     *   <li>A conflicting commit leaves the entry unchanged</li>
     * </ul>
     */
    @Override
    public ScopeCommitResult commitScope(ScopeKey scopeKey, List<String> entityIds, long expectedVersion) {
        requireKey(scopeKey);
        if (entityIds == null) {
            throw new IllegalArgumentException("entityIds cannot be null");
        }
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must be non-negative (current: " + expectedVersion + ")");
        }

        AtomicReference<ScopeCommitResult> result = new AtomicReference<>();
        scopes.compute(scopeKey, (key, existing) -> {
            long current = existing == null ? 0L : existing.version();
            if (current != expectedVersion) {
                result.set(ScopeCommitResult.conflict(current));
                return existing;
            }
            Instant now = clock.instant();
            ScopeEntry base = existing == null ? ScopeEntry.empty(now) : existing;
            ScopeEntry next = base.advance(entityIds, now);
            result.set(ScopeCommitResult.committed(next.version()));
            return next;
        });

        log.debug("Scope commit: scopeKey={}, expectedVersion={}, result={}",
            scopeKey.getValue(), expectedVersion, result.get());
        return result.get();
    }

    /**
     * Returns the scope, creating it at version 0 if absent.
     *
     * @param scopeKey the scope key
     * @return the (possibly new) scope state
     */
    public ScopeState getOrCreate(ScopeKey scopeKey) {
        requireKey(scopeKey);
        return scopes.computeIfAbsent(scopeKey, key -> ScopeEntry.empty(clock.instant())).toState(scopeKey);
    }

    /**
     * Lists a tenant's scopes with the default page size.
     *
     * @param tenantId the tenant id
     * @return up to {@link #DEFAULT_LIST_LIMIT} scopes, oldest first
     */
    public List<ScopeState> listScopesByTenant(String tenantId) {
        return listScopesByTenant(tenantId, null, DEFAULT_LIST_LIMIT);
    }

    /**
     * Lists a tenant's scopes, optionally narrowed to one scope type.
     *
     * <p>Results are ordered by createdAt, then by key. The limit is capped at
     * {@link #MAX_LIST_LIMIT}.</p>
     *
     * @param tenantId the tenant id
     * @param scopeType the scope type, or null for all types
     * @param limit maximum number of scopes to return
     * @return matching scopes, oldest first
     * @throws IllegalArgumentException if tenantId is blank or limit is not positive
     */
    public List<ScopeState> listScopesByTenant(String tenantId, String scopeType, int limit) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new IllegalArgumentException("tenantId cannot be null or blank");
        }
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        int effectiveLimit = Math.min(limit, MAX_LIST_LIMIT);

        List<ScopeState> matches = new ArrayList<>();
        scopes.forEach((key, entry) -> {
            if (ScopeKeys.isTenant(key.getValue(), tenantId)
                && (scopeType == null || scopeType.equals(key.getScopeType()))) {
                matches.add(entry.toState(key));
            }
        });
        matches.sort(Comparator.comparing(ScopeState::createdAt)
            .thenComparing(state -> state.scopeKey().getValue()));
        return List.copyOf(matches.subList(0, Math.min(effectiveLimit, matches.size())));
    }

    /**
     * Compares the stored version with an expected one without committing.
     *
     * @param scopeKey the scope key
     * @param expectedVersion the expected version
     * @return MATCH, MISMATCH with the stored version, or NOT_FOUND for an absent scope and a positive expected version
     */
    public ScopeVersionCheck checkVersion(ScopeKey scopeKey, long expectedVersion) {
        return ScopeVersionCheck.evaluate(getScope(scopeKey), expectedVersion);
    }

    public int size() {
        return scopes.size();
    }

    public void clear() {
        scopes.clear();
    }

    private static void requireKey(ScopeKey scopeKey) {
        if (scopeKey == null) {
            throw new IllegalArgumentException("scopeKey cannot be null");
        }
    }

    /**
     * Immutable stored row; replaced as a whole on each commit.
     */
    private record ScopeEntry(long version, List<String> entityIds, Instant createdAt, Instant lastUpdatedAt) {

        static ScopeEntry empty(Instant now) {
            return new ScopeEntry(0L, List.of(), now, now);
        }

        ScopeEntry advance(List<String> committedIds, Instant now) {
            Set<String> merged = new LinkedHashSet<>(entityIds);
            merged.addAll(committedIds);
            return new ScopeEntry(version + 1, List.copyOf(merged), createdAt, now);
        }

        ScopeState toState(ScopeKey scopeKey) {
            return ScopeState.of(scopeKey, version, entityIds, createdAt, lastUpdatedAt);
        }
    }
}
