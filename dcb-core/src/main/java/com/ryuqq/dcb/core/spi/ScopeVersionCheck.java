package com.ryuqq.dcb.core.spi;

import java.util.Optional;

/**
 * Result of comparing a stored scope version with an expected one.
 *
 * @param status comparison status
 * @param currentVersion the stored version (0 when not found)
 * @author DCB Team
 * @since 1.0.0
 */
public record ScopeVersionCheck(Status status, long currentVersion) {

    /**
     * Comparison status.
     */
    public enum Status {
        MATCH,
        MISMATCH,
        NOT_FOUND
    }

    public ScopeVersionCheck {
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        if (currentVersion < 0) {
            throw new IllegalArgumentException("currentVersion must be non-negative (current: " + currentVersion + ")");
        }
    }

    /**
     * Compares a stored scope with an expected version.
     *
     * <p>An absent scope counts as version 0: it matches an expected version of 0
     * and is {@code NOT_FOUND} for any later version.</p>
     *
     * @param scope the stored scope, if any
     * @param expectedVersion the expected version
     * @return the check result
     * @throws IllegalArgumentException if scope is null
     */
    public static ScopeVersionCheck evaluate(Optional<ScopeState> scope, long expectedVersion) {
        if (scope == null) {
            throw new IllegalArgumentException("scope cannot be null");
        }
        if (scope.isEmpty()) {
            return expectedVersion == 0
                ? new ScopeVersionCheck(Status.MATCH, 0L)
                : new ScopeVersionCheck(Status.NOT_FOUND, 0L);
        }
        long current = scope.get().currentVersion();
        return current == expectedVersion
            ? new ScopeVersionCheck(Status.MATCH, current)
            : new ScopeVersionCheck(Status.MISMATCH, current);
    }

    public boolean matches() {
        return status == Status.MATCH;
    }
}
