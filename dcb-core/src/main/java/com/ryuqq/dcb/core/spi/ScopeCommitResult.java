package com.ryuqq.dcb.core.spi;

/**
 * Outcome of {@link ScopeOperations#commitScope}.
 *
 * @author DCB Team
 * @since 1.0.0
 */
public sealed interface ScopeCommitResult permits ScopeCommitResult.Committed, ScopeCommitResult.Conflict {

    static ScopeCommitResult committed(long newVersion) {
        return new Committed(newVersion);
    }

    static ScopeCommitResult conflict(long currentVersion) {
        return new Conflict(currentVersion);
    }

    default boolean isCommitted() {
        return this instanceof Committed;
    }

    /**
     * Version was incremented.
     *
     * @param newVersion the committed version
     */
    record Committed(long newVersion) implements ScopeCommitResult {
        public Committed {
            if (newVersion < 1) {
                throw new IllegalArgumentException("newVersion must be positive (current: " + newVersion + ")");
            }
        }
    }

    /**
     * Stored version differed from the expected one.
     *
     * @param currentVersion the actual stored version
     */
    record Conflict(long currentVersion) implements ScopeCommitResult {
        public Conflict {
            if (currentVersion < 0) {
                throw new IllegalArgumentException("currentVersion must be non-negative (current: " + currentVersion + ")");
            }
        }
    }
}
