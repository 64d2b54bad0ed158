/**
 * In-memory scope store adapter.
 *
 * <p>{@link com.ryuqq.dcb.adapter.inmemory.scope.InMemoryScopeStore} is the reference
 * {@link com.ryuqq.dcb.core.spi.ScopeOperations} implementation. It passes the contract tests
 * in {@code dcb-testkit} and adds the store-side helpers {@code getOrCreate} and
 * {@code checkVersion}.</p>
 *
 * @see com.ryuqq.dcb.core.spi.ScopeOperations
 * @author DCB Team
 * @since 1.0.0
 */
package com.ryuqq.dcb.adapter.inmemory.scope;
