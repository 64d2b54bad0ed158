/**
 * Scope key codec package.
 *
 * <p>Scope keys identify the ad-hoc consistency boundary protected by optimistic
 * concurrency control. Format: {@code tenant:{tenantId}:{scopeType}:{scopeId}}.</p>
 *
 * <h2>Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.dcb.core.scope.ScopeKeys} - create, parse, validate, extract</li>
 *   <li>{@link com.ryuqq.dcb.core.scope.ScopeKey} - validated value object</li>
 *   <li>{@link com.ryuqq.dcb.core.scope.ParsedScopeKey} - parsed components</li>
 *   <li>{@link com.ryuqq.dcb.core.scope.ScopeKeyValidationError} - structured validation error</li>
 * </ul>
 *
 * <h2>Parsing Rule</h2>
 * <p>{@code scopeId} is everything after the third colon, so composite identifiers such as
 * {@code ord:2024:001} round-trip unchanged.</p>
 *
 * @since 1.0.0
 * @author DCB Team
 */
package com.ryuqq.dcb.core.scope;
