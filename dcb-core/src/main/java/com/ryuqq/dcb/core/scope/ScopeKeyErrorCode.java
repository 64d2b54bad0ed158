package com.ryuqq.dcb.core.scope;

/**
 * Scope Key 검증 실패 코드.
 *
 * @author DCB Team
 * @since 1.0.0
 */
public enum ScopeKeyErrorCode {

    /**
     * null 또는 빈 문자열.
     */
    SCOPE_KEY_EMPTY,

    /**
     * {@code tenant:} 접두사 누락 또는 세그먼트 형식 오류.
     */
    INVALID_SCOPE_KEY_FORMAT
}
