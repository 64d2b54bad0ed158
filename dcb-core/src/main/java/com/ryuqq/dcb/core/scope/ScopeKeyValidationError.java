package com.ryuqq.dcb.core.scope;

/**
 * Scope Key 검증 오류.
 *
 * @param code 오류 코드
 * @param message 오류 메시지
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record ScopeKeyValidationError(
    ScopeKeyErrorCode code,
    String message
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null인 경우
     */
    public ScopeKeyValidationError {
        if (code == null) {
            throw new IllegalArgumentException("code cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    /**
     * "CODE: message" 형식의 문자열.
     *
     * @return 포맷된 오류 설명
     */
    public String describe() {
        return code.name() + ": " + message;
    }
}
