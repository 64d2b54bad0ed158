package com.ryuqq.dcb.core.scope;

/**
 * 파싱된 Scope Key 구성 요소.
 *
 * @param tenantId 테넌트 ID (콜론 불가)
 * @param scopeType Scope 유형 (콜론 불가, 예: reservation)
 * @param scopeId Scope 내 고유 ID (콜론 허용)
 * @param raw 원본 Scope Key 문자열
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record ParsedScopeKey(
    String tenantId,
    String scopeType,
    String scopeId,
    String raw
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public ParsedScopeKey {
        if (tenantId == null || tenantId.isEmpty()) {
            throw new IllegalArgumentException("tenantId cannot be null or empty");
        }
        if (scopeType == null || scopeType.isEmpty()) {
            throw new IllegalArgumentException("scopeType cannot be null or empty");
        }
        if (scopeId == null || scopeId.isEmpty()) {
            throw new IllegalArgumentException("scopeId cannot be null or empty");
        }
        if (raw == null) {
            throw new IllegalArgumentException("raw cannot be null");
        }
    }
}
