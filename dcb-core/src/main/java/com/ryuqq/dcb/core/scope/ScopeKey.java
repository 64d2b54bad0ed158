package com.ryuqq.dcb.core.scope;

/**
 * 검증된 Scope Key.
 *
 * <p>OCC 경계를 식별하는 테넌트 범위 복합 키입니다.
 * 생성 시점에 형식이 검증되므로 인스턴스는 항상 유효합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 *
 * @author DCB Team
 * @since 1.0.0
 * @see ScopeKeys
 */
public final class ScopeKey {

    private final ParsedScopeKey parsed;

    private ScopeKey(ParsedScopeKey parsed) {
        this.parsed = parsed;
    }

    /**
     * 문자열에서 ScopeKey 생성.
     *
     * @param raw Scope Key 문자열
     * @return ScopeKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 형식인 경우
     */
    public static ScopeKey of(String raw) {
        ScopeKeys.assertValid(raw);
        return new ScopeKey(ScopeKeys.parse(raw).orElseThrow());
    }

    /**
     * 구성 요소에서 ScopeKey 생성.
     *
     * @param tenantId 테넌트 ID
     * @param scopeType Scope 유형
     * @param scopeId Scope ID
     * @return ScopeKey 인스턴스
     * @throws IllegalArgumentException 구성 요소가 유효하지 않은 경우
     */
    public static ScopeKey of(String tenantId, String scopeType, String scopeId) {
        return of(ScopeKeys.create(tenantId, scopeType, scopeId));
    }

    public String getValue() {
        return parsed.raw();
    }

    public String getTenantId() {
        return parsed.tenantId();
    }

    public String getScopeType() {
        return parsed.scopeType();
    }

    public String getScopeId() {
        return parsed.scopeId();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScopeKey scopeKey = (ScopeKey) o;
        return parsed.raw().equals(scopeKey.parsed.raw());
    }

    @Override
    public int hashCode() {
        return parsed.raw().hashCode();
    }

    @Override
    public String toString() {
        return "ScopeKey{" + parsed.raw() + '}';
    }
}
