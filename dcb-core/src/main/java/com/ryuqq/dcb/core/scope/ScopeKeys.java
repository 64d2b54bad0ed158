package com.ryuqq.dcb.core.scope;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Scope Key 생성, 파싱, 검증 유틸리티.
 *
 * <p>Scope Key 형식: {@code tenant:{tenantId}:{scopeType}:{scopeId}}</p>
 *
 * <p><strong>규칙:</strong></p>
 * <ul>
 *   <li>tenant 접두사 필수 (테넌트 격리)</li>
 *   <li>tenantId, scopeType: 빈 문자열 불가, 콜론 불가</li>
 *   <li>scopeId: 빈 문자열 불가, 콜론 허용 (세 번째 콜론 이후 전체)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ScopeKeys.create("t1", "reservation", "res_123");  // "tenant:t1:reservation:res_123"
 * ScopeKeys.extractScopeId("tenant:t1:order:ord:2024:001");  // "ord:2024:001"
 * </pre>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class ScopeKeys {

    /**
     * 테넌트 격리를 위한 Scope Key 접두사.
     */
    public static final String PREFIX = "tenant:";

    private static final String SEPARATOR = ":";

    private static final Pattern SCOPE_KEY_PATTERN = Pattern.compile("^tenant:([^:]+):([^:]+):(.+)$");

    // Utility class - prevent instantiation
    private ScopeKeys() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 구성 요소로 Scope Key 생성.
     *
     * @param tenantId 테넌트 ID
     * @param scopeType Scope 유형
     * @param scopeId Scope ID
     * @return Scope Key 문자열
     * @throws IllegalArgumentException 구성 요소가 비어 있거나 tenantId/scopeType에 콜론이 포함된 경우
     */
    public static String create(String tenantId, String scopeType, String scopeId) {
        if (tenantId == null || tenantId.isEmpty()) {
            throw new IllegalArgumentException("tenantId is required for scope key");
        }
        if (scopeType == null || scopeType.isEmpty()) {
            throw new IllegalArgumentException("scopeType is required for scope key");
        }
        if (scopeId == null || scopeId.isEmpty()) {
            throw new IllegalArgumentException("scopeId is required for scope key");
        }
        if (tenantId.contains(SEPARATOR)) {
            throw new IllegalArgumentException("tenantId cannot contain colons (current: " + tenantId + ")");
        }
        if (scopeType.contains(SEPARATOR)) {
            throw new IllegalArgumentException("scopeType cannot contain colons (current: " + scopeType + ")");
        }
        return PREFIX + tenantId + SEPARATOR + scopeType + SEPARATOR + scopeId;
    }

    /**
     * 예외 없이 Scope Key 생성.
     *
     * @param tenantId 테넌트 ID
     * @param scopeType Scope 유형
     * @param scopeId Scope ID
     * @return 생성된 Scope Key, 유효하지 않으면 empty
     */
    public static Optional<String> tryCreate(String tenantId, String scopeType, String scopeId) {
        try {
            return Optional.of(create(tenantId, scopeType, scopeId));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }

    /**
     * Scope Key 파싱.
     *
     * <p>scopeId는 세 번째 콜론 이후의 나머지 문자열 전체입니다.</p>
     *
     * @param raw Scope Key 문자열
     * @return 파싱 결과, 형식이 잘못되었으면 empty
     */
    public static Optional<ParsedScopeKey> parse(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        Matcher matcher = SCOPE_KEY_PATTERN.matcher(raw);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return Optional.of(new ParsedScopeKey(matcher.group(1), matcher.group(2), matcher.group(3), raw));
    }

    /**
     * Scope Key 형식 검증.
     *
     * @param raw Scope Key 문자열
     * @return 유효하면 empty, 아니면 검증 오류
     */
    public static Optional<ScopeKeyValidationError> validate(String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.of(new ScopeKeyValidationError(
                ScopeKeyErrorCode.SCOPE_KEY_EMPTY,
                "Scope key cannot be empty"
            ));
        }
        if (!raw.startsWith(PREFIX)) {
            return Optional.of(new ScopeKeyValidationError(
                ScopeKeyErrorCode.INVALID_SCOPE_KEY_FORMAT,
                "Scope key must start with '" + PREFIX + "' prefix for tenant isolation. Got: " + raw
            ));
        }
        if (parse(raw).isEmpty()) {
            return Optional.of(new ScopeKeyValidationError(
                ScopeKeyErrorCode.INVALID_SCOPE_KEY_FORMAT,
                "Invalid scope key format. Expected: tenant:{tenantId}:{scopeType}:{scopeId}, got: " + raw
            ));
        }
        return Optional.empty();
    }

    /**
     * Scope Key 유효 여부.
     *
     * @param raw Scope Key 문자열
     * @return 유효하면 true
     */
    public static boolean isValid(String raw) {
        return validate(raw).isEmpty();
    }

    /**
     * Scope Key가 유효하지 않으면 예외 발생.
     *
     * @param raw Scope Key 문자열
     * @throws IllegalArgumentException 유효하지 않은 경우 ("CODE: message")
     */
    public static void assertValid(String raw) {
        Optional<ScopeKeyValidationError> error = validate(raw);
        if (error.isPresent()) {
            throw new IllegalArgumentException(error.get().describe());
        }
    }

    /**
     * Scope Key가 특정 테넌트에 속하는지 확인.
     *
     * @param raw Scope Key 문자열
     * @param tenantId 비교할 테넌트 ID
     * @return 해당 테넌트 소속이면 true (형식 오류 시 false)
     */
    public static boolean isTenant(String raw, String tenantId) {
        return parse(raw)
            .map(parsed -> parsed.tenantId().equals(tenantId))
            .orElse(false);
    }

    /**
     * 테넌트 ID 추출.
     *
     * @param raw Scope Key 문자열
     * @return 테넌트 ID
     * @throws IllegalArgumentException 유효하지 않은 Scope Key인 경우
     */
    public static String extractTenantId(String raw) {
        return parseOrThrow(raw).tenantId();
    }

    /**
     * Scope 유형 추출.
     *
     * @param raw Scope Key 문자열
     * @return Scope 유형
     * @throws IllegalArgumentException 유효하지 않은 Scope Key인 경우
     */
    public static String extractScopeType(String raw) {
        return parseOrThrow(raw).scopeType();
    }

    /**
     * Scope ID 추출.
     *
     * @param raw Scope Key 문자열
     * @return Scope ID (콜론 포함 가능)
     * @throws IllegalArgumentException 유효하지 않은 Scope Key인 경우
     */
    public static String extractScopeId(String raw) {
        return parseOrThrow(raw).scopeId();
    }

    private static ParsedScopeKey parseOrThrow(String raw) {
        return parse(raw).orElseThrow(() -> new IllegalArgumentException("Invalid scope key: " + raw));
    }
}
