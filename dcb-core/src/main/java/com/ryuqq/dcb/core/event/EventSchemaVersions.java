package com.ryuqq.dcb.core.event;

/**
 * 이벤트 스키마 버전 유틸리티.
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class EventSchemaVersions {

    /**
     * 스키마 버전 기본값.
     */
    public static final int DEFAULT = 1;

    private EventSchemaVersions() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 스키마 버전 정규화 (0 이하이면 기본값).
     *
     * @param schemaVersion 스키마 버전 (null 가능)
     * @return 1 이상의 스키마 버전
     */
    public static int normalize(Integer schemaVersion) {
        if (schemaVersion == null || schemaVersion <= 0) {
            return DEFAULT;
        }
        return schemaVersion;
    }
}
