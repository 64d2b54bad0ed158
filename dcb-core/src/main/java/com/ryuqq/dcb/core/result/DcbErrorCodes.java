package com.ryuqq.dcb.core.result;

/**
 * 실행 엔진이 생성하는 거절 코드.
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class DcbErrorCodes {

    public static final String ENTITIES_NOT_FOUND = "ENTITIES_NOT_FOUND";

    public static final String SCOPE_KEY_EMPTY = "SCOPE_KEY_EMPTY";

    public static final String INVALID_SCOPE_KEY_FORMAT = "INVALID_SCOPE_KEY_FORMAT";

    /**
     * 재시도 헬퍼가 최대 시도 횟수를 소진한 경우.
     */
    public static final String DCB_MAX_RETRIES_EXCEEDED = "DCB_MAX_RETRIES_EXCEEDED";

    private DcbErrorCodes() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
