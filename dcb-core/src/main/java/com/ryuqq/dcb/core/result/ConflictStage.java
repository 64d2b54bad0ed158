package com.ryuqq.dcb.core.result;

/**
 * 충돌 감지 단계.
 *
 * @author DCB Team
 * @since 1.0.0
 */
public enum ConflictStage {

    /**
     * 엔티티 로딩 전 Scope 버전 확인 단계.
     */
    PRE_CHECK,

    /**
     * 엔티티 변경 적용 후 Scope 커밋 단계.
     */
    COMMIT
}
