package com.ryuqq.dcb.core.statemachine;

/**
 * DCB 실행 단계.
 *
 * <p><strong>단계 전이 다이어그램:</strong></p>
 * <pre>
 * VALIDATE
 *    │
 *    ├─► REJECTED (Scope Key 형식 오류)
 *    ├─► OCC_PRE_CHECK ─► CONFLICT
 *    │        │
 *    ▼        ▼
 *   LOAD ─────┴─► REJECTED (엔티티 누락)
 *    │
 *    ▼
 * DECIDE
 *    │
 *    ├─► REJECTED
 *    ├─► FAILED
 *    └─► APPLY
 *          │
 *          ├─► COMMITTED (Scope OCC 미사용)
 *          └─► OCC_COMMIT
 *                 ├─► CONFLICT
 *                 └─► COMMITTED
 * </pre>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public enum ExecutionPhase {

    /**
     * Scope Key 검증.
     */
    VALIDATE,

    /**
     * Scope 버전 사전 확인.
     */
    OCC_PRE_CHECK,

    /**
     * 엔티티 로딩.
     */
    LOAD,

    /**
     * Decider 호출.
     */
    DECIDE,

    /**
     * 엔티티 변경 적용.
     */
    APPLY,

    /**
     * Scope 버전 커밋.
     */
    OCC_COMMIT,

    REJECTED,

    FAILED,

    CONFLICT,

    COMMITTED;

    /**
     * 종료 단계인지 확인.
     *
     * @return REJECTED, FAILED, CONFLICT, COMMITTED인 경우 true
     */
    public boolean isTerminal() {
        return this == REJECTED || this == FAILED || this == CONFLICT || this == COMMITTED;
    }
}
