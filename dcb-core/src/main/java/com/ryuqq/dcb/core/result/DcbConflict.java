package com.ryuqq.dcb.core.result;

import java.util.function.Function;

/**
 * 동시성 충돌 결과.
 *
 * <p>{@link ConflictStage#PRE_CHECK}이면 아무것도 적용되지 않았고,
 * {@link ConflictStage#COMMIT}이면 엔티티 변경은 이미 적용된 상태입니다 (롤백 없음).</p>
 *
 * @param currentVersion 충돌 시점의 실제 Scope 버전
 * @param stage 충돌 감지 단계
 * @param <D> 데이터 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DcbConflict<D>(
    long currentVersion,
    ConflictStage stage
) implements DcbExecutionResult<D> {

    public DcbConflict {
        if (currentVersion < 0) {
            throw new IllegalArgumentException("currentVersion must be non-negative (current: " + currentVersion + ")");
        }
        if (stage == null) {
            throw new IllegalArgumentException("stage cannot be null");
        }
    }

    /**
     * 충돌 전에 엔티티 변경이 적용되었는지 확인.
     *
     * @return COMMIT 단계 충돌인 경우 true
     */
    public boolean updatesApplied() {
        return stage == ConflictStage.COMMIT;
    }

    @Override
    public <R> R match(
        Function<DcbSuccess<D>, R> onSuccess,
        Function<DcbRejected<D>, R> onRejected,
        Function<DcbFailed<D>, R> onFailed,
        Function<DcbConflict<D>, R> onConflict
    ) {
        return onConflict.apply(this);
    }
}
