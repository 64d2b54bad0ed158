package com.ryuqq.dcb.core.result;

import java.util.function.Function;

/**
 * DCB 실행 결과.
 *
 * <p>DcbExecutionResult는 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link DcbSuccess}: 변경 적용 및 Scope 커밋 완료</li>
 *   <li>{@link DcbRejected}: 형식 오류, 엔티티 누락 또는 비즈니스 거절 (부수 효과 없음)</li>
 *   <li>{@link DcbFailed}: 기록되는 거절 (실패 이벤트만 존재, 상태 변경 없음)</li>
 *   <li>{@link DcbConflict}: 동시성 충돌 (호출자가 재시도 여부 결정)</li>
 * </ul>
 *
 * <p>Java 17에서는 switch 패턴 매칭 대신 {@link #match}로 모든 케이스 처리를 강제합니다.</p>
 *
 * <pre>
 * String summary = result.match(
 *     success -&gt; "v" + success.scopeVersion(),
 *     rejected -&gt; rejected.code(),
 *     failed -&gt; failed.reason(),
 *     conflict -&gt; "conflict@" + conflict.currentVersion()
 * );
 * </pre>
 *
 * @param <D> 성공 데이터 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public sealed interface DcbExecutionResult<D> permits DcbSuccess, DcbRejected, DcbFailed, DcbConflict {

    /**
     * 결과 유형별 분기.
     *
     * @param onSuccess 성공 처리
     * @param onRejected 거절 처리
     * @param onFailed 실패 처리
     * @param onConflict 충돌 처리
     * @param <R> 반환 타입
     * @return 선택된 함수의 반환값
     */
    <R> R match(
        Function<DcbSuccess<D>, R> onSuccess,
        Function<DcbRejected<D>, R> onRejected,
        Function<DcbFailed<D>, R> onFailed,
        Function<DcbConflict<D>, R> onConflict
    );

    default boolean isSuccess() {
        return this instanceof DcbSuccess;
    }

    default boolean isRejected() {
        return this instanceof DcbRejected;
    }

    default boolean isFailed() {
        return this instanceof DcbFailed;
    }

    default boolean isConflict() {
        return this instanceof DcbConflict;
    }
}
