package com.ryuqq.dcb.core.result;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 거절 결과.
 *
 * <p>이벤트가 없고 엔티티 또는 Scope에 아무것도 기록되지 않았습니다.</p>
 *
 * @param code 오류 코드 (예: ENTITIES_NOT_FOUND)
 * @param reason 사유
 * @param context 상세 정보 (null 가능)
 * @param <D> 데이터 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DcbRejected<D>(
    String code,
    String reason,
    Map<String, Object> context
) implements DcbExecutionResult<D> {

    public DcbRejected {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public <R> R match(
        Function<DcbSuccess<D>, R> onSuccess,
        Function<DcbRejected<D>, R> onRejected,
        Function<DcbFailed<D>, R> onFailed,
        Function<DcbConflict<D>, R> onConflict
    ) {
        return onRejected.apply(this);
    }
}
