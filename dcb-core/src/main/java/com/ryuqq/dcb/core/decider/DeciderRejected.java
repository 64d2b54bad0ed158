package com.ryuqq.dcb.core.decider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 거절 결과 (이벤트 없음).
 *
 * <p>사전 조건 또는 비즈니스 규칙 위반을 나타냅니다. 상태는 변경되지 않았으며,
 * 입력을 바꾸지 않고 재시도해도 같은 결과가 나옵니다.</p>
 *
 * @param code 오류 코드 (예: ORDER_NOT_IN_DRAFT)
 * @param message 오류 메시지
 * @param context 오류 상세 정보 (null 가능)
 * @param <D> 데이터 타입
 * @param <U> 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DeciderRejected<D, U>(
    String code,
    String message,
    Map<String, Object> context
) implements DeciderOutput<D, U> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException code 또는 message가 null이거나 빈 문자열인 경우
     */
    public DeciderRejected {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("code cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public <R> R match(
        Function<DeciderSuccess<D, U>, R> onSuccess,
        Function<DeciderRejected<D, U>, R> onRejected,
        Function<DeciderFailed<D, U>, R> onFailed
    ) {
        return onRejected.apply(this);
    }
}
