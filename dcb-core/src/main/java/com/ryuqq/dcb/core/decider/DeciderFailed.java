package com.ryuqq.dcb.core.decider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * 실패 결과 (실패 이벤트 발행).
 *
 * <p>요청된 변경은 거부하지만, 보상 로직이 참조할 수 있도록 이벤트를 남깁니다.</p>
 *
 * <p><strong>예시:</strong> 재고 부족으로 예약 실패 시 ReservationFailed 이벤트 발행</p>
 *
 * @param reason 실패 사유
 * @param event 실패 이벤트
 * @param context 실패 상세 정보 (null 가능)
 * @param <D> 데이터 타입
 * @param <U> 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DeciderFailed<D, U>(
    String reason,
    DeciderEvent event,
    Map<String, Object> context
) implements DeciderOutput<D, U> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException reason이 비어 있거나 event가 null인 경우
     */
    public DeciderFailed {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public <R> R match(
        Function<DeciderSuccess<D, U>, R> onSuccess,
        Function<DeciderRejected<D, U>, R> onRejected,
        Function<DeciderFailed<D, U>, R> onFailed
    ) {
        return onFailed.apply(this);
    }
}
