package com.ryuqq.dcb.core.result;

import com.ryuqq.dcb.core.event.EventData;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * 실패 결과.
 *
 * <p>태깅된 실패 이벤트를 포함하지만 엔티티 변경과 Scope 커밋은 수행되지 않았습니다.
 * 실패 이벤트의 영속화는 호출자 책임입니다.</p>
 *
 * @param reason 실패 사유
 * @param events 태깅된 실패 이벤트
 * @param context 상세 정보 (null 가능)
 * @param <D> 데이터 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DcbFailed<D>(
    String reason,
    List<EventData> events,
    Map<String, Object> context
) implements DcbExecutionResult<D> {

    public DcbFailed {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        events = List.copyOf(events);
        context = context == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }

    @Override
    public <R> R match(
        Function<DcbSuccess<D>, R> onSuccess,
        Function<DcbRejected<D>, R> onRejected,
        Function<DcbFailed<D>, R> onFailed,
        Function<DcbConflict<D>, R> onConflict
    ) {
        return onFailed.apply(this);
    }
}
