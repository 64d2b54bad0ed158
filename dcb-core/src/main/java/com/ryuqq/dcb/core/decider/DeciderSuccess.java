package com.ryuqq.dcb.core.decider;

import java.util.List;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * <p>발행할 이벤트, 호출자 반환 데이터, 적용할 상태 변경분을 담습니다.</p>
 *
 * @param data 호출자 반환 데이터 (null 허용)
 * @param events 발행할 이벤트 (1개 이상)
 * @param stateUpdate 상태 변경분
 * @param <D> 데이터 타입
 * @param <U> 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DeciderSuccess<D, U>(
    D data,
    List<DeciderEvent> events,
    U stateUpdate
) implements DeciderOutput<D, U> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException events가 비어 있거나 stateUpdate가 null인 경우
     */
    public DeciderSuccess {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (events.contains(null)) {
            throw new IllegalArgumentException("events cannot contain null");
        }
        if (stateUpdate == null) {
            throw new IllegalArgumentException("stateUpdate cannot be null");
        }
        events = List.copyOf(events);
        // data는 null 허용
    }

    /**
     * 첫 번째 이벤트 조회.
     *
     * @return 첫 번째 이벤트
     */
    public DeciderEvent event() {
        return events.get(0);
    }

    @Override
    public <R> R match(
        Function<DeciderSuccess<D, U>, R> onSuccess,
        Function<DeciderRejected<D, U>, R> onRejected,
        Function<DeciderFailed<D, U>, R> onFailed
    ) {
        return onSuccess.apply(this);
    }
}
