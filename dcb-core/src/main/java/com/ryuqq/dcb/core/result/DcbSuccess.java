package com.ryuqq.dcb.core.result;

import com.ryuqq.dcb.core.event.EventData;

import java.util.List;
import java.util.function.Function;

/**
 * 성공 결과.
 *
 * @param data Decider 반환 데이터 (null 허용)
 * @param events 태깅된 이벤트 (1개 이상)
 * @param scopeVersion 커밋 후 Scope 버전
 * @param updatedEntityIds 변경된 엔티티 ID (적용 순서)
 * @param <D> 데이터 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DcbSuccess<D>(
    D data,
    List<EventData> events,
    long scopeVersion,
    List<String> updatedEntityIds
) implements DcbExecutionResult<D> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public DcbSuccess {
        if (events == null || events.isEmpty()) {
            throw new IllegalArgumentException("events cannot be null or empty");
        }
        if (scopeVersion < 1) {
            throw new IllegalArgumentException("scopeVersion must be positive (current: " + scopeVersion + ")");
        }
        if (updatedEntityIds == null) {
            throw new IllegalArgumentException("updatedEntityIds cannot be null");
        }
        events = List.copyOf(events);
        updatedEntityIds = List.copyOf(updatedEntityIds);
    }

    @Override
    public <R> R match(
        Function<DcbSuccess<D>, R> onSuccess,
        Function<DcbRejected<D>, R> onRejected,
        Function<DcbFailed<D>, R> onFailed,
        Function<DcbConflict<D>, R> onConflict
    ) {
        return onSuccess.apply(this);
    }
}
