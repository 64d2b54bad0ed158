package com.ryuqq.dcb.core.decider;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decider가 생성하는 최소 이벤트.
 *
 * <p>eventType과 payload만 담으며, eventId/streamId/schemaVersion 등
 * 인프라 필드는 실행 엔진이 태깅합니다.</p>
 *
 * @param eventType 이벤트 유형 (예: ItemsReserved)
 * @param payload 이벤트 데이터 (빈 맵 허용)
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DeciderEvent(
    String eventType,
    Map<String, Object> payload
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException eventType이 null이거나 빈 문자열인 경우
     */
    public DeciderEvent {
        if (eventType == null || eventType.isBlank()) {
            throw new IllegalArgumentException("eventType cannot be null or blank");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    /**
     * DeciderEvent 생성.
     *
     * @param eventType 이벤트 유형
     * @param payload 이벤트 데이터
     * @return DeciderEvent 인스턴스
     */
    public static DeciderEvent of(String eventType, Map<String, Object> payload) {
        return new DeciderEvent(eventType, payload);
    }
}
