package com.ryuqq.dcb.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 실행 엔진이 태깅한 이벤트.
 *
 * <p>Decider가 생성한 {@code DeciderEvent}에 스트림, 컨텍스트, 스키마, 추적 정보를 붙인 형태입니다.
 * DCB 실행에서 streamId는 Scope Key의 scopeId입니다.</p>
 *
 * @param eventId 이벤트 ID
 * @param eventType 이벤트 유형
 * @param streamType 스트림 유형
 * @param streamId 스트림 ID
 * @param boundedContext Bounded Context 이름
 * @param schemaVersion 스키마 버전 (1 이상)
 * @param category 이벤트 카테고리
 * @param payload 이벤트 데이터
 * @param metadata 추적 메타데이터
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record EventData(
    String eventId,
    String eventType,
    String streamType,
    String streamId,
    String boundedContext,
    int schemaVersion,
    EventCategory category,
    Map<String, Object> payload,
    EventMetadata metadata
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 누락되었거나 schemaVersion이 0 이하인 경우
     */
    public EventData {
        requireText(eventId, "eventId");
        requireText(eventType, "eventType");
        requireText(streamType, "streamType");
        requireText(streamId, "streamId");
        requireText(boundedContext, "boundedContext");
        if (schemaVersion <= 0) {
            throw new IllegalArgumentException("schemaVersion must be positive (current: " + schemaVersion + ")");
        }
        if (category == null) {
            throw new IllegalArgumentException("category cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        payload = payload == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
