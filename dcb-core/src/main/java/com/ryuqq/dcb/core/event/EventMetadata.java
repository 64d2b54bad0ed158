package com.ryuqq.dcb.core.event;

/**
 * 이벤트 추적 메타데이터.
 *
 * @param correlationId 상관관계 ID
 * @param causationId 원인 ID (이벤트를 발생시킨 명령 ID)
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record EventMetadata(
    String correlationId,
    String causationId
) {

    public EventMetadata {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
        if (causationId == null || causationId.isBlank()) {
            throw new IllegalArgumentException("causationId cannot be null or blank");
        }
    }
}
