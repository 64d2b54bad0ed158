package com.ryuqq.dcb.core.decider;

import java.time.Instant;

/**
 * Decider 호출 컨텍스트.
 *
 * <p>순수 함수가 직접 생성하면 안 되는 값(현재 시각, 식별자)을 명시적으로 전달합니다.
 * Decider는 전역 상태나 시스템 시계를 읽지 않고 이 값만 사용해야 합니다.</p>
 *
 * @param now 결정 시각
 * @param commandId 명령 ID (causation 추적)
 * @param correlationId 상관관계 ID (요청 추적)
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DeciderContext(
    Instant now,
    String commandId,
    String correlationId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 빈 문자열인 경우
     */
    public DeciderContext {
        if (now == null) {
            throw new IllegalArgumentException("now cannot be null");
        }
        if (commandId == null || commandId.isBlank()) {
            throw new IllegalArgumentException("commandId cannot be null or blank");
        }
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be null or blank");
        }
    }

    /**
     * DeciderContext 생성.
     *
     * @param now 결정 시각
     * @param commandId 명령 ID
     * @param correlationId 상관관계 ID
     * @return DeciderContext 인스턴스
     */
    public static DeciderContext of(Instant now, String commandId, String correlationId) {
        return new DeciderContext(now, commandId, correlationId);
    }
}
