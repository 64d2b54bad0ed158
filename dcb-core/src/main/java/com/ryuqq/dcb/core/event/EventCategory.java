package com.ryuqq.dcb.core.event;

/**
 * 이벤트 카테고리.
 *
 * <p>이벤트가 어느 경계를 넘어 소비되는지를 나타냅니다.</p>
 * <ul>
 *   <li>DOMAIN: 같은 Bounded Context 내부 이벤트 (기본값)</li>
 *   <li>INTEGRATION: 다른 Bounded Context로 전달되는 이벤트</li>
 *   <li>TRIGGER: 외부 시스템 트리거용 얇은 이벤트</li>
 *   <li>FAT: 외부 소비자를 위한 전체 상태 포함 이벤트</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public enum EventCategory {

    DOMAIN("domain"),

    INTEGRATION("integration"),

    TRIGGER("trigger"),

    FAT("fat");

    /**
     * 기본 카테고리.
     */
    public static final EventCategory DEFAULT = DOMAIN;

    private final String value;

    EventCategory(String value) {
        this.value = value;
    }

    /**
     * 직렬화 값 (소문자).
     *
     * @return 카테고리 값
     */
    public String getValue() {
        return value;
    }

    /**
     * 외부 시스템으로 나가는 카테고리인지 확인.
     *
     * @return TRIGGER 또는 FAT인 경우 true
     */
    public boolean isExternal() {
        return this == TRIGGER || this == FAT;
    }

    /**
     * Bounded Context 간 전달 카테고리인지 확인.
     *
     * @return INTEGRATION인 경우 true
     */
    public boolean isCrossContext() {
        return this == INTEGRATION;
    }

    /**
     * 직렬화 값으로 카테고리 조회.
     *
     * @param value 카테고리 값 (대소문자 무시)
     * @return EventCategory
     * @throws IllegalArgumentException 알 수 없는 값인 경우
     */
    public static EventCategory fromValue(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        for (EventCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown event category: " + value);
    }

    /**
     * 관대한 변환 (알 수 없는 값 또는 null이면 DOMAIN).
     *
     * @param value 카테고리 값
     * @return EventCategory
     */
    public static EventCategory normalize(String value) {
        if (value == null) {
            return DEFAULT;
        }
        for (EventCategory category : values()) {
            if (category.value.equalsIgnoreCase(value.trim())) {
                return category;
            }
        }
        return DEFAULT;
    }
}
