package com.ryuqq.dcb.core.event;

import java.util.UUID;

/**
 * 이벤트 ID 생성기.
 *
 * <p>테스트에서는 결정적인 구현을 주입합니다.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventIdGenerator {

    /**
     * 이벤트 ID 생성.
     *
     * @param boundedContext Bounded Context 이름
     * @return 고유 이벤트 ID
     */
    String generate(String boundedContext);

    /**
     * UUID 기반 기본 생성기 ({@code {boundedContext}_event_{uuid}}).
     *
     * @return EventIdGenerator
     */
    static EventIdGenerator uuid() {
        return boundedContext -> boundedContext + "_event_" + UUID.randomUUID();
    }
}
