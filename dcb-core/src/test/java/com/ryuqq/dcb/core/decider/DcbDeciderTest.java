package com.ryuqq.dcb.core.decider;

import com.ryuqq.dcb.core.scope.ScopeKey;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DcbDecider.forEntity 테스트.
 *
 * @author DCB Team
 * @since 1.0.0
 */
class DcbDeciderTest {

    private static final DeciderContext CONTEXT = DeciderContext.of(Instant.EPOCH, "cmd_1", "corr_1");

    /** 재고에서 수량만큼 차감, 부족하면 거절, 0이면 실패 이벤트. */
    private static final Decider<Integer, Integer, String, Integer> RESERVE = (stock, quantity, context) -> {
        if (quantity == 0) {
            return DeciderOutput.failed("Empty reservation", DeciderEvent.of("ReservationFailed", Map.of()));
        }
        if (stock < quantity) {
            return DeciderOutput.rejected("INSUFFICIENT_STOCK", "Not enough stock", Map.of("available", stock));
        }
        return DeciderOutput.success("reserved", DeciderEvent.of("ItemsReserved", Map.of("quantity", quantity)), -quantity);
    };

    @Test
    void forEntity_성공이면_대상_엔티티_하나의_변경분() {
        // Given
        DcbDecider<Integer, Integer, String, Integer> decider = DcbDecider.forEntity("product_2", RESERVE);

        // When
        DeciderOutput<String, StateUpdates<Integer>> output = decider.decide(state(), 3, CONTEXT);

        // Then
        DeciderSuccess<String, StateUpdates<Integer>> success = (DeciderSuccess<String, StateUpdates<Integer>>) output;
        assertEquals("reserved", success.data());
        assertEquals(StateUpdates.of("product_2", -3), success.stateUpdate());
        assertEquals("ItemsReserved", success.event().eventType());
    }

    @Test
    void forEntity_거절과_실패는_그대로_전달() {
        DcbDecider<Integer, Integer, String, Integer> decider = DcbDecider.forEntity("product_2", RESERVE);

        DeciderOutput<String, StateUpdates<Integer>> rejected = decider.decide(state(), 9, CONTEXT);
        DeciderOutput<String, StateUpdates<Integer>> failed = decider.decide(state(), 0, CONTEXT);

        DeciderRejected<String, StateUpdates<Integer>> rejection = (DeciderRejected<String, StateUpdates<Integer>>) rejected;
        assertEquals("INSUFFICIENT_STOCK", rejection.code());
        assertEquals(5, rejection.context().get("available"));
        assertTrue(failed.isFailed());
        assertEquals("ReservationFailed", ((DeciderFailed<String, StateUpdates<Integer>>) failed).event().eventType());
    }

    @Test
    void forEntity_집계_상태에_없는_엔티티면_IllegalArgumentException() {
        DcbDecider<Integer, Integer, String, Integer> decider = DcbDecider.forEntity("product_9", RESERVE);

        assertThrows(IllegalArgumentException.class, () -> decider.decide(state(), 1, CONTEXT));
    }

    @Test
    void forEntity_Decider가_null을_반환하면_IllegalStateException() {
        DcbDecider<Integer, Integer, String, Integer> decider =
            DcbDecider.forEntity("product_1", (stock, quantity, context) -> null);

        assertThrows(IllegalStateException.class, () -> decider.decide(state(), 1, CONTEXT));
    }

    @Test
    void forEntity_잘못된_인자는_IllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> DcbDecider.forEntity(" ", RESERVE));
        assertThrows(IllegalArgumentException.class, () -> DcbDecider.<Integer, Integer, String, Integer>forEntity("product_1", null));
    }

    private static AggregatedState<Integer> state() {
        Map<String, Integer> entities = new LinkedHashMap<>();
        entities.put("product_1", 10);
        entities.put("product_2", 5);
        return AggregatedState.of(ScopeKey.of("t1", "reservation", "res_1"), 2, entities);
    }
}
