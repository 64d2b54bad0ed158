package com.ryuqq.dcb.core.decider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DeciderOutput 테스트.
 *
 * <ul>
 *   <li>팩토리별 결과 유형과 술어</li>
 *   <li>match 분기</li>
 *   <li>success는 이벤트 1개 이상, failed는 이벤트 정확히 1개</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 */
class DeciderOutputTest {

    private static final DeciderEvent RESERVED = DeciderEvent.of("ItemsReserved", Map.of("orderId", "ord_1"));

    @Test
    void success_단일_이벤트() {
        // When
        DeciderOutput<String, Integer> output = DeciderOutput.success("data", RESERVED, 3);

        // Then
        assertTrue(output.isSuccess());
        assertFalse(output.isRejected());
        assertFalse(output.isFailed());
        DeciderSuccess<String, Integer> success = (DeciderSuccess<String, Integer>) output;
        assertEquals("data", success.data());
        assertEquals(List.of(RESERVED), success.events());
        assertEquals(RESERVED, success.event());
        assertEquals(3, success.stateUpdate());
    }

    @Test
    void success_다중_이벤트_순서_유지() {
        // Given
        DeciderEvent second = DeciderEvent.of("StockLowered", Map.of());

        // When
        DeciderOutput<String, Integer> output = DeciderOutput.success(null, List.of(RESERVED, second), 1);

        // Then
        DeciderSuccess<String, Integer> success = (DeciderSuccess<String, Integer>) output;
        assertNull(success.data());
        assertEquals(List.of(RESERVED, second), success.events());
    }

    @Test
    void success_이벤트가_없으면_예외() {
        assertThrows(IllegalArgumentException.class, () -> DeciderOutput.success("data", List.of(), 1));
    }

    @Test
    void success_stateUpdate가_null이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> DeciderOutput.success("data", RESERVED, null));
    }

    @Test
    void rejected_context_없이_생성() {
        // When
        DeciderOutput<String, Integer> output = DeciderOutput.rejected("INSUFFICIENT_STOCK", "Not enough stock");

        // Then
        assertTrue(output.isRejected());
        DeciderRejected<String, Integer> rejected = (DeciderRejected<String, Integer>) output;
        assertEquals("INSUFFICIENT_STOCK", rejected.code());
        assertEquals("Not enough stock", rejected.message());
        assertNull(rejected.context());
    }

    @Test
    void rejected_context_포함() {
        DeciderOutput<String, Integer> output =
            DeciderOutput.rejected("INSUFFICIENT_STOCK", "Not enough stock", Map.of("available", 2));

        assertEquals(Map.of("available", 2), ((DeciderRejected<String, Integer>) output).context());
    }

    @Test
    void rejected_빈_코드면_예외() {
        assertThrows(IllegalArgumentException.class, () -> DeciderOutput.rejected(" ", "message"));
    }

    @Test
    void failed_이벤트_하나를_포함() {
        // Given
        DeciderEvent failure = DeciderEvent.of("ReservationFailed", Map.of("reason", "stock"));

        // When
        DeciderOutput<String, Integer> output = DeciderOutput.failed("Out of stock", failure, Map.of("productId", "p1"));

        // Then
        assertTrue(output.isFailed());
        DeciderFailed<String, Integer> failed = (DeciderFailed<String, Integer>) output;
        assertEquals("Out of stock", failed.reason());
        assertEquals(failure, failed.event());
        assertEquals(Map.of("productId", "p1"), failed.context());
    }

    @Test
    void failed_이벤트가_null이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> DeciderOutput.failed("reason", null));
    }

    @Test
    void match_결과_유형별_분기() {
        // Given
        DeciderOutput<String, Integer> success = DeciderOutput.success("d", RESERVED, 1);
        DeciderOutput<String, Integer> rejected = DeciderOutput.rejected("CODE", "message");
        DeciderOutput<String, Integer> failed = DeciderOutput.failed("reason", RESERVED);

        // When & Then
        assertEquals("success:ItemsReserved", describe(success));
        assertEquals("rejected:CODE", describe(rejected));
        assertEquals("failed:reason", describe(failed));
    }

    @Test
    void payload_방어적_복사() {
        // Given
        java.util.HashMap<String, Object> payload = new java.util.HashMap<>();
        payload.put("qty", 1);

        // When
        DeciderEvent event = DeciderEvent.of("ItemsReserved", payload);
        payload.put("qty", 2);

        // Then
        assertEquals(1, event.payload().get("qty"));
        assertThrows(UnsupportedOperationException.class, () -> event.payload().put("x", 1));
    }

    @Test
    void payload와_context는_null_값과_키_순서를_유지() {
        // Given
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("reservationId", "res_1");
        payload.put("note", null);
        payload.put("attempt", 2);
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("missing", null);

        // When
        DeciderEvent event = DeciderEvent.of("ReservationFailed", payload);
        DeciderOutput<String, Integer> rejected = DeciderOutput.rejected("X", "y", context);
        DeciderOutput<String, Integer> failed = DeciderOutput.failed("z", event, context);

        // Then
        assertEquals(List.of("reservationId", "note", "attempt"), new ArrayList<>(event.payload().keySet()));
        assertTrue(event.payload().containsKey("note"));
        assertNull(event.payload().get("note"));
        assertTrue(((DeciderRejected<String, Integer>) rejected).context().containsKey("missing"));
        assertTrue(((DeciderFailed<String, Integer>) failed).context().containsKey("missing"));
    }

    private static String describe(DeciderOutput<String, Integer> output) {
        return output.match(
            s -> "success:" + s.event().eventType(),
            r -> "rejected:" + r.code(),
            f -> "failed:" + f.reason()
        );
    }
}
