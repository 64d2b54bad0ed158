package com.ryuqq.dcb.core.contract;

import com.ryuqq.dcb.core.decider.DcbDecider;
import com.ryuqq.dcb.core.decider.DeciderOutput;
import com.ryuqq.dcb.core.event.EventCategory;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * DcbExecution 생성 검증 테스트.
 *
 * <p>호출자 배선 오류는 생성 시점에 IllegalArgumentException, Scope Key 형식은 검증하지 않음.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
class DcbExecutionTest {

    private static final DcbDecider<String, String, String, String> DECIDER =
        (state, command, context) -> DeciderOutput.rejected("NOPE", "nope");

    private static DcbExecution.Builder<String, String, String, String> validBuilder() {
        return DcbExecution.<String, String, String, String>builder()
            .scopeKey("tenant:t1:reservation:res_1")
            .expectedVersion(0)
            .boundedContext("inventory")
            .streamType("Reservation")
            .entityIds(List.of("product_1"))
            .entityLoader(id -> Optional.of("snapshot"))
            .decider(DECIDER)
            .command("reserve")
            .updateApplier(update -> { })
            .commandId("cmd_1")
            .correlationId("corr_1");
    }

    @Test
    void build_기본값_적용() {
        // When
        DcbExecution<String, String, String, String> execution = validBuilder().build();

        // Then
        assertEquals(1, execution.schemaVersion());
        assertEquals(EventCategory.DOMAIN, execution.eventCategory());
        assertNull(execution.scopeOperations());
        assertTrue(execution.scopeOperationsIfPresent().isEmpty());
    }

    @Test
    void build_잘못된_scopeKey는_허용() {
        assertDoesNotThrow(() -> validBuilder().scopeKey("not-a-key").build());
        assertDoesNotThrow(() -> validBuilder().scopeKey(null).build());
    }

    @Test
    void build_음수_expectedVersion이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> validBuilder().expectedVersion(-1).build());
    }

    @Test
    void build_schemaVersion_0이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> validBuilder().schemaVersion(0).build());
    }

    @Test
    void build_중복_엔티티_ID면_예외() {
        IllegalArgumentException exception = assertThrows(IllegalArgumentException.class,
            () -> validBuilder().entityIds(List.of("product_1", "product_1")).build());
        assertTrue(exception.getMessage().contains("Duplicate entityId"));
    }

    @Test
    void build_필수_협력객체_누락이면_예외() {
        assertThrows(IllegalArgumentException.class, () -> validBuilder().decider(null).build());
        assertThrows(IllegalArgumentException.class, () -> validBuilder().entityLoader(null).build());
        assertThrows(IllegalArgumentException.class, () -> validBuilder().updateApplier(null).build());
        assertThrows(IllegalArgumentException.class, () -> validBuilder().commandId(" ").build());
        assertThrows(IllegalArgumentException.class, () -> validBuilder().entityIds(List.of()).build());
    }

    @Test
    void entityIds_방어적_복사() {
        // Given
        List<String> ids = new ArrayList<>(List.of("product_1"));

        // When
        DcbExecution<String, String, String, String> execution = validBuilder().entityIds(ids).build();
        ids.add("product_2");

        // Then
        assertEquals(List.of("product_1"), execution.entityIds());
    }

    @Test
    void withExpectedVersion_나머지_필드_유지() {
        DcbExecution<String, String, String, String> original = validBuilder().build();

        DcbExecution<String, String, String, String> retried = original.withExpectedVersion(7);

        assertEquals(7, retried.expectedVersion());
        assertEquals(original.scopeKey(), retried.scopeKey());
        assertSame(original.decider(), retried.decider());
    }
}
