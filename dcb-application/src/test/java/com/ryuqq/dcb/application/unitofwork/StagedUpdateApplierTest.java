package com.ryuqq.dcb.application.unitofwork;

import com.ryuqq.dcb.core.event.EventCategory;
import com.ryuqq.dcb.core.event.EventData;
import com.ryuqq.dcb.core.event.EventMetadata;
import com.ryuqq.dcb.core.result.ConflictStage;
import com.ryuqq.dcb.core.result.DcbConflict;
import com.ryuqq.dcb.core.result.DcbRejected;
import com.ryuqq.dcb.core.result.DcbSuccess;
import com.ryuqq.dcb.core.spi.EntityUpdate;
import com.ryuqq.dcb.testkit.fixture.RecordingUpdateApplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StagedUpdateApplier 테스트.
 *
 * @author DCB Team
 * @since 1.0.0
 */
class StagedUpdateApplierTest {

    private static final Instant NOW = Instant.parse("2024-05-01T00:00:00Z");

    private RecordingUpdateApplier<String, Integer> delegate;
    private StagedUpdateApplier<String, Integer> staged;

    @BeforeEach
    void setUp() {
        delegate = new RecordingUpdateApplier<>();
        staged = StagedUpdateApplier.wrap(delegate);
    }

    @Test
    void apply_flush_전에는_delegate_미호출() {
        // When
        staged.apply(update("product_1"));
        staged.apply(update("product_2"));

        // Then
        assertEquals(0, delegate.count());
        assertEquals(2, staged.pending().size());
    }

    @Test
    void flush_버퍼_순서대로_전달() {
        // Given
        staged.apply(update("product_2"));
        staged.apply(update("product_1"));

        // When
        int flushed = staged.flush();

        // Then
        assertEquals(2, flushed);
        assertEquals(List.of("product_2", "product_1"), delegate.appliedEntityIds());
        assertTrue(staged.pending().isEmpty());
    }

    @Test
    void flush_delegate_실패시_남은_변경분은_버퍼에_유지() {
        // Given
        delegate.failOn("product_2");
        staged.apply(update("product_1"));
        staged.apply(update("product_2"));
        staged.apply(update("product_3"));

        // When
        assertThrows(IllegalStateException.class, () -> staged.flush());

        // Then
        assertEquals(List.of("product_1"), delegate.appliedEntityIds());
        assertEquals(2, staged.pending().size());
        assertEquals("product_2", staged.pending().get(0).entityId());
    }

    @Test
    void discard_버퍼_비우고_delegate_미호출() {
        // Given
        staged.apply(update("product_1"));

        // When
        int discarded = staged.discard();

        // Then
        assertEquals(1, discarded);
        assertEquals(0, delegate.count());
        assertTrue(staged.pending().isEmpty());
    }

    @Test
    void completeWith_성공이면_flush() {
        // Given
        staged.apply(update("product_1"));
        DcbSuccess<String> success = new DcbSuccess<>(
            "ok",
            List.of(new EventData(
                "inventory_event_1", "ItemsReserved", "Reservation", "res_1", "inventory",
                1, EventCategory.DOMAIN, Map.of(), new EventMetadata("corr_1", "cmd_1")
            )),
            1,
            List.of("product_1")
        );

        // When & Then
        assertTrue(staged.completeWith(success));
        assertEquals(1, delegate.count());
    }

    @Test
    void completeWith_충돌이나_거절이면_discard() {
        staged.apply(update("product_1"));
        assertFalse(staged.completeWith(new DcbConflict<>(2, ConflictStage.COMMIT)));

        staged.apply(update("product_1"));
        assertFalse(staged.completeWith(new DcbRejected<>("INSUFFICIENT_STOCK", "Not enough stock", null)));

        assertEquals(0, delegate.count());
        assertTrue(staged.pending().isEmpty());
    }

    @Test
    void 잘못된_인자는_IllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> new StagedUpdateApplier<String, Integer>(null));
        assertThrows(IllegalArgumentException.class, () -> staged.apply(null));
        assertThrows(IllegalArgumentException.class, () -> staged.completeWith(null));
    }

    private static EntityUpdate<String, Integer> update(String entityId) {
        return new EntityUpdate<>(entityId, "snapshot", -1, 1, NOW);
    }
}
