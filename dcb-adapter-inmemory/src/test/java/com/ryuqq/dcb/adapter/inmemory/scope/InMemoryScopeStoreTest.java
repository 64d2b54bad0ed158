package com.ryuqq.dcb.adapter.inmemory.scope;

import com.ryuqq.dcb.core.scope.ScopeKey;
import com.ryuqq.dcb.core.spi.ScopeCommitResult;
import com.ryuqq.dcb.core.spi.ScopeState;
import com.ryuqq.dcb.core.spi.ScopeVersionCheck;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * InMemoryScopeStore 부가 기능 테스트.
 *
 * <p>SPI 계약 외 기능(getOrCreate, checkVersion, 관리용 메서드)을 검증합니다.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
class InMemoryScopeStoreTest {

    private final ScopeKey key = ScopeKey.of("t1", "reservation", "res_1");
    private static final Instant START = Instant.parse("2024-05-01T00:00:00Z");

    private InMemoryScopeStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryScopeStore(new TickingClock(START));
    }

    @Test
    void getOrCreate_없으면_버전_0으로_생성() {
        // When
        ScopeState state = store.getOrCreate(key);

        // Then
        assertEquals(0, state.currentVersion());
        assertTrue(state.entityIds().isEmpty());
        assertEquals(1, store.size());
        assertTrue(store.getScope(key).isPresent());
    }

    @Test
    void getOrCreate_이미_있으면_기존_상태_유지() {
        // Given
        store.commitScope(key, List.of("product_1"), 0);

        // When
        ScopeState state = store.getOrCreate(key);

        // Then
        assertEquals(1, state.currentVersion());
        assertEquals(List.of("product_1"), state.entityIds());
    }

    @Test
    void getOrCreate_후_expectedVersion_0_커밋은_성공() {
        // Given
        store.getOrCreate(key);

        // When
        ScopeCommitResult result = store.commitScope(key, List.of("product_1"), 0);

        // Then
        assertEquals(ScopeCommitResult.committed(1), result);
    }

    @Test
    void checkVersion_상태별_결과() {
        ScopeVersionCheck absentAtZero = store.checkVersion(key, 0);
        assertEquals(ScopeVersionCheck.Status.MATCH, absentAtZero.status());
        assertEquals(0, absentAtZero.currentVersion());
        assertEquals(ScopeVersionCheck.Status.NOT_FOUND, store.checkVersion(key, 1).status());
        assertEquals(0, store.size());

        store.commitScope(key, List.of("product_1"), 0);

        assertTrue(store.checkVersion(key, 1).matches());
        ScopeVersionCheck mismatch = store.checkVersion(key, 3);
        assertEquals(ScopeVersionCheck.Status.MISMATCH, mismatch.status());
        assertEquals(1, mismatch.currentVersion());
    }

    // ========== 타임스탬프 ==========

    @Test
    void commitScope_첫_커밋은_생성시각과_수정시각이_같고_이후_수정시각만_갱신() {
        // When
        store.commitScope(key, List.of("product_1"), 0);
        ScopeState first = store.getScope(key).orElseThrow();
        store.commitScope(key, List.of("product_2"), 1);
        ScopeState second = store.getScope(key).orElseThrow();

        // Then
        assertEquals(START, first.createdAt());
        assertEquals(first.createdAt(), first.lastUpdatedAt());
        assertEquals(START, second.createdAt());
        assertEquals(START.plusSeconds(1), second.lastUpdatedAt());
    }

    @Test
    void commitScope_충돌이면_수정시각_불변() {
        // Given
        store.commitScope(key, List.of("product_1"), 0);

        // When
        store.commitScope(key, List.of("product_1"), 0);

        // Then
        assertEquals(START, store.getScope(key).orElseThrow().lastUpdatedAt());
    }

    @Test
    void getOrCreate_생성시각_기록() {
        ScopeState state = store.getOrCreate(key);

        assertEquals(START, state.createdAt());
        assertEquals(START, state.lastUpdatedAt());
    }

    // ========== 테넌트별 조회 ==========

    @Test
    void listScopesByTenant_테넌트와_타입으로_필터링_생성순_정렬() {
        // Given
        ScopeKey order = ScopeKey.of("t1", "order", "ord_1");
        ScopeKey reservation2 = ScopeKey.of("t1", "reservation", "res_2");
        ScopeKey otherTenant = ScopeKey.of("t2", "reservation", "res_1");
        store.commitScope(reservation2, List.of(), 0);
        store.commitScope(otherTenant, List.of(), 0);
        store.commitScope(order, List.of(), 0);
        store.commitScope(key, List.of(), 0);

        // When
        List<ScopeState> all = store.listScopesByTenant("t1");
        List<ScopeState> reservations = store.listScopesByTenant("t1", "reservation", 10);

        // Then
        assertEquals(List.of(reservation2, order, key), all.stream().map(ScopeState::scopeKey).toList());
        assertEquals(List.of(reservation2, key), reservations.stream().map(ScopeState::scopeKey).toList());
        assertTrue(store.listScopesByTenant("t3").isEmpty());
    }

    @Test
    void listScopesByTenant_limit_적용() {
        for (int i = 0; i < 5; i++) {
            store.commitScope(ScopeKey.of("t1", "reservation", "res_" + i), List.of(), 0);
        }

        List<ScopeState> page = store.listScopesByTenant("t1", null, 2);

        assertEquals(2, page.size());
        assertEquals("res_0", page.get(0).scopeId());
        assertEquals(5, store.listScopesByTenant("t1", null, Integer.MAX_VALUE).size());
    }

    @Test
    void listScopesByTenant_잘못된_인자는_IllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> store.listScopesByTenant(" "));
        assertThrows(IllegalArgumentException.class, () -> store.listScopesByTenant("t1", null, 0));
        assertThrows(IllegalArgumentException.class, () -> new InMemoryScopeStore(null));
    }

    @Test
    void clear_모든_Scope_제거() {
        store.commitScope(key, List.of("product_1"), 0);
        store.commitScope(ScopeKey.of("t1", "reservation", "res_2"), List.of("product_2"), 0);

        store.clear();

        assertEquals(0, store.size());
        assertTrue(store.getScope(key).isEmpty());
    }

    @Test
    void commitScope_잘못된_인자는_IllegalArgumentException() {
        assertThrows(IllegalArgumentException.class, () -> store.commitScope(null, List.of(), 0));
        assertThrows(IllegalArgumentException.class, () -> store.commitScope(key, null, 0));
        assertThrows(IllegalArgumentException.class, () -> store.commitScope(key, List.of(), -1));
        assertThrows(IllegalArgumentException.class, () -> store.getScope(null));
    }

    /**
     * instant() 호출마다 1초씩 진행하는 시계.
     */
    private static final class TickingClock extends Clock {

        private Instant next;

        private TickingClock(Instant start) {
            this.next = start;
        }

        @Override
        public synchronized Instant instant() {
            Instant current = next;
            next = next.plusSeconds(1);
            return current;
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }
    }
}
