package com.ryuqq.dcb.testkit.contract;

import com.ryuqq.dcb.core.scope.ScopeKey;
import com.ryuqq.dcb.core.spi.ScopeCommitResult;
import com.ryuqq.dcb.core.spi.ScopeOperations;
import com.ryuqq.dcb.core.spi.ScopeState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Abstract base class for {@link ScopeOperations} Contract Tests.
 *
 * <p>Any scope store implementation can be verified by extending this class and providing a
 * fresh instance from {@link #createScopeOperations()}.</p>
 *
 * <p><strong>Contract:</strong></p>
 * <ul>
 *   <li>An absent scope reads as empty and commits as version 0</li>
 *   <li>Each successful commit increments the version by exactly 1</li>
 *   <li>A commit with a stale expected version conflicts and changes nothing</li>
 *   <li>Committed entity ids are merged into the scope</li>
 *   <li>Of several concurrent commits with the same expected version, exactly one succeeds</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class JdbcScopeStoreContractTest extends AbstractScopeOperationsContractTest {
 *     {@literal @}Override
 *     protected ScopeOperations createScopeOperations() {
 *         return new JdbcScopeStore(dataSource);
 *     }
 * }
 * </pre>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public abstract class AbstractScopeOperationsContractTest {

    protected ScopeOperations scopeOperations;

    /**
     * Creates a fresh, empty implementation under test.
     *
     * @return the scope store
     */
    protected abstract ScopeOperations createScopeOperations();

    @BeforeEach
    void setUpScopeOperations() {
        scopeOperations = createScopeOperations();
    }

    protected ScopeKey scopeKey(String scopeId) {
        return ScopeKey.of("t1", "reservation", scopeId);
    }

    @Test
    void getScope_존재하지_않는_Scope는_empty() {
        // when
        Optional<ScopeState> scope = scopeOperations.getScope(scopeKey("absent"));

        // then
        assertTrue(scope.isEmpty(), "Absent scope should read as empty");
    }

    @Test
    void commitScope_새_Scope를_expectedVersion_0으로_커밋하면_버전_1() {
        // given
        ScopeKey key = scopeKey("res_1");

        // when
        ScopeCommitResult result = scopeOperations.commitScope(key, List.of("product_1", "product_2"), 0);

        // then
        assertEquals(ScopeCommitResult.committed(1), result);
        ScopeState state = scopeOperations.getScope(key).orElseThrow();
        assertEquals(1, state.currentVersion());
        assertEquals("t1", state.tenantId());
        assertEquals("reservation", state.scopeType());
        assertEquals("res_1", state.scopeId());
        assertEquals(List.of("product_1", "product_2"), state.entityIds());
    }

    @Test
    void commitScope_존재하지_않는_Scope에_양수_expectedVersion이면_conflict_0() {
        // given
        ScopeKey key = scopeKey("res_2");

        // when
        ScopeCommitResult result = scopeOperations.commitScope(key, List.of("product_1"), 3);

        // then
        assertEquals(ScopeCommitResult.conflict(0), result);
        assertTrue(scopeOperations.getScope(key).isEmpty(), "Conflicting commit must not create the scope");
    }

    @Test
    void commitScope_연속_커밋은_버전을_1씩_증가() {
        // given
        ScopeKey key = scopeKey("res_3");

        // when
        ScopeCommitResult first = scopeOperations.commitScope(key, List.of("a"), 0);
        ScopeCommitResult second = scopeOperations.commitScope(key, List.of("a"), 1);
        ScopeCommitResult third = scopeOperations.commitScope(key, List.of("a"), 2);

        // then
        assertEquals(ScopeCommitResult.committed(1), first);
        assertEquals(ScopeCommitResult.committed(2), second);
        assertEquals(ScopeCommitResult.committed(3), third);
        assertEquals(3, scopeOperations.getScope(key).orElseThrow().currentVersion());
    }

    @Test
    void commitScope_오래된_expectedVersion은_conflict_및_상태_불변() {
        // given
        ScopeKey key = scopeKey("res_4");
        scopeOperations.commitScope(key, List.of("a"), 0);
        scopeOperations.commitScope(key, List.of("a"), 1);

        // when: 이전 기준 버전 재사용
        ScopeCommitResult result = scopeOperations.commitScope(key, List.of("b"), 1);

        // then
        assertEquals(ScopeCommitResult.conflict(2), result);
        ScopeState state = scopeOperations.getScope(key).orElseThrow();
        assertEquals(2, state.currentVersion());
        assertFalse(state.entityIds().contains("b"), "Conflicting commit must not track entity ids");
    }

    @Test
    void commitScope_엔티티_ID는_누적_병합() {
        // given
        ScopeKey key = scopeKey("res_5");

        // when
        scopeOperations.commitScope(key, List.of("product_1", "product_2"), 0);
        scopeOperations.commitScope(key, List.of("product_2", "product_3"), 1);

        // then
        List<String> entityIds = scopeOperations.getScope(key).orElseThrow().entityIds();
        assertEquals(3, entityIds.size());
        assertTrue(entityIds.containsAll(List.of("product_1", "product_2", "product_3")));
    }

    @Test
    void commitScope_서로_다른_Scope는_독립적() {
        // given
        ScopeKey first = scopeKey("res_6");
        ScopeKey second = ScopeKey.of("t2", "reservation", "res_6");

        // when
        scopeOperations.commitScope(first, List.of("a"), 0);
        scopeOperations.commitScope(first, List.of("a"), 1);
        ScopeCommitResult result = scopeOperations.commitScope(second, List.of("a"), 0);

        // then
        assertEquals(ScopeCommitResult.committed(1), result);
        assertEquals(2, scopeOperations.getScope(first).orElseThrow().currentVersion());
    }

    @Test
    void commitScope_동시_커밋은_하나만_성공() throws Exception {
        // given
        ScopeKey key = scopeKey("res_race");
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ScopeCommitResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                String entityId = "product_" + i;
                futures.add(executor.submit(() -> {
                    start.await();
                    return scopeOperations.commitScope(key, List.of(entityId), 0);
                }));
            }

            // when
            start.countDown();
            int committed = 0;
            int conflicts = 0;
            for (Future<ScopeCommitResult> future : futures) {
                ScopeCommitResult result = future.get(5, TimeUnit.SECONDS);
                if (result.isCommitted()) {
                    committed++;
                } else {
                    assertEquals(ScopeCommitResult.conflict(1), result);
                    conflicts++;
                }
            }

            // then
            assertEquals(1, committed, "Exactly one concurrent commit should succeed");
            assertEquals(threads - 1, conflicts);
            assertEquals(1, scopeOperations.getScope(key).orElseThrow().currentVersion());
        } finally {
            executor.shutdownNow();
        }
    }
}
