package com.ryuqq.dcb.adapter.runner;

import com.ryuqq.dcb.application.engine.DcbEngine;
import com.ryuqq.dcb.core.contract.DcbExecution;
import com.ryuqq.dcb.core.decider.AggregatedState;
import com.ryuqq.dcb.core.decider.DeciderContext;
import com.ryuqq.dcb.core.decider.DeciderEvent;
import com.ryuqq.dcb.core.decider.DeciderFailed;
import com.ryuqq.dcb.core.decider.DeciderOutput;
import com.ryuqq.dcb.core.decider.DeciderRejected;
import com.ryuqq.dcb.core.decider.DeciderSuccess;
import com.ryuqq.dcb.core.decider.StateUpdates;
import com.ryuqq.dcb.core.event.EventData;
import com.ryuqq.dcb.core.event.EventIdGenerator;
import com.ryuqq.dcb.core.event.EventMetadata;
import com.ryuqq.dcb.core.result.ConflictStage;
import com.ryuqq.dcb.core.result.DcbConflict;
import com.ryuqq.dcb.core.result.DcbErrorCodes;
import com.ryuqq.dcb.core.result.DcbExecutionResult;
import com.ryuqq.dcb.core.result.DcbFailed;
import com.ryuqq.dcb.core.result.DcbRejected;
import com.ryuqq.dcb.core.result.DcbSuccess;
import com.ryuqq.dcb.core.scope.ScopeKey;
import com.ryuqq.dcb.core.scope.ScopeKeyValidationError;
import com.ryuqq.dcb.core.scope.ScopeKeys;
import com.ryuqq.dcb.core.spi.EntityUpdate;
import com.ryuqq.dcb.core.spi.ScopeCommitResult;
import com.ryuqq.dcb.core.spi.ScopeOperations;
import com.ryuqq.dcb.core.spi.ScopeState;
import com.ryuqq.dcb.core.spi.ScopeVersionCheck;
import com.ryuqq.dcb.core.statemachine.ExecutionPhase;
import com.ryuqq.dcb.core.statemachine.PhaseTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * DCB 실행 엔진 구현체.
 *
 * <p>한 번의 다중 엔티티 결정을 단계별로 조정합니다. 모든 단계 이동은
 * {@link PhaseTransition}으로 검증됩니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * execute(execution)
 *   ↓
 * VALIDATE      → Scope Key 형식 오류면 rejected
 *   ↓
 * OCC_PRE_CHECK → getScope() 버전 불일치면 conflict(PRE_CHECK)  (scopeOperations 있을 때만)
 *   ↓
 * LOAD          → 요청 순서대로 로딩, 하나라도 없으면 rejected(ENTITIES_NOT_FOUND)
 *   ↓
 * DECIDE        → decider.decide(aggregatedState, command, context)
 *   ├─ rejected → 그대로 반환 (이벤트/쓰기 없음)
 *   ├─ failed   → 실패 이벤트 태깅 후 반환 (쓰기 없음)
 *   └─ success
 *        ↓
 * APPLY         → 변경분을 삽입 순서대로 updateApplier에 전달
 *   ↓
 * OCC_COMMIT    → commitScope() 불일치면 conflict(COMMIT), 적용된 변경은 롤백하지 않음
 *   ↓
 * COMMITTED     → success(data, events, scopeVersion, updatedEntityIds)
 * </pre>
 *
 * <p><strong>동시성:</strong> 상태를 갖지 않으므로 여러 스레드에서 공유할 수 있습니다.
 * 충돌 시 재시도하지 않습니다 (호출자 책임, {@link ConflictRetryRunner} 참고).</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class DcbExecutionRunner implements DcbEngine {

    private static final Logger log = LoggerFactory.getLogger(DcbExecutionRunner.class);

    private final Clock clock;
    private final EventIdGenerator eventIdGenerator;

    /**
     * 생성자 (시스템 UTC 시계, UUID 이벤트 ID).
     */
    public DcbExecutionRunner() {
        this(Clock.systemUTC(), EventIdGenerator.uuid());
    }

    /**
     * 생성자 (커스텀 시계 및 이벤트 ID 생성기 주입).
     *
     * @param clock 결정 시각 시계
     * @param eventIdGenerator 이벤트 ID 생성기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DcbExecutionRunner(Clock clock, EventIdGenerator eventIdGenerator) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (eventIdGenerator == null) {
            throw new IllegalArgumentException("eventIdGenerator cannot be null");
        }
        this.clock = clock;
        this.eventIdGenerator = eventIdGenerator;
    }

    @Override
    public <S, C, D, U> DcbExecutionResult<D> execute(DcbExecution<S, C, D, U> execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        try {
            return run(execution);
        } catch (RuntimeException e) {
            log.error("DCB execution aborted: scopeKey={}, commandId={}",
                execution.scopeKey(), execution.commandId(), e);
            throw e;
        }
    }

    private <S, C, D, U> DcbExecutionResult<D> run(DcbExecution<S, C, D, U> execution) {
        ExecutionPhase phase = ExecutionPhase.VALIDATE;

        // 1. Scope Key 검증
        Optional<ScopeKeyValidationError> validationError = ScopeKeys.validate(execution.scopeKey());
        if (validationError.isPresent()) {
            PhaseTransition.transition(phase, ExecutionPhase.REJECTED);
            ScopeKeyValidationError error = validationError.get();
            log.info("DCB scope key rejected: scopeKey={}, code={}", execution.scopeKey(), error.code());
            return new DcbRejected<>(error.code().name(), error.message(), null);
        }
        ScopeKey scopeKey = ScopeKey.of(execution.scopeKey());
        long expectedVersion = execution.expectedVersion();

        log.debug("DCB execution starting: scopeKey={}, expectedVersion={}, entityCount={}, occ={}",
            scopeKey.getValue(), expectedVersion, execution.entityIds().size(), execution.scopeOperations() != null);

        // 2. OCC 사전 확인
        Optional<ScopeOperations> scopeOperations = execution.scopeOperationsIfPresent();
        if (scopeOperations.isPresent()) {
            phase = PhaseTransition.transition(phase, ExecutionPhase.OCC_PRE_CHECK);
            Optional<ScopeState> current = scopeOperations.get().getScope(scopeKey);
            if (current == null) {
                throw new IllegalStateException("ScopeOperations returned null scope for: " + scopeKey.getValue());
            }
            ScopeVersionCheck check = ScopeVersionCheck.evaluate(current, expectedVersion);
            if (!check.matches()) {
                PhaseTransition.transition(phase, ExecutionPhase.CONFLICT);
                log.info("DCB scope version mismatch: scopeKey={}, expectedVersion={}, currentVersion={}",
                    scopeKey.getValue(), expectedVersion, check.currentVersion());
                return new DcbConflict<>(check.currentVersion(), ConflictStage.PRE_CHECK);
            }
        }

        // 3. 엔티티 로딩 (전부 아니면 전무)
        phase = PhaseTransition.transition(phase, ExecutionPhase.LOAD);
        Map<String, S> snapshots = new LinkedHashMap<>();
        List<String> missingEntities = new ArrayList<>();
        for (String entityId : execution.entityIds()) {
            Optional<S> snapshot = execution.entityLoader().load(entityId);
            if (snapshot == null) {
                throw new IllegalStateException("EntityLoader returned null for entity: " + entityId);
            }
            if (snapshot.isPresent()) {
                snapshots.put(entityId, snapshot.get());
            } else {
                missingEntities.add(entityId);
            }
        }
        if (!missingEntities.isEmpty()) {
            PhaseTransition.transition(phase, ExecutionPhase.REJECTED);
            log.warn("DCB entities not found: scopeKey={}, missingEntities={}", scopeKey.getValue(), missingEntities);
            return new DcbRejected<>(
                DcbErrorCodes.ENTITIES_NOT_FOUND,
                "Entities not found: " + String.join(", ", missingEntities),
                Map.<String, Object>of("missingEntities", List.copyOf(missingEntities))
            );
        }

        // 4. Decider 호출
        phase = PhaseTransition.transition(phase, ExecutionPhase.DECIDE);
        AggregatedState<S> state = AggregatedState.of(scopeKey, expectedVersion, snapshots);
        Instant now = clock.instant();
        DeciderContext context = DeciderContext.of(now, execution.commandId(), execution.correlationId());
        DeciderOutput<D, StateUpdates<U>> output = execution.decider().decide(state, execution.command(), context);
        if (output == null) {
            throw new IllegalStateException("Decider returned null for scope: " + scopeKey.getValue());
        }

        ExecutionPhase decided = phase;
        return output.match(
            success -> applyAndCommit(execution, scopeKey, state, success, now, decided),
            rejected -> reject(scopeKey, rejected, decided),
            failed -> fail(execution, scopeKey, failed, decided)
        );
    }

    private <D, U> DcbExecutionResult<D> reject(
        ScopeKey scopeKey,
        DeciderRejected<D, StateUpdates<U>> rejected,
        ExecutionPhase phase
    ) {
        PhaseTransition.transition(phase, ExecutionPhase.REJECTED);
        log.info("DCB decider rejected: scopeKey={}, code={}, message={}",
            scopeKey.getValue(), rejected.code(), rejected.message());
        return new DcbRejected<>(rejected.code(), rejected.message(), rejected.context());
    }

    private <S, C, D, U> DcbExecutionResult<D> fail(
        DcbExecution<S, C, D, U> execution,
        ScopeKey scopeKey,
        DeciderFailed<D, StateUpdates<U>> failed,
        ExecutionPhase phase
    ) {
        PhaseTransition.transition(phase, ExecutionPhase.FAILED);
        EventData event = tag(execution, scopeKey, failed.event());
        log.info("DCB business failure: scopeKey={}, reason={}, eventType={}",
            scopeKey.getValue(), failed.reason(), event.eventType());
        return new DcbFailed<>(failed.reason(), List.of(event), failed.context());
    }

    private <S, C, D, U> DcbExecutionResult<D> applyAndCommit(
        DcbExecution<S, C, D, U> execution,
        ScopeKey scopeKey,
        AggregatedState<S> state,
        DeciderSuccess<D, StateUpdates<U>> success,
        Instant now,
        ExecutionPhase phase
    ) {
        StateUpdates<U> updates = success.stateUpdate();
        for (String entityId : updates.entityIds()) {
            if (!state.contains(entityId)) {
                throw new IllegalStateException("Unknown entityId in state update: " + entityId);
            }
        }

        // 5. 변경분 적용 (삽입 순서)
        ExecutionPhase current = PhaseTransition.transition(phase, ExecutionPhase.APPLY);
        long newVersion = execution.expectedVersion() + 1;
        List<String> updatedEntityIds = new ArrayList<>(updates.size());
        for (Map.Entry<String, U> entry : updates.asMap().entrySet()) {
            String entityId = entry.getKey();
            execution.updateApplier().apply(
                new EntityUpdate<>(entityId, state.get(entityId), entry.getValue(), newVersion, now)
            );
            updatedEntityIds.add(entityId);
            log.debug("DCB entity updated: entityId={}, scopeVersion={}", entityId, newVersion);
        }

        // 6. Scope 커밋
        long scopeVersion = newVersion;
        Optional<ScopeOperations> scopeOperations = execution.scopeOperationsIfPresent();
        if (scopeOperations.isPresent()) {
            current = PhaseTransition.transition(current, ExecutionPhase.OCC_COMMIT);
            ScopeCommitResult commit = scopeOperations.get()
                .commitScope(scopeKey, List.copyOf(updatedEntityIds), execution.expectedVersion());
            if (commit == null) {
                throw new IllegalStateException("ScopeOperations returned null commit result for scope: " + scopeKey.getValue());
            }
            if (commit instanceof ScopeCommitResult.Conflict conflict) {
                PhaseTransition.transition(current, ExecutionPhase.CONFLICT);
                log.warn("DCB scope commit conflict: scopeKey={}, expectedVersion={}, currentVersion={}, appliedEntities={}",
                    scopeKey.getValue(), execution.expectedVersion(), conflict.currentVersion(), updatedEntityIds);
                return new DcbConflict<>(conflict.currentVersion(), ConflictStage.COMMIT);
            }
            scopeVersion = ((ScopeCommitResult.Committed) commit).newVersion();
            log.debug("DCB scope committed: scopeKey={}, newVersion={}", scopeKey.getValue(), scopeVersion);
        }
        PhaseTransition.transition(current, ExecutionPhase.COMMITTED);

        List<EventData> events = new ArrayList<>(success.events().size());
        for (DeciderEvent event : success.events()) {
            events.add(tag(execution, scopeKey, event));
        }

        log.info("DCB execution succeeded: scopeKey={}, scopeVersion={}, eventCount={}, updatedEntityCount={}",
            scopeKey.getValue(), scopeVersion, events.size(), updatedEntityIds.size());
        return new DcbSuccess<>(success.data(), events, scopeVersion, updatedEntityIds);
    }

    private EventData tag(DcbExecution<?, ?, ?, ?> execution, ScopeKey scopeKey, DeciderEvent event) {
        return new EventData(
            eventIdGenerator.generate(execution.boundedContext()),
            event.eventType(),
            execution.streamType(),
            scopeKey.getScopeId(),
            execution.boundedContext(),
            execution.schemaVersion(),
            execution.eventCategory(),
            event.payload(),
            new EventMetadata(execution.correlationId(), execution.commandId())
        );
    }
}
