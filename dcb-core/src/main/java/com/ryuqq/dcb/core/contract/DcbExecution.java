package com.ryuqq.dcb.core.contract;

import com.ryuqq.dcb.core.decider.DcbDecider;
import com.ryuqq.dcb.core.event.EventCategory;
import com.ryuqq.dcb.core.event.EventSchemaVersions;
import com.ryuqq.dcb.core.spi.EntityLoader;
import com.ryuqq.dcb.core.spi.ScopeOperations;
import com.ryuqq.dcb.core.spi.UpdateApplier;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * DCB 실행 요청.
 *
 * <p>한 번의 다중 엔티티 결정에 필요한 모든 입력과 협력 객체를 담습니다.
 * 생성 시점에 호출자 배선 오류(필수 값 누락, 음수 버전, 중복 엔티티 ID 등)를 검증하며,
 * Scope Key 형식은 검증하지 않습니다. 형식 오류는 실행 결과로 반환됩니다.</p>
 *
 * <p><strong>필드 구성:</strong></p>
 * <ul>
 *   <li><strong>scopeKey:</strong> 원본 Scope Key 문자열 ({@code tenant:{t}:{type}:{id}})</li>
 *   <li><strong>expectedVersion:</strong> OCC 기준 버전 (0 = Scope가 아직 존재하지 않음)</li>
 *   <li><strong>scopeOperations:</strong> null이면 OCC 없이 실행</li>
 *   <li><strong>entityIds:</strong> 로딩할 엔티티 ID (요청 순서대로 로딩)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DcbExecution&lt;Stock, Reserve, Reservation, StockChange&gt; execution = DcbExecution
 *     .&lt;Stock, Reserve, Reservation, StockChange&gt;builder()
 *     .scopeKey(ScopeKeys.create("t1", "reservation", "res_123"))
 *     .expectedVersion(0)
 *     .boundedContext("inventory")
 *     .streamType("Reservation")
 *     .scopeOperations(scopeStore)
 *     .entityIds(List.of("product_1", "product_2"))
 *     .entityLoader(stockRepository::find)
 *     .decider(reserveDecider)
 *     .command(command)
 *     .updateApplier(stockRepository::apply)
 *     .commandId("cmd_1")
 *     .correlationId("corr_1")
 *     .build();
 * </pre>
 *
 * @param scopeKey Scope Key 문자열
 * @param expectedVersion OCC 기준 버전
 * @param boundedContext Bounded Context 이름
 * @param streamType 이벤트 스트림 유형
 * @param schemaVersion 이벤트 스키마 버전 (1 이상)
 * @param eventCategory 이벤트 카테고리
 * @param scopeOperations Scope 버전 저장소 (null 가능)
 * @param entityIds 엔티티 ID 목록
 * @param entityLoader 엔티티 로더
 * @param decider DCB Decider
 * @param command 명령
 * @param updateApplier 변경 적용기
 * @param commandId 명령 ID
 * @param correlationId 상관관계 ID
 * @param <S> 엔티티 스냅샷 타입
 * @param <C> 명령 타입
 * @param <D> 성공 데이터 타입
 * @param <U> 엔티티 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public record DcbExecution<S, C, D, U>(
    String scopeKey,
    long expectedVersion,
    String boundedContext,
    String streamType,
    int schemaVersion,
    EventCategory eventCategory,
    ScopeOperations scopeOperations,
    List<String> entityIds,
    EntityLoader<S> entityLoader,
    DcbDecider<S, C, D, U> decider,
    C command,
    UpdateApplier<S, U> updateApplier,
    String commandId,
    String correlationId
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 호출자 배선 오류인 경우
     */
    public DcbExecution {
        if (expectedVersion < 0) {
            throw new IllegalArgumentException("expectedVersion must be non-negative (current: " + expectedVersion + ")");
        }
        requireText(boundedContext, "boundedContext");
        requireText(streamType, "streamType");
        if (schemaVersion <= 0) {
            throw new IllegalArgumentException("schemaVersion must be positive (current: " + schemaVersion + ")");
        }
        if (eventCategory == null) {
            throw new IllegalArgumentException("eventCategory cannot be null");
        }
        if (entityIds == null || entityIds.isEmpty()) {
            throw new IllegalArgumentException("entityIds cannot be null or empty");
        }
        Set<String> seen = new HashSet<>();
        for (String entityId : entityIds) {
            requireText(entityId, "entityId");
            if (!seen.add(entityId)) {
                throw new IllegalArgumentException("Duplicate entityId: " + entityId);
            }
        }
        if (entityLoader == null) {
            throw new IllegalArgumentException("entityLoader cannot be null");
        }
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (updateApplier == null) {
            throw new IllegalArgumentException("updateApplier cannot be null");
        }
        requireText(commandId, "commandId");
        requireText(correlationId, "correlationId");
        entityIds = List.copyOf(entityIds);
        // scopeKey는 형식 검증하지 않음 (실행 결과로 거절)
        // scopeOperations는 null 허용 (OCC 미사용)
    }

    /**
     * Scope 버전 저장소 조회.
     *
     * @return scopeOperations (없으면 empty)
     */
    public Optional<ScopeOperations> scopeOperationsIfPresent() {
        return Optional.ofNullable(scopeOperations);
    }

    /**
     * 같은 요청을 다른 기준 버전으로 복제 (재시도용).
     *
     * @param newExpectedVersion 새 기준 버전
     * @return 복제된 실행 요청
     */
    public DcbExecution<S, C, D, U> withExpectedVersion(long newExpectedVersion) {
        return new DcbExecution<>(
            scopeKey, newExpectedVersion, boundedContext, streamType, schemaVersion, eventCategory,
            scopeOperations, entityIds, entityLoader, decider, command, updateApplier,
            commandId, correlationId
        );
    }

    public static <S, C, D, U> Builder<S, C, D, U> builder() {
        return new Builder<>();
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }

    /**
     * DcbExecution 빌더.
     *
     * <p>schemaVersion 기본값 1, eventCategory 기본값 DOMAIN.</p>
     */
    public static final class Builder<S, C, D, U> {

        private String scopeKey;
        private long expectedVersion;
        private String boundedContext;
        private String streamType;
        private int schemaVersion = EventSchemaVersions.DEFAULT;
        private EventCategory eventCategory = EventCategory.DEFAULT;
        private ScopeOperations scopeOperations;
        private List<String> entityIds;
        private EntityLoader<S> entityLoader;
        private DcbDecider<S, C, D, U> decider;
        private C command;
        private UpdateApplier<S, U> updateApplier;
        private String commandId;
        private String correlationId;

        private Builder() {
        }

        public Builder<S, C, D, U> scopeKey(String scopeKey) {
            this.scopeKey = scopeKey;
            return this;
        }

        public Builder<S, C, D, U> expectedVersion(long expectedVersion) {
            this.expectedVersion = expectedVersion;
            return this;
        }

        public Builder<S, C, D, U> boundedContext(String boundedContext) {
            this.boundedContext = boundedContext;
            return this;
        }

        public Builder<S, C, D, U> streamType(String streamType) {
            this.streamType = streamType;
            return this;
        }

        public Builder<S, C, D, U> schemaVersion(int schemaVersion) {
            this.schemaVersion = schemaVersion;
            return this;
        }

        public Builder<S, C, D, U> eventCategory(EventCategory eventCategory) {
            this.eventCategory = eventCategory;
            return this;
        }

        public Builder<S, C, D, U> scopeOperations(ScopeOperations scopeOperations) {
            this.scopeOperations = scopeOperations;
            return this;
        }

        public Builder<S, C, D, U> entityIds(List<String> entityIds) {
            this.entityIds = entityIds;
            return this;
        }

        public Builder<S, C, D, U> entityLoader(EntityLoader<S> entityLoader) {
            this.entityLoader = entityLoader;
            return this;
        }

        public Builder<S, C, D, U> decider(DcbDecider<S, C, D, U> decider) {
            this.decider = decider;
            return this;
        }

        public Builder<S, C, D, U> command(C command) {
            this.command = command;
            return this;
        }

        public Builder<S, C, D, U> updateApplier(UpdateApplier<S, U> updateApplier) {
            this.updateApplier = updateApplier;
            return this;
        }

        public Builder<S, C, D, U> commandId(String commandId) {
            this.commandId = commandId;
            return this;
        }

        public Builder<S, C, D, U> correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        /**
         * 실행 요청 생성.
         *
         * @return DcbExecution
         * @throws IllegalArgumentException 호출자 배선 오류인 경우
         */
        public DcbExecution<S, C, D, U> build() {
            return new DcbExecution<>(
                scopeKey, expectedVersion, boundedContext, streamType, schemaVersion, eventCategory,
                scopeOperations, entityIds, entityLoader, decider, command, updateApplier,
                commandId, correlationId
            );
        }
    }
}
