package com.ryuqq.dcb.core.decider;

/**
 * 다중 엔티티(DCB) Decider.
 *
 * <p>Scope 내 모든 엔티티의 집계 상태를 받아 엔티티 간 불변식을 검증합니다.
 * 성공 시 변경할 엔티티만 {@link StateUpdates}에 담습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * DcbDecider&lt;Stock, Reserve, Reservation, StockChange&gt; reserve = (state, command, context) -&gt; {
 *     StateUpdates.Builder&lt;StockChange&gt; updates = StateUpdates.builder();
 *     for (String productId : command.productIds()) {
 *         Stock stock = state.get(productId);
 *         if (stock.available() &lt; command.quantity()) {
 *             return DeciderOutput.rejected("INSUFFICIENT_STOCK", "Not enough stock");
 *         }
 *         updates.put(productId, StockChange.reserve(command.quantity()));
 *     }
 *     return DeciderOutput.success(reservation, DeciderEvent.of("ItemsReserved", payload), updates.build());
 * };
 * </pre>
 *
 * @param <S> 엔티티 스냅샷 타입
 * @param <C> 명령 타입
 * @param <D> 성공 데이터 타입
 * @param <U> 엔티티별 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface DcbDecider<S, C, D, U> {

    /**
     * 결정 수행.
     *
     * @param state 집계 상태
     * @param command 명령
     * @param context 호출 컨텍스트
     * @return 결정 결과
     */
    DeciderOutput<D, StateUpdates<U>> decide(AggregatedState<S> state, C command, DeciderContext context);

    /**
     * 단일 엔티티 {@link Decider}를 DCB Decider로 변환.
     *
     * <p>지정한 엔티티의 스냅샷만 전달하고, 성공 시 변경분을 해당 엔티티 하나의
     * {@link StateUpdates}로 감쌉니다. 거절/실패는 그대로 전달합니다.</p>
     *
     * @param entityId 결정 대상 엔티티 ID (집계 상태에 있어야 함)
     * @param decider 단일 엔티티 Decider
     * @param <S> 엔티티 스냅샷 타입
     * @param <C> 명령 타입
     * @param <D> 성공 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DCB Decider
     * @throws IllegalArgumentException entityId가 비어 있거나 decider가 null인 경우
     */
    static <S, C, D, U> DcbDecider<S, C, D, U> forEntity(String entityId, Decider<S, C, D, U> decider) {
        if (entityId == null || entityId.isBlank()) {
            throw new IllegalArgumentException("entityId cannot be null or blank");
        }
        if (decider == null) {
            throw new IllegalArgumentException("decider cannot be null");
        }
        return (state, command, context) -> {
            DeciderOutput<D, U> output = decider.decide(state.get(entityId), command, context);
            if (output == null) {
                throw new IllegalStateException("Decider returned null for entity: " + entityId);
            }
            return output.<DeciderOutput<D, StateUpdates<U>>>match(
                success -> DeciderOutput.success(
                    success.data(), success.events(), StateUpdates.of(entityId, success.stateUpdate())
                ),
                rejected -> DeciderOutput.rejected(rejected.code(), rejected.message(), rejected.context()),
                failed -> DeciderOutput.failed(failed.reason(), failed.event(), failed.context())
            );
        };
    }
}
