package com.ryuqq.dcb.core.decider;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Decider 결정 결과.
 *
 * <p>DeciderOutput은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link DeciderSuccess}: 상태 변경 수락 (이벤트 + 상태 변경분)</li>
 *   <li>{@link DeciderRejected}: 조용한 거절 (이벤트 없음, 상태 변경 없음)</li>
 *   <li>{@link DeciderFailed}: 기록되는 거절 (요청은 거부하지만 실패 이벤트 발행)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 있으며, 소비 측은 {@link #match}로 모든 케이스를 처리합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * if (available &lt; requested) {
 *     return DeciderOutput.rejected("INSUFFICIENT_STOCK", "Not enough stock");
 * }
 * return DeciderOutput.success(
 *     data,
 *     DeciderEvent.of("ItemsReserved", Map.of("orderId", orderId)),
 *     updates
 * );
 * </pre>
 *
 * @param <D> 성공 시 호출자에게 반환할 데이터 타입
 * @param <U> 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public sealed interface DeciderOutput<D, U> permits DeciderSuccess, DeciderRejected, DeciderFailed {

    /**
     * 단일 이벤트 성공 결과 생성.
     *
     * @param data 호출자 반환 데이터
     * @param event 발행할 이벤트
     * @param stateUpdate 상태 변경분
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderSuccess 인스턴스
     */
    static <D, U> DeciderOutput<D, U> success(D data, DeciderEvent event, U stateUpdate) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        return new DeciderSuccess<>(data, List.of(event), stateUpdate);
    }

    /**
     * 다중 이벤트 성공 결과 생성.
     *
     * @param data 호출자 반환 데이터
     * @param events 발행할 이벤트 목록 (1개 이상)
     * @param stateUpdate 상태 변경분
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderSuccess 인스턴스
     */
    static <D, U> DeciderOutput<D, U> success(D data, List<DeciderEvent> events, U stateUpdate) {
        return new DeciderSuccess<>(data, events, stateUpdate);
    }

    /**
     * 거절 결과 생성 (이벤트 없음).
     *
     * @param code 오류 코드 (예: INSUFFICIENT_STOCK)
     * @param message 오류 메시지
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderRejected 인스턴스
     */
    static <D, U> DeciderOutput<D, U> rejected(String code, String message) {
        return new DeciderRejected<>(code, message, null);
    }

    /**
     * 컨텍스트를 포함한 거절 결과 생성.
     *
     * @param code 오류 코드
     * @param message 오류 메시지
     * @param context 오류 상세 정보 (null 가능)
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderRejected 인스턴스
     */
    static <D, U> DeciderOutput<D, U> rejected(String code, String message, Map<String, Object> context) {
        return new DeciderRejected<>(code, message, context);
    }

    /**
     * 실패 결과 생성 (실패 이벤트 발행).
     *
     * @param reason 실패 사유
     * @param event 실패 이벤트 (예: ReservationFailed)
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderFailed 인스턴스
     */
    static <D, U> DeciderOutput<D, U> failed(String reason, DeciderEvent event) {
        return new DeciderFailed<>(reason, event, null);
    }

    /**
     * 컨텍스트를 포함한 실패 결과 생성.
     *
     * @param reason 실패 사유
     * @param event 실패 이벤트
     * @param context 실패 상세 정보 (null 가능)
     * @param <D> 데이터 타입
     * @param <U> 상태 변경분 타입
     * @return DeciderFailed 인스턴스
     */
    static <D, U> DeciderOutput<D, U> failed(String reason, DeciderEvent event, Map<String, Object> context) {
        return new DeciderFailed<>(reason, event, context);
    }

    /**
     * 결과 유형별 분기 (모든 케이스 처리 강제).
     *
     * @param onSuccess 성공 처리
     * @param onRejected 거절 처리
     * @param onFailed 실패 처리
     * @param <R> 반환 타입
     * @return 선택된 함수의 반환값
     */
    <R> R match(
        Function<DeciderSuccess<D, U>, R> onSuccess,
        Function<DeciderRejected<D, U>, R> onRejected,
        Function<DeciderFailed<D, U>, R> onFailed
    );

    default boolean isSuccess() {
        return this instanceof DeciderSuccess;
    }

    default boolean isRejected() {
        return this instanceof DeciderRejected;
    }

    default boolean isFailed() {
        return this instanceof DeciderFailed;
    }
}
