package com.ryuqq.dcb.core.decider;

/**
 * 단일 엔티티 Decider.
 *
 * <p>현재 상태와 명령을 받아 결정 결과를 반환하는 순수 함수입니다.
 * 부수 효과, I/O 없이 동일 입력에 대해 항상 동일한 결과를 반환해야 합니다.</p>
 *
 * @param <S> 상태 타입
 * @param <C> 명령 타입
 * @param <D> 성공 데이터 타입
 * @param <U> 상태 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Decider<S, C, D, U> {

    /**
     * 결정 수행.
     *
     * @param state 현재 상태
     * @param command 명령
     * @param context 호출 컨텍스트
     * @return 결정 결과
     */
    DeciderOutput<D, U> decide(S state, C command, DeciderContext context);
}
