package com.ryuqq.dcb.application.engine;

import com.ryuqq.dcb.core.contract.DcbExecution;
import com.ryuqq.dcb.core.result.DcbExecutionResult;

/**
 * DCB 실행 엔진.
 *
 * <p>Scope Key 검증, OCC 사전 확인, 엔티티 로딩, Decider 호출, 변경 적용, Scope 커밋을
 * 한 번의 호출로 조정합니다. 충돌 시 재시도하지 않으며, 모든 도메인 결과를 그대로 반환합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DcbExecutionResult&lt;Reservation&gt; result = engine.execute(execution);
 *
 * result.match(
 *     success -&gt; eventStore.append(success.events()),
 *     rejected -&gt; respond(400, rejected.code()),
 *     failed -&gt; eventStore.append(failed.events()),
 *     conflict -&gt; retryWith(conflict.currentVersion())
 * );
 * </pre>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public interface DcbEngine {

    /**
     * 다중 엔티티 결정 실행.
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>Scope Key 형식 검증 (실패 시 rejected)</li>
     *   <li>scopeOperations가 있으면 Scope 버전 사전 확인 (불일치 시 PRE_CHECK conflict)</li>
     *   <li>모든 엔티티를 요청 순서대로 로딩 (누락 시 ENTITIES_NOT_FOUND rejected)</li>
     *   <li>집계 상태로 Decider 호출</li>
     *   <li>rejected/failed는 쓰기 없이 반환</li>
     *   <li>success면 변경분을 삽입 순서대로 적용 후 Scope 커밋 (불일치 시 COMMIT conflict)</li>
     * </ol>
     *
     * @param execution 실행 요청
     * @param <S> 엔티티 스냅샷 타입
     * @param <C> 명령 타입
     * @param <D> 성공 데이터 타입
     * @param <U> 엔티티 변경분 타입
     * @return 실행 결과
     * @throws IllegalArgumentException execution이 null인 경우
     * @throws IllegalStateException Decider가 로딩되지 않은 엔티티의 변경분을 반환한 경우
     */
    <S, C, D, U> DcbExecutionResult<D> execute(DcbExecution<S, C, D, U> execution);
}
