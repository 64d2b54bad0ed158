package com.ryuqq.dcb.application.unitofwork;

import com.ryuqq.dcb.core.result.DcbExecutionResult;
import com.ryuqq.dcb.core.spi.EntityUpdate;
import com.ryuqq.dcb.core.spi.UpdateApplier;

import java.util.ArrayList;
import java.util.List;

/**
 * 변경분을 버퍼링했다가 커밋 성공 후에만 전달하는 UpdateApplier.
 *
 * <p>트랜잭션 저장소가 없는 호스트에서 COMMIT 단계 충돌 시 엔티티 변경이 남지 않도록
 * 실행 엔진의 적용 단계와 실제 쓰기를 분리합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * StagedUpdateApplier&lt;Stock, StockChange&gt; staged = StagedUpdateApplier.wrap(stockRepository::apply);
 * DcbExecutionResult&lt;Reservation&gt; result = engine.execute(
 *     executionBuilder.updateApplier(staged).build()
 * );
 * staged.completeWith(result);  // success면 flush, 그 외 discard
 * </pre>
 *
 * <p>실행 한 건당 하나의 인스턴스를 사용합니다 (스레드 안전하지 않음).</p>
 *
 * @param <S> 엔티티 스냅샷 타입
 * @param <U> 엔티티 변경분 타입
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class StagedUpdateApplier<S, U> implements UpdateApplier<S, U> {

    private final UpdateApplier<S, U> delegate;
    private final List<EntityUpdate<S, U>> staged = new ArrayList<>();

    /**
     * 생성자.
     *
     * @param delegate 실제 쓰기를 수행할 UpdateApplier
     * @throws IllegalArgumentException delegate가 null인 경우
     */
    public StagedUpdateApplier(UpdateApplier<S, U> delegate) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.delegate = delegate;
    }

    public static <S, U> StagedUpdateApplier<S, U> wrap(UpdateApplier<S, U> delegate) {
        return new StagedUpdateApplier<>(delegate);
    }

    /**
     * 변경분을 버퍼에 추가 (delegate 호출 없음).
     *
     * @param update 엔티티 변경분
     */
    @Override
    public void apply(EntityUpdate<S, U> update) {
        if (update == null) {
            throw new IllegalArgumentException("update cannot be null");
        }
        staged.add(update);
    }

    /**
     * 버퍼링된 변경분을 순서대로 delegate에 전달.
     *
     * <p>delegate가 예외를 던지면 전파하며, 아직 전달되지 않은 변경분은 버퍼에 남습니다.</p>
     *
     * @return 전달된 변경분 수
     */
    public int flush() {
        int flushed = 0;
        while (!staged.isEmpty()) {
            delegate.apply(staged.get(0));
            staged.remove(0);
            flushed++;
        }
        return flushed;
    }

    /**
     * 버퍼링된 변경분 폐기.
     *
     * @return 폐기된 변경분 수
     */
    public int discard() {
        int discarded = staged.size();
        staged.clear();
        return discarded;
    }

    /**
     * 실행 결과에 따라 flush 또는 discard.
     *
     * @param result 실행 결과
     * @return success면 true (flush 수행)
     * @throws IllegalArgumentException result가 null인 경우
     */
    public boolean completeWith(DcbExecutionResult<?> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
        if (result.isSuccess()) {
            flush();
            return true;
        }
        discard();
        return false;
    }

    /**
     * 아직 전달되지 않은 변경분 (읽기 전용 사본).
     *
     * @return 버퍼링된 변경분
     */
    public List<EntityUpdate<S, U>> pending() {
        return List.copyOf(staged);
    }
}
