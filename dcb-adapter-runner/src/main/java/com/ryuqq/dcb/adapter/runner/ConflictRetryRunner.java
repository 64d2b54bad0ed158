package com.ryuqq.dcb.adapter.runner;

import com.ryuqq.dcb.application.engine.DcbEngine;
import com.ryuqq.dcb.core.contract.DcbExecution;
import com.ryuqq.dcb.core.result.DcbConflict;
import com.ryuqq.dcb.core.result.DcbErrorCodes;
import com.ryuqq.dcb.core.result.DcbExecutionResult;
import com.ryuqq.dcb.core.result.DcbRejected;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.LongFunction;

/**
 * OCC 충돌 시 호출자 수준 재시도 헬퍼 (opt-in).
 *
 * <p>실행 엔진 자체는 재시도하지 않습니다. 이 헬퍼는 conflict 결과를 받으면
 * 백오프 후 충돌 시점의 currentVersion을 새 기준 버전으로 삼아 다시 실행합니다.
 * conflict 이외의 결과는 그대로 반환합니다.</p>
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * attempt = 0, expectedVersion = initial
 * loop:
 *   result = engine.execute(attemptFactory.apply(expectedVersion))
 *   success / rejected / failed → 반환
 *   conflict:
 *     attempt + 1 &gt;= maxAttempts → rejected(DCB_MAX_RETRIES_EXCEEDED)
 *     sleep(backoff.calculate(attempt))
 *     expectedVersion = conflict.currentVersion, attempt++
 * </pre>
 *
 * <p><strong>주의:</strong> COMMIT 단계 충돌은 엔티티 변경이 이미 적용된 상태입니다.
 * 트랜잭션 경계 없이 이 헬퍼를 사용할 경우 attemptFactory가 시도마다 새
 * {@code StagedUpdateApplier}를 생성해야 합니다.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public final class ConflictRetryRunner {

    private static final Logger log = LoggerFactory.getLogger(ConflictRetryRunner.class);

    private final DcbEngine engine;
    private final RetryConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Sleeper sleeper;

    /**
     * 생성자 (기본 RetryConfig).
     *
     * @param engine 실행 엔진
     */
    public ConflictRetryRunner(DcbEngine engine) {
        this(engine, new RetryConfig());
    }

    /**
     * 생성자 (기본 jitter, Thread.sleep 대기).
     *
     * @param engine 실행 엔진
     * @param config 재시도 설정
     */
    public ConflictRetryRunner(DcbEngine engine, RetryConfig config) {
        this(engine, config, config == null ? null : new BackoffCalculator(config), Sleeper.threadSleep());
    }

    /**
     * 생성자 (모든 의존성 주입).
     *
     * @param engine 실행 엔진
     * @param config 재시도 설정
     * @param backoffCalculator 백오프 계산기
     * @param sleeper 대기 구현
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public ConflictRetryRunner(DcbEngine engine, RetryConfig config, BackoffCalculator backoffCalculator, Sleeper sleeper) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.engine = engine;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.sleeper = sleeper;
    }

    /**
     * 같은 요청을 기준 버전만 바꿔 재시도.
     *
     * @param execution 최초 실행 요청
     * @return 최종 실행 결과
     */
    public <S, C, D, U> DcbExecutionResult<D> execute(DcbExecution<S, C, D, U> execution) {
        if (execution == null) {
            throw new IllegalArgumentException("execution cannot be null");
        }
        return execute(execution.scopeKey(), execution.expectedVersion(), execution::withExpectedVersion);
    }

    /**
     * 시도마다 새 실행 요청을 생성하며 재시도.
     *
     * @param scopeKey Scope Key (소진 시 context에 기록)
     * @param initialExpectedVersion 최초 기준 버전
     * @param attemptFactory 기준 버전 → 실행 요청
     * @return 최종 실행 결과
     * @throws IllegalArgumentException attemptFactory가 null인 경우
     */
    public <S, C, D, U> DcbExecutionResult<D> execute(
        String scopeKey,
        long initialExpectedVersion,
        LongFunction<DcbExecution<S, C, D, U>> attemptFactory
    ) {
        if (attemptFactory == null) {
            throw new IllegalArgumentException("attemptFactory cannot be null");
        }

        long expectedVersion = initialExpectedVersion;
        for (int attempt = 0; ; attempt++) {
            DcbExecutionResult<D> result = engine.execute(attemptFactory.apply(expectedVersion));
            if (!(result instanceof DcbConflict<D> conflict)) {
                return result;
            }

            if (attempt + 1 >= config.maxAttempts()) {
                log.warn("DCB retries exhausted: scopeKey={}, attempts={}, lastConflictVersion={}",
                    scopeKey, attempt + 1, conflict.currentVersion());
                return new DcbRejected<>(
                    DcbErrorCodes.DCB_MAX_RETRIES_EXCEEDED,
                    "DCB operation failed after " + config.maxAttempts()
                        + " total attempts (including initial) due to OCC conflicts",
                    Map.<String, Object>of(
                        "scopeKey", String.valueOf(scopeKey),
                        "lastAttempt", attempt,
                        "lastConflictVersion", conflict.currentVersion()
                    )
                );
            }

            long delayMs = backoffCalculator.calculate(attempt);
            log.info("DCB conflict, retrying: scopeKey={}, attempt={}, stage={}, currentVersion={}, backoffMs={}",
                scopeKey, attempt + 1, conflict.stage(), conflict.currentVersion(), delayMs);
            sleeper.sleep(delayMs);
            expectedVersion = conflict.currentVersion();
        }
    }

    public RetryConfig getConfig() {
        return config;
    }
}
