package com.ryuqq.dcb.adapter.runner;

/**
 * ConflictRetryRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxAttempts: 최초 실행을 포함한 총 실행 횟수 (기본 5)</li>
 *   <li>initialBackoffMs: 첫 재시도 전 대기 시간 (기본 100ms)</li>
 *   <li>backoffBase: 지수 증가 밑 (기본 2)</li>
 *   <li>maxBackoffMs: 최대 대기 시간 (기본 30000ms)</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 * @param maxAttempts 총 실행 횟수 (1 이상)
 * @param initialBackoffMs 초기 대기 시간 (밀리초, 양수)
 * @param backoffBase 지수 밑 (양수)
 * @param maxBackoffMs 최대 대기 시간 (밀리초, 양수)
 */
public record RetryConfig(
    int maxAttempts,
    long initialBackoffMs,
    double backoffBase,
    long maxBackoffMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxAttempts=5, initialBackoffMs=100ms, backoffBase=2, maxBackoffMs=30000ms</p>
     */
    public RetryConfig() {
        this(5, 100, 2.0, 30000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException(
                "maxAttempts must be positive (current: " + maxAttempts + ")"
            );
        }
        if (initialBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "initialBackoffMs must be positive (current: " + initialBackoffMs + ")"
            );
        }
        if (!(backoffBase > 0) || Double.isInfinite(backoffBase)) {
            throw new IllegalArgumentException(
                "backoffBase must be positive (current: " + backoffBase + ")"
            );
        }
        if (maxBackoffMs <= 0) {
            throw new IllegalArgumentException(
                "maxBackoffMs must be positive (current: " + maxBackoffMs + ")"
            );
        }
    }

    public RetryConfig withMaxAttempts(int maxAttempts) {
        return new RetryConfig(maxAttempts, initialBackoffMs, backoffBase, maxBackoffMs);
    }

    public RetryConfig withInitialBackoffMs(long initialBackoffMs) {
        return new RetryConfig(maxAttempts, initialBackoffMs, backoffBase, maxBackoffMs);
    }

    public RetryConfig withBackoffBase(double backoffBase) {
        return new RetryConfig(maxAttempts, initialBackoffMs, backoffBase, maxBackoffMs);
    }

    public RetryConfig withMaxBackoffMs(long maxBackoffMs) {
        return new RetryConfig(maxAttempts, initialBackoffMs, backoffBase, maxBackoffMs);
    }
}
