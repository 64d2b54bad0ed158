package com.ryuqq.dcb.adapter.runner;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>OCC 충돌 재시도 간격을 지수적으로 증가시키고, 배수형 Jitter로
 * 같은 Scope를 두고 경쟁하는 호출자들이 동시에 재시도하지 않도록 분산합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(round(initialMs * base^attempt * jitter), maxMs)
 * jitter = random[0.5, 1.5)   (기본)
 * </pre>
 *
 * <p><strong>예시 (initialMs=100, base=2, jitter=1.0):</strong></p>
 * <ul>
 *   <li>attempt=0: 100ms</li>
 *   <li>attempt=1: 200ms</li>
 *   <li>attempt=3: 800ms</li>
 *   <li>attempt=9: 51200ms → 30000ms (maxMs)</li>
 * </ul>
 *
 * @author DCB Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long initialMs;
    private final double base;
    private final long maxMs;
    private final DoubleSupplier jitter;

    /**
     * 기본 설정으로 생성 (initialMs=100, base=2, maxMs=30000, 기본 jitter).
     */
    public BackoffCalculator() {
        this(new RetryConfig());
    }

    /**
     * RetryConfig로 생성 (기본 jitter).
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, defaultJitter());
    }

    /**
     * RetryConfig와 jitter 공급자로 생성.
     *
     * @param config 재시도 설정
     * @param jitter jitter 배수 공급자 (양수 반환)
     * @throws IllegalArgumentException config 또는 jitter가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, DoubleSupplier jitter) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (jitter == null) {
            throw new IllegalArgumentException("jitter cannot be null");
        }
        this.initialMs = config.initialBackoffMs();
        this.base = config.backoffBase();
        this.maxMs = config.maxBackoffMs();
        this.jitter = jitter;
    }

    /**
     * 기본 jitter: [0.5, 1.5) 구간 난수.
     *
     * @return jitter 공급자
     */
    public static DoubleSupplier defaultJitter() {
        return () -> 0.5 + ThreadLocalRandom.current().nextDouble();
    }

    /**
     * 결정적 테스트용 jitter (항상 1.0).
     *
     * @return jitter 공급자
     */
    public static DoubleSupplier noJitter() {
        return () -> 1.0;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attempt 실패한 시도 번호 (0부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attempt가 음수이거나 jitter가 양의 유한수가 아닌 경우
     */
    public long calculate(int attempt) {
        if (attempt < 0) {
            throw new IllegalArgumentException(
                "attempt must be non-negative (current: " + attempt + ")"
            );
        }

        double baseDelay = initialMs * Math.pow(base, attempt);

        double multiplier = jitter.getAsDouble();
        if (!Double.isFinite(multiplier) || multiplier <= 0) {
            throw new IllegalArgumentException(
                "jitter must be a finite positive number (current: " + multiplier + ")"
            );
        }

        // Math.round는 long 범위를 넘으면 Long.MAX_VALUE로 고정
        return Math.min(maxMs, Math.round(baseDelay * multiplier));
    }

    public long getInitialMs() {
        return initialMs;
    }

    public double getBase() {
        return base;
    }

    public long getMaxMs() {
        return maxMs;
    }
}
