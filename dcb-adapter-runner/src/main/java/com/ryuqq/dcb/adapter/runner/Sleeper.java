package com.ryuqq.dcb.adapter.runner;

/**
 * 재시도 대기 추상화.
 *
 * <p>테스트에서는 대기 시간을 기록만 하는 구현을 주입합니다.</p>
 *
 * @author DCB Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    /**
     * 지정 시간 대기.
     *
     * @param millis 대기 시간 (밀리초)
     */
    void sleep(long millis);

    /**
     * {@link Thread#sleep(long)} 기반 구현.
     *
     * <p>InterruptedException 발생 시 현재 스레드의 인터럽트 플래그를 복원하고
     * RuntimeException으로 래핑하여 던집니다.</p>
     *
     * @return Sleeper
     */
    static Sleeper threadSleep() {
        return millis -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RuntimeException("Retry backoff interrupted", e);
            }
        };
    }
}
