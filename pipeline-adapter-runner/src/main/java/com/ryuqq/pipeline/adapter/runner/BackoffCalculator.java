package com.ryuqq.pipeline.adapter.runner;

/**
 * Exponential Backoff with Jitter 계산기 (Job 재시도 간격).
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(baseDelay * 2^(attemptCount-1) + jitter, maxDelay)
 * jitter = random(0, exponential * jitterFactor)
 * </pre>
 *
 * <p>baseDelay가 0이면 항상 0을 반환하며 재시도는 즉시 다시 디스패치됩니다 ({@link #none()}).</p>
 *
 * <p><strong>예시 (baseDelay=1000ms, jitterFactor=0.1):</strong></p>
 * <ul>
 *   <li>attemptCount=1: 1000-1100ms</li>
 *   <li>attemptCount=2: 2000-2200ms</li>
 *   <li>attemptCount=3: 4000-4400ms</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double jitterFactor;

    /**
     * 기본 설정으로 생성.
     *
     * <p>기본값: baseDelay=1000ms, maxDelay=300000ms, jitterFactor=0.1</p>
     */
    public BackoffCalculator() {
        this(1000, 300000, 0.1);
    }

    /**
     * 커스텀 설정으로 생성.
     *
     * @param baseDelayMs 기본 지연 시간 (밀리초, 0 이상)
     * @param maxDelayMs 최대 지연 시간 (밀리초, baseDelayMs 이상이어야 함)
     * @param jitterFactor Jitter 비율 (0.0 ~ 1.0)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BackoffCalculator(long baseDelayMs, long maxDelayMs, double jitterFactor) {
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException(
                "baseDelayMs cannot be negative (current: " + baseDelayMs + ")"
            );
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (jitterFactor < 0.0 || jitterFactor > 1.0) {
            throw new IllegalArgumentException(
                "jitterFactor must be between 0.0 and 1.0 (current: " + jitterFactor + ")"
            );
        }
        this.baseDelayMs = baseDelayMs;
        this.maxDelayMs = maxDelayMs;
        this.jitterFactor = jitterFactor;
    }

    /**
     * 지연 없는 재시도.
     */
    public static BackoffCalculator none() {
        return new BackoffCalculator(0, 0, 0.0);
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param attemptCount 지금까지의 디스패치 횟수 (1부터 시작)
     * @return 재시도 전 대기 시간 (밀리초)
     * @throws IllegalArgumentException attemptCount가 양수가 아닌 경우
     */
    public long calculate(int attemptCount) {
        if (attemptCount <= 0) {
            throw new IllegalArgumentException(
                "attemptCount must be positive (current: " + attemptCount + ")"
            );
        }
        if (baseDelayMs == 0) {
            return 0;
        }

        // overflow 방지: shift 폭 제한 후 maxDelay로 자름
        int shift = Math.min(attemptCount - 1, 30);
        long exponential = Math.min(baseDelayMs * (1L << shift), maxDelayMs);

        long jitter = (long) (exponential * jitterFactor * Math.random());

        return Math.min(exponential + jitter, maxDelayMs);
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterFactor() {
        return jitterFactor;
    }
}
