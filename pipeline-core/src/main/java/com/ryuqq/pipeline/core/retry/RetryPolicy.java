package com.ryuqq.pipeline.core.retry;

/**
 * 재시도 여부 결정.
 *
 * <p>(재시도 설정, 실패 분류, 시도 횟수)만의 함수이며 숨겨진 전역 상태가 없습니다.</p>
 *
 * <p><strong>결정 규칙:</strong></p>
 * <ol>
 *   <li>디스패치 전 실패(의존 아티팩트 없음, 보호 environment)는 재시도 안 함</li>
 *   <li>attemptCount가 max를 넘으면 재시도 안 함 (1 + max회 디스패치로 예산 소진)</li>
 *   <li>인프라 실패는 예산 내에서 항상 재시도</li>
 *   <li>그 외 실패는 {@code retry.when}에 포함된 경우에만 재시도</li>
 * </ol>
 *
 * <p><strong>예시 (max=2, 항상 재시도 가능한 사유):</strong></p>
 * <ul>
 *   <li>attemptCount=1 → true (두 번째 디스패치)</li>
 *   <li>attemptCount=2 → true (세 번째 디스패치)</li>
 *   <li>attemptCount=3 → false (총 3회 디스패치 후 FAILED)</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RetryPolicy {

    // Utility class - prevent instantiation
    private RetryPolicy() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 재시도 여부 결정.
     *
     * @param spec Job의 재시도 설정 (null이면 재시도 없음)
     * @param reason 실패 사유
     * @param attemptCount 지금까지의 디스패치 횟수 (1 이상)
     * @return 재시도하면 true
     * @throws IllegalArgumentException reason이 null이거나 attemptCount가 1 미만인 경우
     */
    public static boolean shouldRetry(RetrySpec spec, FailureReason reason, int attemptCount) {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (attemptCount < 1) {
            throw new IllegalArgumentException("attemptCount must be positive (current: " + attemptCount + ")");
        }
        if (spec == null || reason.isPreDispatch()) {
            return false;
        }
        if (attemptCount > spec.effectiveMax()) {
            return false;
        }
        return reason.isInfrastructure() || spec.effectiveWhen().matches(reason);
    }
}
