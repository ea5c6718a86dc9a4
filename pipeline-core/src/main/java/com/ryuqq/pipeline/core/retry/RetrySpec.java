package com.ryuqq.pipeline.core.retry;

/**
 * Job 재시도 설정 ({@code retry}).
 *
 * <p>템플릿 병합 시 키 단위로 병합되므로 각 필드는 "미지정"을 뜻하는 null을 허용합니다.
 * 실제 정책 계산에는 {@link #effectiveMax()} / {@link #effectiveWhen()}을 사용합니다.</p>
 *
 * @param max 최대 재시도 횟수 (null: 미지정, 0 ~ {@value #MAX_RETRIES})
 * @param when 재시도 대상 사유 (null: 미지정 → always)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetrySpec(Integer max, RetryTrigger when) {

    public static final int MAX_RETRIES = 10;

    /**
     * 재시도 없음.
     */
    public static final RetrySpec NONE = new RetrySpec(0, null);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException max가 범위를 벗어난 경우
     */
    public RetrySpec {
        if (max != null && (max < 0 || max > MAX_RETRIES)) {
            throw new IllegalArgumentException(
                "retry max must be between 0 and " + MAX_RETRIES + " (current: " + max + ")");
        }
    }

    /**
     * {@code retry: N} 형태 (모든 사유 재시도).
     */
    public static RetrySpec of(int max) {
        return new RetrySpec(max, null);
    }

    public static RetrySpec of(int max, RetryTrigger when) {
        return new RetrySpec(max, when);
    }

    public int effectiveMax() {
        return max == null ? 0 : max;
    }

    public RetryTrigger effectiveWhen() {
        return when == null ? RetryTrigger.ALWAYS : when;
    }

    /**
     * 부모 설정 위에 이 설정을 키 단위로 덮어쓴 결과.
     *
     * @param parent 부모 설정 (null 가능)
     * @return 병합 결과
     */
    public RetrySpec mergeOver(RetrySpec parent) {
        if (parent == null) {
            return this;
        }
        return new RetrySpec(
            max != null ? max : parent.max,
            when != null ? when : parent.when
        );
    }
}
