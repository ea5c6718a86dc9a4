package com.ryuqq.pipeline.core.retry;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * {@code retry.when}: 재시도 대상 실패 사유 집합.
 *
 * @param always 모든 사유에 대해 재시도 ({@code when: always})
 * @param reasons 재시도 대상 사유 (always이면 무시)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RetryTrigger(boolean always, Set<FailureReason> reasons) {

    public static final String ALWAYS_KEYWORD = "always";

    /**
     * {@code when: always}.
     */
    public static final RetryTrigger ALWAYS = new RetryTrigger(true, Set.of());

    public RetryTrigger {
        reasons = reasons == null || reasons.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(EnumSet.copyOf(reasons));
    }

    /**
     * 특정 사유 집합으로 생성.
     *
     * @param reasons 재시도 대상 사유
     * @return RetryTrigger
     */
    public static RetryTrigger of(Set<FailureReason> reasons) {
        return new RetryTrigger(false, reasons);
    }

    /**
     * 정의 문서 값 목록으로 생성 ({@code always} 키워드 포함 가능).
     *
     * @param values 예: {@code ["runner_system_failure", "api_failure"]}
     * @return RetryTrigger
     * @throws com.ryuqq.pipeline.core.error.ConfigurationException 알 수 없는 값이 있는 경우
     */
    public static RetryTrigger fromWireValues(Iterable<String> values) {
        EnumSet<FailureReason> parsed = EnumSet.noneOf(FailureReason.class);
        for (String value : values) {
            if (ALWAYS_KEYWORD.equals(value)) {
                return ALWAYS;
            }
            parsed.add(FailureReason.fromWireValue(value));
        }
        return of(parsed);
    }

    /**
     * 사유가 재시도 대상인지 확인.
     *
     * @param reason 실패 사유
     * @return 대상이면 true
     */
    public boolean matches(FailureReason reason) {
        return always || reasons.contains(reason);
    }
}
