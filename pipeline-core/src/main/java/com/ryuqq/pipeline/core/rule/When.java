package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.error.ConfigurationException;

import java.util.Arrays;

/**
 * rule이 매칭되었을 때의 실행 정책.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum When {

    /** 선행 Job이 모두 성공(또는 실패 허용)했을 때만 실행. */
    ON_SUCCESS("on_success"),

    /** 선행 Job의 실패 여부와 무관하게 실행. */
    ALWAYS("always"),

    /** 파이프라인에서 제외. */
    NEVER("never"),

    /** 명시적으로 실행 요청(play)된 경우에만 실행. */
    MANUAL("manual");

    private final String wireValue;

    When(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    /**
     * 정의 문서 값으로부터 When 조회.
     *
     * @param value 예: {@code "on_success"}
     * @return When
     * @throws ConfigurationException 알 수 없는 값인 경우
     */
    public static When fromWireValue(String value) {
        return Arrays.stream(values())
            .filter(when -> when.wireValue.equals(value))
            .findFirst()
            .orElseThrow(() -> new ConfigurationException("Unknown rule action 'when: " + value + "'"));
    }

    /**
     * 이 정책이 만드는 Job 포함 결정.
     *
     * @return NEVER는 EXCLUDED, 나머지는 대응하는 포함 결정
     */
    public JobInclusion toInclusion() {
        return switch (this) {
            case ON_SUCCESS -> JobInclusion.ON_SUCCESS;
            case ALWAYS -> JobInclusion.ALWAYS;
            case MANUAL -> JobInclusion.MANUAL;
            case NEVER -> JobInclusion.EXCLUDED;
        };
    }
}
