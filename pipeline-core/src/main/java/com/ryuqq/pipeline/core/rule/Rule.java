package com.ryuqq.pipeline.core.rule;

/**
 * 조건과 실행 정책의 쌍.
 *
 * @param condition 조건 ({@code if} 없는 rule은 {@link Condition#ALWAYS_TRUE})
 * @param when 매칭 시 실행 정책
 * @param expression 원본 조건식 (보고용, null 가능)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Rule(
    Condition condition,
    When when,
    String expression
) {

    public Rule {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        if (when == null) {
            throw new IllegalArgumentException("when cannot be null");
        }
    }

    /**
     * 조건식 문자열을 파싱해 rule 생성.
     *
     * @param expression 조건식 (예: {@code $CI_PIPELINE_SOURCE == "schedule"})
     * @param when 실행 정책
     * @return Rule
     * @throws com.ryuqq.pipeline.core.error.ConfigurationException 조건식이 잘못된 경우
     */
    public static Rule of(String expression, When when) {
        return new Rule(ConditionParser.parse(expression), when, expression);
    }

    /**
     * 조건 없는 rule 생성 (항상 매칭).
     *
     * @param when 실행 정책
     * @return Rule
     */
    public static Rule unconditional(When when) {
        return new Rule(Condition.ALWAYS_TRUE, when, null);
    }
}
