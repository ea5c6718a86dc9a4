package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.model.PipelineContext;

import java.util.List;

/**
 * rules 평가기.
 *
 * <p><strong>평가 규칙:</strong></p>
 * <ul>
 *   <li>선언 순서대로 평가하며, 처음 매칭된 rule의 when이 결과 (first-match)</li>
 *   <li>이후 rule의 조건은 평가하지 않음 (short-circuit)</li>
 *   <li>어떤 rule도 매칭되지 않으면 EXCLUDED</li>
 *   <li>rules 자체가 없는 Job은 ON_SUCCESS</li>
 * </ul>
 *
 * <p>부수 효과가 없는 순수 함수입니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class RuleEvaluator {

    // Utility class - prevent instantiation
    private RuleEvaluator() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * rules 평가.
     *
     * @param rules 선언 순서의 rule 목록 (null이면 rules 없음으로 간주)
     * @param context 파이프라인 컨텍스트
     * @return 포함 결정
     * @throws IllegalArgumentException context가 null인 경우
     */
    public static JobInclusion evaluate(List<Rule> rules, PipelineContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }
        if (rules == null || rules.isEmpty()) {
            return JobInclusion.ON_SUCCESS;
        }
        for (Rule rule : rules) {
            if (rule.condition().evaluate(context)) {
                return rule.when().toInclusion();
            }
        }
        return JobInclusion.EXCLUDED;
    }
}
