package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.model.PipelineContext;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * rules의 조건식 AST.
 *
 * <p>정의 로드 시점에 {@link ConditionParser}가 한 번 파싱하며,
 * 평가는 {@link PipelineContext}만을 입력으로 하는 순수 함수입니다.
 * 동일 컨텍스트에 대해 항상 동일한 결과를 반환하므로
 * 그래프 빌더가 검증/테스트 목적으로 여러 번 평가해도 안전합니다.</p>
 *
 * <p>Sealed interface로 정의되어 모든 노드 타입이 컴파일 타임에 고정됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Condition
    permits Condition.Constant, Condition.Presence, Condition.Comparison, Condition.PatternMatch,
            Condition.Not, Condition.And, Condition.Or {

    /**
     * 조건 평가.
     *
     * @param context 파이프라인 컨텍스트
     * @return 조건 충족 여부
     */
    boolean evaluate(PipelineContext context);

    /**
     * 항상 참인 조건 ({@code if} 없는 rule).
     */
    Condition ALWAYS_TRUE = new Constant(true);

    record Constant(boolean value) implements Condition {

        @Override
        public boolean evaluate(PipelineContext context) {
            return value;
        }
    }

    /**
     * {@code $VAR}: 정의되어 있고 빈 문자열이 아니면 참.
     */
    record Presence(Operand.Variable variable) implements Condition {

        public Presence {
            Objects.requireNonNull(variable, "variable cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            String value = variable.resolve(context);
            return value != null && !value.isEmpty();
        }
    }

    /**
     * {@code ==} / {@code !=} 비교.
     */
    record Comparison(Operand left, boolean negated, Operand right) implements Condition {

        public Comparison {
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            boolean equal = Objects.equals(left.resolve(context), right.resolve(context));
            return negated != equal;
        }
    }

    /**
     * {@code =~} / {@code !~} 정규식 매칭 (부분 일치).
     *
     * <p>값이 null이면 {@code =~}는 거짓, {@code !~}는 참입니다.</p>
     */
    record PatternMatch(Operand left, boolean negated, Pattern pattern) implements Condition {

        public PatternMatch {
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(pattern, "pattern cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            String value = left.resolve(context);
            boolean matched = value != null && pattern.matcher(value).find();
            return negated != matched;
        }
    }

    record Not(Condition operand) implements Condition {

        public Not {
            Objects.requireNonNull(operand, "operand cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            return !operand.evaluate(context);
        }
    }

    record And(Condition left, Condition right) implements Condition {

        public And {
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            return left.evaluate(context) && right.evaluate(context);
        }
    }

    record Or(Condition left, Condition right) implements Condition {

        public Or {
            Objects.requireNonNull(left, "left cannot be null");
            Objects.requireNonNull(right, "right cannot be null");
        }

        @Override
        public boolean evaluate(PipelineContext context) {
            return left.evaluate(context) || right.evaluate(context);
        }
    }
}
