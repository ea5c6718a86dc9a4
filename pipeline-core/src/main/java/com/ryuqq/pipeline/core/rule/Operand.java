package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.model.PipelineContext;

/**
 * 조건식 피연산자.
 *
 * <ul>
 *   <li>{@link Variable}: {@code $VAR}, 미정의 시 null로 평가</li>
 *   <li>{@link Text}: 따옴표 문자열 리터럴</li>
 *   <li>{@link Null}: {@code null} 리터럴</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface Operand permits Operand.Variable, Operand.Text, Operand.Null {

    /**
     * 컨텍스트에 대해 값 계산.
     *
     * @param context 파이프라인 컨텍스트
     * @return 값 (null 가능)
     */
    String resolve(PipelineContext context);

    record Variable(String name) implements Operand {

        public Variable {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("variable name cannot be null or blank");
            }
        }

        @Override
        public String resolve(PipelineContext context) {
            return context.variable(name);
        }

        @Override
        public String toString() {
            return "$" + name;
        }
    }

    record Text(String value) implements Operand {

        public Text {
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null");
            }
        }

        @Override
        public String resolve(PipelineContext context) {
            return value;
        }

        @Override
        public String toString() {
            return '"' + value + '"';
        }
    }

    record Null() implements Operand {

        @Override
        public String resolve(PipelineContext context) {
            return null;
        }

        @Override
        public String toString() {
            return "null";
        }
    }
}
