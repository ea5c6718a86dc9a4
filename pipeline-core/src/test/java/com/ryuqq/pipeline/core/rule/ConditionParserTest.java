package com.ryuqq.pipeline.core.rule;

import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.model.PipelineSource;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ConditionParser 테스트.
 *
 * <p>실제 CI 정의에서 사용하는 조건식 형태를 기준으로 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class ConditionParserTest {

    private static final PipelineContext MAIN_PUSH = PipelineContext.forBranch("main", PipelineSource.PUSH);
    private static final PipelineContext SCHEDULE = PipelineContext.forBranch("main", PipelineSource.SCHEDULE);
    private static final PipelineContext TAG = PipelineContext.forTag("2024.1.0");

    private static boolean eval(String expression, PipelineContext context) {
        return ConditionParser.parse(expression).evaluate(context);
    }

    // ========== 비교 ==========

    @Test
    void equality_QuotedLiteral() {
        assertTrue(eval("$CI_PIPELINE_SOURCE == \"schedule\"", SCHEDULE));
        assertFalse(eval("$CI_PIPELINE_SOURCE == \"schedule\"", MAIN_PUSH));
        assertTrue(eval("$CI_PIPELINE_SOURCE != 'schedule'", MAIN_PUSH));
    }

    @Test
    void equality_UndefinedVariableEqualsNull() {
        assertTrue(eval("$CI_COMMIT_TAG == null", MAIN_PUSH));
        assertFalse(eval("$CI_COMMIT_TAG == null", TAG));
    }

    @Test
    void presence_BareVariable() {
        assertTrue(eval("$CI_COMMIT_TAG", TAG));
        assertFalse(eval("$CI_COMMIT_TAG", MAIN_PUSH));
        assertTrue(eval("${CI_COMMIT_BRANCH}", MAIN_PUSH));
    }

    // ========== 정규식 ==========

    @Test
    void regex_PartialMatch() {
        PipelineContext staging = PipelineContext.forBranch("staging-next", PipelineSource.PUSH);

        assertTrue(eval("$CI_COMMIT_REF_NAME =~ /^staging/", staging));
        assertFalse(eval("$CI_COMMIT_REF_NAME !~ /staging/", staging));
        assertTrue(eval("$CI_COMMIT_REF_NAME =~ /MAIN/i", MAIN_PUSH));
    }

    @Test
    void regex_UndefinedVariable_NeverMatches() {
        assertFalse(eval("$CI_COMMIT_TAG =~ /.*/", MAIN_PUSH));
        assertTrue(eval("$CI_COMMIT_TAG !~ /.*/", MAIN_PUSH));
    }

    // ========== 논리 연산 ==========

    @Test
    void and_BindsTighterThanOr() {
        // true || (false && false)
        assertTrue(eval("$CI_COMMIT_BRANCH == \"main\" || $CI_COMMIT_TAG && $CI_COMMIT_TAG == \"x\"", MAIN_PUSH));
        // (true || false) && false
        assertFalse(eval("($CI_COMMIT_BRANCH == \"main\" || $CI_COMMIT_TAG) && $CI_COMMIT_TAG", MAIN_PUSH));
    }

    @Test
    void not_NegatesOperand() {
        assertTrue(eval("!$CI_COMMIT_TAG", MAIN_PUSH));
        assertFalse(eval("!($CI_PIPELINE_SOURCE == \"push\")", MAIN_PUSH));
    }

    @Test
    void escapedQuoteInsideLiteral() {
        PipelineContext context = MAIN_PUSH.withVariable("MESSAGE", "say \"hi\"");

        assertTrue(eval("$MESSAGE == \"say \\\"hi\\\"\"", context));
    }

    // ========== 문법 오류 ==========

    @ParameterizedTest
    @ValueSource(strings = {
        "",
        "$A ==",
        "$A == \"unterminated",
        "($A == \"x\"",
        "\"literal\"",
        "$A =~ missing-slashes",
        "$A =~ /[/",
        "$A =~ /x/q",
        "$A == \"x\" extra"
    })
    void parse_Malformed_ThrowsConfigurationException(String expression) {
        assertThrows(ConfigurationException.class, () -> ConditionParser.parse(expression));
    }

    @Test
    void parse_ErrorMessageContainsExpression() {
        ConfigurationException exception = assertThrows(
            ConfigurationException.class,
            () -> ConditionParser.parse("$A == $")
        );
        assertTrue(exception.getMessage().contains("$A == $"));
    }
}
