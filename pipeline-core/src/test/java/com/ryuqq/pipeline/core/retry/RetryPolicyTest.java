package com.ryuqq.pipeline.core.retry;

import com.ryuqq.pipeline.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RetryPolicy / RetryTrigger 테스트.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class RetryPolicyTest {

    private static final RetrySpec SCRIPT_ONLY =
        RetrySpec.of(2, RetryTrigger.of(Set.of(FailureReason.SCRIPT_FAILURE)));

    // ========== 재시도 한도 ==========

    @Test
    void shouldRetry_WithinMax_ReturnsTrue() {
        assertTrue(RetryPolicy.shouldRetry(SCRIPT_ONLY, FailureReason.SCRIPT_FAILURE, 1));
        assertTrue(RetryPolicy.shouldRetry(SCRIPT_ONLY, FailureReason.SCRIPT_FAILURE, 2));
    }

    @Test
    void shouldRetry_MaxExhausted_ReturnsFalse() {
        assertFalse(RetryPolicy.shouldRetry(SCRIPT_ONLY, FailureReason.SCRIPT_FAILURE, 3));
    }

    @Test
    void shouldRetry_NoneSpec_ReturnsFalse() {
        assertFalse(RetryPolicy.shouldRetry(RetrySpec.NONE, FailureReason.RUNNER_SYSTEM_FAILURE, 1));
        assertFalse(RetryPolicy.shouldRetry(null, FailureReason.SCRIPT_FAILURE, 1));
    }

    // ========== 실패 사유 ==========

    @Test
    void shouldRetry_UnlistedReason_ReturnsFalse() {
        assertFalse(RetryPolicy.shouldRetry(SCRIPT_ONLY, FailureReason.JOB_EXECUTION_TIMEOUT, 1));
    }

    @ParameterizedTest
    @EnumSource(value = FailureReason.class, names = {
        "API_FAILURE", "RUNNER_SYSTEM_FAILURE", "RUNNER_UNSUPPORTED",
        "STUCK_OR_TIMEOUT_FAILURE", "SCHEDULER_FAILURE", "DATA_INTEGRITY_FAILURE"
    })
    void shouldRetry_InfrastructureReason_AlwaysRetriedWithinMax(FailureReason reason) {
        assertTrue(reason.isInfrastructure());
        assertTrue(RetryPolicy.shouldRetry(SCRIPT_ONLY, reason, 1));
    }

    @ParameterizedTest
    @EnumSource(value = FailureReason.class, names = {"MISSING_DEPENDENCY_FAILURE", "PROTECTED_ENVIRONMENT_FAILURE"})
    void shouldRetry_PreDispatchReason_NeverRetried(FailureReason reason) {
        RetrySpec always = RetrySpec.of(2);

        assertTrue(reason.isPreDispatch());
        assertFalse(RetryPolicy.shouldRetry(always, reason, 1));
    }

    @Test
    void shouldRetry_NoWhen_MatchesAnyReason() {
        assertTrue(RetryPolicy.shouldRetry(RetrySpec.of(1), FailureReason.UNKNOWN_FAILURE, 1));
    }

    @Test
    void shouldRetry_InvalidAttempt_ThrowsException() {
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.shouldRetry(SCRIPT_ONLY, FailureReason.SCRIPT_FAILURE, 0));
        assertThrows(IllegalArgumentException.class,
            () -> RetryPolicy.shouldRetry(SCRIPT_ONLY, null, 1));
    }

    // ========== RetrySpec / RetryTrigger ==========

    @Test
    void retrySpec_MaxOutOfRange_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> RetrySpec.of(11));
        assertThrows(IllegalArgumentException.class, () -> RetrySpec.of(-1));
        assertEquals(10, RetrySpec.of(10).effectiveMax());
    }

    @Test
    void retryTrigger_FromWireValues() {
        RetryTrigger trigger = RetryTrigger.fromWireValues(List.of("script_failure", "api_failure"));

        assertFalse(trigger.always());
        assertEquals(Set.of(FailureReason.SCRIPT_FAILURE, FailureReason.API_FAILURE), trigger.reasons());
        assertSame(RetryTrigger.ALWAYS, RetryTrigger.fromWireValues(List.of("script_failure", "always")));
    }

    @Test
    void retryTrigger_UnknownWireValue_ThrowsConfigurationException() {
        ConfigurationException exception = assertThrows(
            ConfigurationException.class,
            () -> RetryTrigger.fromWireValues(List.of("cosmic_rays"))
        );
        assertTrue(exception.getMessage().contains("cosmic_rays"));
    }
}
