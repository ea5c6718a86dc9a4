package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.application.result.PipelineStatus;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.outcome.Canceled;
import com.ryuqq.pipeline.core.outcome.JobFailed;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.rule.Rule;
import com.ryuqq.pipeline.core.rule.When;
import com.ryuqq.pipeline.core.statemachine.JobState;
import com.ryuqq.pipeline.core.statemachine.SkipReason;
import com.ryuqq.pipeline.testkit.executor.ScriptedJobExecutor.Step;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: failure propagation and pipeline status.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A failed job skips downstream jobs with UPSTREAM_FAILED</li>
 *   <li>allow_failure keeps downstream running and the pipeline green with a warning</li>
 *   <li>A job needing a failed job across stages is skipped with UPSTREAM_FAILED</li>
 *   <li>{@code when: always} jobs still run after a failure, but not after a cancellation</li>
 *   <li>Executor errors are reported as api_failure</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class FailurePropagationContractTest extends AbstractPipelineContractTest {

    @Test
    void testFailure_SkipsDownstreamAndFailsPipeline() {
        // Given
        executor.when("compile", Step.fail(2));
        PipelineDefinition definition = definition(List.of("build", "test", "deploy"),
            job("compile").stage("build").build(),
            job("unit").stage("test").build(),
            job("ship").stage("deploy").build());

        // When
        PipelineResult result = run(definition);

        // Then
        assertEquals(PipelineStatus.FAILED, result.status());
        assertEquals(1, result.exitCode());
        assertFailed(result, "compile", FailureReason.SCRIPT_FAILURE);
        assertSkipped(result, "unit", SkipReason.UPSTREAM_FAILED);
        assertSkipped(result, "ship", SkipReason.UPSTREAM_FAILED);
        assertEquals(List.of("compile"), executor.dispatchOrder());
    }

    @Test
    void testFailure_SiblingInSameStageStillRuns() {
        executor.when("compile", Step.fail(1));
        PipelineDefinition definition = definition(List.of("build", "test"),
            job("compile").stage("build").build(),
            job("lint").stage("build").build(),
            job("unit").stage("test").build());

        PipelineResult result = run(definition);

        assertJobState(result, "lint", JobState.SUCCESS);
        assertSkipped(result, "unit", SkipReason.UPSTREAM_FAILED);
    }

    @Test
    void testFailure_NeedsDownstreamSkippedAndFailsPipeline() {
        // Given
        executor.when("compile", Step.fail(1));
        PipelineDefinition definition = definition(List.of("build", "deploy"),
            job("compile").stage("build").build(),
            job("lint").stage("build").build(),
            job("package").stage("deploy").needs("compile").build());

        // When
        PipelineResult result = run(definition);

        // Then
        assertEquals(PipelineStatus.FAILED, result.status());
        assertFailed(result, "compile", FailureReason.SCRIPT_FAILURE);
        assertJobState(result, "lint", JobState.SUCCESS);
        assertSkipped(result, "package", SkipReason.UPSTREAM_FAILED);
        assertFalse(executor.wasDispatched("package"));
    }

    @Test
    void testAllowFailure_DownstreamRunsWithWarning() {
        // Given
        executor.when("lint", Step.fail(1));
        PipelineDefinition definition = definition(List.of("build", "test"),
            job("lint").stage("build").allowFailure(true).build(),
            job("unit").stage("test").build());

        // When
        PipelineResult result = run(definition);

        // Then
        assertEquals(PipelineStatus.SUCCESS, result.status());
        assertTrue(result.hasWarnings());
        assertFailed(result, "lint", FailureReason.SCRIPT_FAILURE);
        assertJobState(result, "unit", JobState.SUCCESS);
    }

    @Test
    void testAlwaysJob_RunsAfterUpstreamFailure() {
        // Given
        executor.when("compile", Step.fail(1));
        PipelineDefinition definition = definition(List.of("build", "test", "report"),
            job("compile").stage("build").build(),
            job("unit").stage("test").build(),
            job("notify").stage("report").rules(Rule.unconditional(When.ALWAYS)).build());

        // When
        PipelineResult result = run(definition);

        // Then
        assertEquals(PipelineStatus.FAILED, result.status());
        assertSkipped(result, "unit", SkipReason.UPSTREAM_FAILED);
        assertJobState(result, "notify", JobState.SUCCESS);
        assertTrue(executor.wasDispatched("notify"));
    }

    @Test
    void testAlwaysJob_NotRunAfterUpstreamCanceled() {
        // Given
        executor.when("compile", Step.outcome(new Canceled("runner stopped")));
        PipelineDefinition definition = definition(List.of("build", "report"),
            job("compile").stage("build").build(),
            job("notify").stage("report").rules(Rule.unconditional(When.ALWAYS)).build());

        // When
        PipelineResult result = run(definition);

        // Then
        assertNotEquals(PipelineStatus.SUCCESS, result.status());
        assertJobState(result, "compile", JobState.CANCELED);
        assertJobState(result, "notify", JobState.CANCELED);
        assertFalse(executor.wasDispatched("notify"));
    }

    @Test
    void testExecutorThrows_ReportedAsApiFailure() {
        executor.when("compile", Step.throwing(new IllegalStateException("runner offline")));
        PipelineDefinition definition = definition(List.of("build"),
            job("compile").stage("build").build());

        PipelineResult result = run(definition);

        assertFailed(result, "compile", FailureReason.API_FAILURE);
        assertTrue(result.job("compile").message().contains("runner offline"), result.job("compile").message());
    }

    @Test
    void testExitCodeOfFailedScript_PreservedInMessage() {
        executor.when("compile", Step.outcome(JobFailed.script(137, "killed")));
        PipelineDefinition definition = definition(List.of("build"),
            job("compile").stage("build").build());

        PipelineResult result = run(definition);

        assertEquals("killed", result.job("compile").message());
        assertEquals(1, result.job("compile").attempts());
    }
}
