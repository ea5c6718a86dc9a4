package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.application.result.PipelineStatus;
import com.ryuqq.pipeline.application.scheduler.PipelineHandle;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.statemachine.JobState;
import com.ryuqq.pipeline.testkit.executor.ScriptedJobExecutor.Step;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: pipeline cancellation.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Running jobs receive a cancel signal, pending jobs become CANCELED</li>
 *   <li>A job ignoring the signal is forced to CANCELED after the grace period</li>
 *   <li>A late outcome after forced cancellation is ignored</li>
 *   <li>Cancelling a finished pipeline has no effect</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CancellationContractTest extends AbstractPipelineContractTest {

    @Test
    void testCancel_RunningAndPendingJobsCanceled() {
        // Given
        executor.when("compile", Step.gated());
        PipelineDefinition definition = definition(List.of("build", "test"),
            job("compile").stage("build").build(),
            job("unit").stage("test").build());
        PipelineHandle handle = submit(definition);
        awaitDispatch("compile");

        // When
        handle.cancel("user request");
        PipelineResult result = await(handle);

        // Then
        assertEquals(PipelineStatus.CANCELED, result.status());
        assertEquals(2, result.exitCode());
        assertJobState(result, "compile", JobState.CANCELED);
        assertJobState(result, "unit", JobState.CANCELED);
        assertEquals("user request", result.job("unit").message());
        assertEquals(List.of("compile"), executor.cancelRequests());
        assertFalse(executor.wasDispatched("unit"));
    }

    @Test
    void testCancel_UnresponsiveJobForcedAfterGracePeriod() {
        // Given
        executor.when("deploy", Step.unresponsive());
        PipelineDefinition definition = definition(List.of("deploy"),
            job("deploy").stage("deploy").build());
        PipelineHandle handle = submit(definition);
        awaitDispatch("deploy");

        // When
        long startedAt = System.nanoTime();
        handle.cancel("stop");
        PipelineResult result = await(handle);
        long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000;

        // Then
        assertJobState(result, "deploy", JobState.CANCELED);
        assertTrue(result.job("deploy").message().contains("forced"), result.job("deploy").message());
        assertTrue(elapsedMs >= GRACE_PERIOD.toMillis() - 20, "forced before grace period: " + elapsedMs + "ms");

        // late outcome does not change the recorded result
        executor.complete("deploy", Succeeded.of());
        assertEquals(JobState.CANCELED, handle.snapshot().get(0).state());
    }

    @Test
    void testCancel_AfterCompletion_NoEffect() {
        PipelineDefinition definition = definition(List.of("build"),
            job("compile").stage("build").build());
        PipelineHandle handle = submit(definition);
        PipelineResult result = await(handle);

        handle.cancel("too late");

        assertEquals(PipelineStatus.SUCCESS, result.status());
        assertTrue(executor.cancelRequests().isEmpty());
        assertEquals(JobState.SUCCESS, handle.snapshot().get(0).state());
    }

    @Test
    void testSchedulerClose_CancelsActivePipelines() {
        executor.when("compile", Step.gated());
        PipelineHandle handle = submit(definition(List.of("build"),
            job("compile").stage("build").build()));
        awaitDispatch("compile");

        scheduler.close();

        PipelineResult result = await(handle);
        assertEquals(PipelineStatus.CANCELED, result.status());
        assertEquals(0, scheduler.activePipelines());
    }
}
