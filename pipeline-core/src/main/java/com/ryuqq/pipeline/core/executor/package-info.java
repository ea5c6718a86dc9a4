/**
 * Job executor SPI.
 *
 * <p>{@link com.ryuqq.pipeline.core.executor.JobExecutor} is the only collaborator that runs
 * job payloads. {@link com.ryuqq.pipeline.core.executor.JobInstance} carries the mutable state
 * of one job within one pipeline run.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.executor;
