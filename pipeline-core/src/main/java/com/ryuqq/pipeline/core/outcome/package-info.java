/**
 * Job execution outcomes reported by a {@link com.ryuqq.pipeline.core.executor.JobExecutor}.
 *
 * <p>The sealed hierarchy separates job failures from runner infrastructure failures so
 * retry decisions can treat them differently.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.outcome;
