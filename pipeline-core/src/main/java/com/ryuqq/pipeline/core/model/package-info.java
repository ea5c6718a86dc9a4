/**
 * Pipeline invocation model.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.model.JobName} - job identifier</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.PipelineSource} - triggering event kind</li>
 *   <li>{@link com.ryuqq.pipeline.core.model.PipelineContext} - immutable invocation context</li>
 * </ul>
 *
 * <p>{@link com.ryuqq.pipeline.core.model.VariableExpander} expands {@code $VAR} references
 * against a context or a job's variable map.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.model;
