/**
 * Error taxonomy of the pipeline engine.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.error.ConfigurationException} - malformed definition, fatal at load time</li>
 *   <li>{@link com.ryuqq.pipeline.core.error.GraphException} - cycle or unresolved reference, fatal at build time</li>
 *   <li>{@link com.ryuqq.pipeline.core.error.DependencyUnavailableException} - required artifact missing at dispatch, fails one job</li>
 * </ul>
 *
 * <p>Job execution failures are not exceptions; they are reported as
 * {@link com.ryuqq.pipeline.core.outcome.ExecutionOutcome} values.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.error;
