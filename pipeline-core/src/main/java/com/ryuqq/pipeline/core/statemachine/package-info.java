/**
 * Job state machine package.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.statemachine.JobState} - JobInstance lifecycle states</li>
 *   <li>{@link com.ryuqq.pipeline.core.statemachine.StateTransition} - transition validation</li>
 *   <li>{@link com.ryuqq.pipeline.core.statemachine.SkipReason} - why a job ended SKIPPED</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * JobState state = JobState.PENDING;
 * state = StateTransition.transition(state, JobState.READY);
 * state = StateTransition.transition(state, JobState.RUNNING);
 * state = StateTransition.transition(state, JobState.FAILED);
 * state = StateTransition.transition(state, JobState.READY); // retry
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.statemachine;
