/**
 * Retry and failure classification.
 *
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.retry.FailureReason} - failure classification (infrastructure vs job)</li>
 *   <li>{@link com.ryuqq.pipeline.core.retry.RetrySpec} - per-job bounded retry budget</li>
 *   <li>{@link com.ryuqq.pipeline.core.retry.RetryPolicy} - pure retry decision</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.retry;
