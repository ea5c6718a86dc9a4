/**
 * Resource protection for job dispatch.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.protection.Bulkhead} - bounded concurrency for runner tags and resource groups</li>
 *   <li>{@link com.ryuqq.pipeline.core.protection.EnvironmentProtection} - protected environment / protected ref gating</li>
 * </ul>
 *
 * <p>NoOp implementations in {@code noop} apply no limit.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.protection;
