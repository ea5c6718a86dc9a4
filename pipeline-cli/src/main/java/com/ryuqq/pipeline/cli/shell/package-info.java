/**
 * 로컬 셸 기반 {@link com.ryuqq.pipeline.core.executor.JobExecutor} 구현.
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.cli.shell;
