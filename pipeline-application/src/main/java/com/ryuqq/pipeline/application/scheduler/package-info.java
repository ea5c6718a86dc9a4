/**
 * Scheduler 포트 및 실행 핸들.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.scheduler.Scheduler} - 그래프 실행 인터페이스</li>
 *   <li>{@link com.ryuqq.pipeline.application.scheduler.PipelineHandle} - 실행 중 파이프라인 조회/취소</li>
 *   <li>{@link com.ryuqq.pipeline.application.scheduler.RunOptions} - 실행 ID, 수동 실행할 Job</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.scheduler;
