/**
 * 파이프라인 실행 결과.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.application.result.PipelineResult} - 파이프라인 종료 상태와 Job별 결과</li>
 *   <li>{@link com.ryuqq.pipeline.application.result.PipelineStatus} - 상태 판정 규칙과 종료 코드</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.application.result;
