/**
 * 반응형 DAG 스케줄러 구현.
 *
 * <p><strong>핵심 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.DagScheduler} - Job 완료 이벤트로 구동되는 스케줄러</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.SchedulerConfig} - 태그 풀, 타임아웃, 취소 유예, environment 보호</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.SemaphoreBulkhead} - 태그 풀과 resource group의 동시 실행 제한</li>
 *   <li>{@link com.ryuqq.pipeline.adapter.runner.BackoffCalculator} - 재시도 간격 (기본: 즉시)</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.ryuqq.pipeline.adapter.runner;
