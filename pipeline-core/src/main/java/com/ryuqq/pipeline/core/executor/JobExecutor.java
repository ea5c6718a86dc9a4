package com.ryuqq.pipeline.core.executor;

import com.ryuqq.pipeline.core.outcome.ExecutionOutcome;

import java.util.concurrent.CompletableFuture;

/**
 * Job 실행자 (외부 협력자).
 *
 * <p>엔진은 스크립트 내용을 해석하지 않고 실행 환경과 함께 그대로 넘깁니다.</p>
 *
 * <p><strong>계약:</strong></p>
 * <ul>
 *   <li>{@link #dispatch}는 비블로킹으로 즉시 반환해야 합니다.</li>
 *   <li>future가 예외로 완료되면 인프라 실패(API_FAILURE)로 분류됩니다.</li>
 *   <li>{@link #cancel} 호출 후에는 유예 시간 안에 {@code Canceled}로 완료해야 합니다.
 *       그렇지 않으면 스케줄러가 Job을 강제로 CANCELED 처리합니다.</li>
 *   <li>구현체는 thread-safe해야 합니다.</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface JobExecutor {

    /**
     * Job 실행 시작.
     *
     * @param job 실행할 JobInstance (현재 시도 번호 포함)
     * @param environment 확정된 실행 환경
     * @return 실행 결과 future
     */
    CompletableFuture<ExecutionOutcome> dispatch(JobInstance job, ExecutionEnvironment environment);

    /**
     * 실행 중인 Job에 취소 신호 전달.
     *
     * <p>이미 끝났거나 알 수 없는 Job이면 무시합니다.</p>
     *
     * @param job 취소할 JobInstance
     */
    void cancel(JobInstance job);
}
