package com.ryuqq.pipeline.application.scheduler;

import com.ryuqq.pipeline.application.result.JobResult;
import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.core.model.PipelineId;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 제출된 파이프라인 실행에 대한 핸들.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface PipelineHandle {

    PipelineId pipelineId();

    /**
     * 종료 시 완료되는 future.
     */
    CompletableFuture<PipelineResult> completion();

    /**
     * 파이프라인 취소 요청.
     *
     * <p>PENDING/READY Job은 즉시 CANCELED, RUNNING Job은 Executor에 취소 신호를 보내고
     * 유예 시간이 지나면 강제로 CANCELED 처리됩니다. 이미 끝난 실행이면 무시합니다.</p>
     *
     * @param reason 취소 사유 (예: 새 커밋이 이 실행을 대체함)
     */
    void cancel(String reason);

    /**
     * 현재 Job 상태 스냅샷.
     */
    List<JobResult> snapshot();

    default boolean isDone() {
        return completion().isDone();
    }

    /**
     * 종료까지 대기.
     *
     * @return 파이프라인 결과
     */
    default PipelineResult await() {
        return completion().join();
    }

    /**
     * 제한 시간 동안 종료를 대기.
     *
     * @param timeout 최대 대기 시간
     * @return 파이프라인 결과
     * @throws TimeoutException 제한 시간 안에 끝나지 않은 경우
     * @throws InterruptedException 대기 중 인터럽트
     */
    default PipelineResult await(Duration timeout) throws TimeoutException, InterruptedException {
        try {
            return completion().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Pipeline " + pipelineId().getValue() + " terminated abnormally", e.getCause());
        }
    }
}
