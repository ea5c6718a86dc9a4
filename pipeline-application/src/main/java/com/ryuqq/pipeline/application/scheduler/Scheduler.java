package com.ryuqq.pipeline.application.scheduler;

import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.core.graph.JobGraph;

/**
 * 파이프라인 스케줄러.
 *
 * <p>그래프의 Job을 의존 관계와 stage 순서에 따라 Executor로 디스패치하고,
 * 재시도 정책과 아티팩트/캐시 브로커를 적용해 파이프라인 종료 상태를 보고합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));
 * PipelineResult result = scheduler.run(graph);
 * System.exit(result.exitCode());
 * </pre>
 *
 * <p>구현체는 adapter-runner 모듈의 {@code DagScheduler}에서 제공됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface Scheduler {

    /**
     * 파이프라인 실행 시작 (비블로킹).
     *
     * @param graph 실행할 그래프
     * @param options 실행 옵션
     * @return 실행 핸들
     */
    PipelineHandle submit(JobGraph graph, RunOptions options);

    default PipelineHandle submit(JobGraph graph) {
        return submit(graph, RunOptions.defaults());
    }

    /**
     * 파이프라인을 실행하고 종료까지 대기.
     */
    default PipelineResult run(JobGraph graph, RunOptions options) {
        return submit(graph, options).await();
    }

    default PipelineResult run(JobGraph graph) {
        return run(graph, RunOptions.defaults());
    }
}
