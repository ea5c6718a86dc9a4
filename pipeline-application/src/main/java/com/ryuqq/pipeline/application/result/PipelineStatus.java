package com.ryuqq.pipeline.application.result;

import java.util.Collection;

/**
 * 파이프라인 종료 상태.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public enum PipelineStatus {

    SUCCESS(0),

    FAILED(1),

    CANCELED(2);

    private final int exitCode;

    PipelineStatus(int exitCode) {
        this.exitCode = exitCode;
    }

    /**
     * 트리거한 시스템에 돌려줄 프로세스 종료 코드.
     */
    public int exitCode() {
        return exitCode;
    }

    /**
     * Job 결과로부터 파이프라인 상태 판정.
     *
     * <p>취소된 실행은 CANCELED. 그 외에는 allow_failure가 아닌 모든 Job이 SUCCESS이거나
     * 정당한 사유로 SKIPPED일 때만 SUCCESS입니다.</p>
     *
     * @param jobs Job 결과 (rules로 제외된 Job 포함)
     * @param canceled 실행이 취소되었는지 여부
     * @return 파이프라인 상태
     */
    public static PipelineStatus evaluate(Collection<JobResult> jobs, boolean canceled) {
        if (canceled) {
            return CANCELED;
        }
        boolean blocked = jobs.stream().anyMatch(JobResult::blocksSuccess);
        return blocked ? FAILED : SUCCESS;
    }
}
