package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.retry.FailureReason;

/**
 * Executor가 보고한 Job 실행 결과.
 *
 * <ul>
 *   <li>{@link Succeeded}: 스크립트 성공</li>
 *   <li>{@link JobFailed}: 스크립트/컨테이너 실패 (retry.when 설정에 따라 재시도)</li>
 *   <li>{@link SystemFailed}: runner 인프라 실패 (예산 내에서 항상 재시도)</li>
 *   <li>{@link Canceled}: 취소 신호에 따라 중단됨</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public sealed interface ExecutionOutcome permits Succeeded, JobFailed, SystemFailed, Canceled {

    /**
     * 실행 후 워크스페이스 파일.
     *
     * @return 출력 (없으면 {@link JobOutput#EMPTY})
     */
    JobOutput output();

    default boolean isSuccess() {
        return this instanceof Succeeded;
    }

    default boolean isCanceled() {
        return this instanceof Canceled;
    }

    /**
     * 실패 사유.
     *
     * @return 실패가 아니면 null
     */
    default FailureReason failureReason() {
        return null;
    }
}
