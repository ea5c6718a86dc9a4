package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.retry.FailureReason;

/**
 * Job 자체의 실패 (스크립트 non-zero 종료, 타임아웃 등).
 *
 * @param reason 실패 분류 (인프라 사유 불가)
 * @param exitCode 종료 코드 (알 수 없으면 -1)
 * @param message 실패 메시지
 * @param output 실패 시점의 워크스페이스 파일
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobFailed(
    FailureReason reason,
    int exitCode,
    String message,
    JobOutput output
) implements ExecutionOutcome {

    public JobFailed {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (reason.isInfrastructure()) {
            throw new IllegalArgumentException("Infrastructure reason must be reported as SystemFailed: " + reason);
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        output = output == null ? JobOutput.EMPTY : output;
    }

    /**
     * 스크립트 실패 생성.
     *
     * @param exitCode 종료 코드
     * @param message 메시지
     * @return JobFailed (SCRIPT_FAILURE)
     */
    public static JobFailed script(int exitCode, String message) {
        return new JobFailed(FailureReason.SCRIPT_FAILURE, exitCode, message, JobOutput.EMPTY);
    }

    public static JobFailed of(FailureReason reason, String message) {
        return new JobFailed(reason, -1, message, JobOutput.EMPTY);
    }

    @Override
    public FailureReason failureReason() {
        return reason;
    }
}
