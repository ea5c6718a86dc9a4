package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.retry.FailureReason;

/**
 * runner 인프라 실패.
 *
 * <p>Job의 실제 실패와 구분되며, 재시도 예산이 남아 있으면 retry.when 설정과 무관하게 재시도됩니다.</p>
 *
 * @param reason 인프라 실패 분류
 * @param message 실패 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record SystemFailed(FailureReason reason, String message) implements ExecutionOutcome {

    public SystemFailed {
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (!reason.isInfrastructure()) {
            throw new IllegalArgumentException("Not an infrastructure reason: " + reason);
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
    }

    public static SystemFailed of(FailureReason reason, String message) {
        return new SystemFailed(reason, message);
    }

    @Override
    public JobOutput output() {
        return JobOutput.EMPTY;
    }

    @Override
    public FailureReason failureReason() {
        return reason;
    }
}
