package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.executor.JobOutput;

/**
 * 취소 신호를 받아 중단됨.
 *
 * @param message 취소 메시지
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Canceled(String message) implements ExecutionOutcome {

    public Canceled {
        message = message == null || message.isBlank() ? "canceled" : message;
    }

    public static Canceled of() {
        return new Canceled("canceled");
    }

    @Override
    public JobOutput output() {
        return JobOutput.EMPTY;
    }
}
