package com.ryuqq.pipeline.core.outcome;

import com.ryuqq.pipeline.core.executor.JobOutput;

/**
 * 성공.
 *
 * @param output 실행 후 워크스페이스 파일
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record Succeeded(JobOutput output) implements ExecutionOutcome {

    public Succeeded {
        output = output == null ? JobOutput.EMPTY : output;
    }

    public static Succeeded of() {
        return new Succeeded(JobOutput.EMPTY);
    }

    public static Succeeded of(JobOutput output) {
        return new Succeeded(output);
    }
}
