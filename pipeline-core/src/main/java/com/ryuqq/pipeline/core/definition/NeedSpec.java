package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.model.JobName;

/**
 * {@code needs} 항목.
 *
 * @param job 선행 Job
 * @param artifacts 선행 Job의 아티팩트를 가져올지 여부 (기본 true)
 * @param optional 선행 Job이 rules로 제외되어도 허용할지 여부 (기본 false)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record NeedSpec(JobName job, boolean artifacts, boolean optional) {

    public NeedSpec {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
    }

    public static NeedSpec of(String job) {
        return new NeedSpec(JobName.of(job), true, false);
    }

    public static NeedSpec optional(String job) {
        return new NeedSpec(JobName.of(job), true, true);
    }

    public static NeedSpec withoutArtifacts(String job) {
        return new NeedSpec(JobName.of(job), false, false);
    }
}
