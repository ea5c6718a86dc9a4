package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.model.JobName;

/**
 * Job이 디스패치 전에 아티팩트를 가져올 upstream Job.
 *
 * @param job upstream Job
 * @param required 아티팩트가 없으면 디스패치를 실패시킬지 여부
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ArtifactSource(JobName job, boolean required) {

    public ArtifactSource {
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
    }
}
