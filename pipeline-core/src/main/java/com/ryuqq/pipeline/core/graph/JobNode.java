package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.rule.JobInclusion;

import java.util.List;

/**
 * 그래프의 노드: 실행 대상으로 포함된 Job.
 *
 * @param definition Job 정의
 * @param inclusion rules 평가 결과 (EXCLUDED 불가)
 * @param stageIndex stage 순서
 * @param predecessors 선행 노드 (stage 대기와 needs가 하나의 간선 타입으로 통합됨)
 * @param artifactSources 아티팩트를 가져올 upstream Job
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobNode(
    JobDefinition definition,
    JobInclusion inclusion,
    int stageIndex,
    List<JobName> predecessors,
    List<ArtifactSource> artifactSources
) {

    public JobNode {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (inclusion == null || !inclusion.isIncluded()) {
            throw new IllegalArgumentException("inclusion must be an included decision (current: " + inclusion + ")");
        }
        predecessors = List.copyOf(predecessors);
        artifactSources = List.copyOf(artifactSources);
    }

    public JobName name() {
        return definition.name();
    }
}
