package com.ryuqq.pipeline.core.artifact;

import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;

import java.time.Instant;
import java.util.List;

/**
 * 발행된 아티팩트에 대한 참조 (파이프라인 결과에 포함).
 *
 * @param pipelineId 생산한 파이프라인
 * @param job 생산한 Job
 * @param name 아티팩트 이름 (변수 확장 후)
 * @param paths 수집된 파일 경로
 * @param createdAt 발행 시각
 * @param expiresAt 만료 시각 (null이면 만료 없음)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record ArtifactReference(
    PipelineId pipelineId,
    JobName job,
    String name,
    List<String> paths,
    Instant createdAt,
    Instant expiresAt
) {

    public ArtifactReference {
        if (pipelineId == null) {
            throw new IllegalArgumentException("pipelineId cannot be null");
        }
        if (job == null) {
            throw new IllegalArgumentException("job cannot be null");
        }
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    /**
     * 보존 기간이 지났는지 확인.
     *
     * @param now 현재 시각
     * @return expiresAt이 now 이전이거나 같으면 true
     */
    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
