package com.ryuqq.pipeline.application.result;

import com.ryuqq.pipeline.core.artifact.ArtifactReference;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 파이프라인 실행 결과.
 *
 * <p>jobs는 그래프의 위상 순서 뒤에 rules로 제외된 Job이 선언 순서로 이어집니다.</p>
 *
 * @param pipelineId 파이프라인 실행 ID
 * @param status 종료 상태
 * @param jobs Job별 결과
 * @param startedAt 시작 시각
 * @param finishedAt 종료 시각
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineResult(
    PipelineId pipelineId,
    PipelineStatus status,
    List<JobResult> jobs,
    Instant startedAt,
    Instant finishedAt
) {

    public PipelineResult {
        if (pipelineId == null) {
            throw new IllegalArgumentException("pipelineId cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("status cannot be null");
        }
        jobs = jobs == null ? List.of() : List.copyOf(jobs);
    }

    /**
     * 이름으로 Job 결과 조회.
     *
     * @param name Job 이름
     * @return Job 결과
     * @throws IllegalArgumentException 결과에 없는 Job인 경우
     */
    public JobResult job(String name) {
        return findJob(name).orElseThrow(() -> new IllegalArgumentException("No such job in result: " + name));
    }

    public Optional<JobResult> findJob(String name) {
        JobName jobName = JobName.of(name);
        return jobs.stream().filter(job -> job.name().equals(jobName)).findFirst();
    }

    public boolean isSuccess() {
        return status == PipelineStatus.SUCCESS;
    }

    /**
     * 성공했지만 allow_failure Job이 실패한 경우.
     */
    public boolean hasWarnings() {
        return jobs.stream().anyMatch(JobResult::isWarning);
    }

    public int exitCode() {
        return status.exitCode();
    }

    public List<ArtifactReference> artifacts() {
        return jobs.stream().map(JobResult::artifact).filter(Objects::nonNull).toList();
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
