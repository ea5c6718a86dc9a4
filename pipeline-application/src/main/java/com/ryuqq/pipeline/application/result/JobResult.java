package com.ryuqq.pipeline.application.result;

import com.ryuqq.pipeline.core.artifact.ArtifactReference;
import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.executor.JobInstance;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.statemachine.JobState;
import com.ryuqq.pipeline.core.statemachine.SkipReason;

import java.time.Duration;
import java.time.Instant;

/**
 * 한 Job의 실행 결과 (또는 실행 중 스냅샷).
 *
 * @param name Job 이름
 * @param stage stage 이름
 * @param state 상태
 * @param skipReason SKIPPED 사유 (아니면 null)
 * @param failureReason 실패 사유 (아니면 null)
 * @param message 실패/취소 메시지 (없으면 null)
 * @param attempts 디스패치 횟수
 * @param allowFailure allow_failure 여부
 * @param startedAt 첫 디스패치 시각 (없으면 null)
 * @param finishedAt 종료 시각 (없으면 null)
 * @param artifact 발행된 아티팩트 (없으면 null)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobResult(
    JobName name,
    String stage,
    JobState state,
    SkipReason skipReason,
    FailureReason failureReason,
    String message,
    int attempts,
    boolean allowFailure,
    Instant startedAt,
    Instant finishedAt,
    ArtifactReference artifact
) {

    public JobResult {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (state == null) {
            throw new IllegalArgumentException("state cannot be null");
        }
        if (state == JobState.SKIPPED && skipReason == null) {
            throw new IllegalArgumentException("skipReason is required for SKIPPED job " + name);
        }
    }

    public static JobResult from(JobInstance job) {
        return new JobResult(
            job.name(),
            job.definition().stage(),
            job.state(),
            job.skipReason(),
            job.failureReason(),
            job.message(),
            job.attemptCount(),
            job.definition().allowFailure(),
            job.startedAt(),
            job.finishedAt(),
            job.artifact()
        );
    }

    /**
     * rules로 제외된 Job의 결과.
     */
    public static JobResult excluded(JobDefinition definition) {
        return new JobResult(definition.name(), definition.stage(), JobState.SKIPPED, SkipReason.RULES_EXCLUDED,
            null, null, 0, definition.allowFailure(), null, null, null);
    }

    public boolean isSuccess() {
        return state == JobState.SUCCESS;
    }

    public boolean isLegitimatelySkipped() {
        return state == JobState.SKIPPED && skipReason.isLegitimate();
    }

    /**
     * 이 Job 때문에 파이프라인이 SUCCESS가 될 수 없는지 확인.
     */
    public boolean blocksSuccess() {
        return !allowFailure && !isSuccess() && !isLegitimatelySkipped();
    }

    /**
     * allow_failure Job이 실패했는지 확인.
     */
    public boolean isWarning() {
        return allowFailure && state == JobState.FAILED;
    }

    public Duration duration() {
        if (startedAt == null || finishedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, finishedAt);
    }
}
