package com.ryuqq.pipeline.core.executor;

import com.ryuqq.pipeline.core.artifact.ArtifactReference;
import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.graph.JobNode;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.statemachine.JobState;
import com.ryuqq.pipeline.core.statemachine.SkipReason;
import com.ryuqq.pipeline.core.statemachine.StateTransition;

import java.time.Instant;

/**
 * 한 번의 파이프라인 실행에서 Job의 실행 상태.
 *
 * <p>상태 변경은 스케줄러의 파이프라인 락 안에서만 일어나며, 필드는 volatile이라
 * 다른 스레드(Executor, 조회 API)에서 안전하게 읽을 수 있습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobInstance {

    private final PipelineId pipelineId;
    private final JobNode node;

    private volatile JobState state = JobState.PENDING;
    private volatile int attemptCount;
    private volatile SkipReason skipReason;
    private volatile FailureReason failureReason;
    private volatile String message;
    private volatile Instant startedAt;
    private volatile Instant finishedAt;
    private volatile ExecutionEnvironment environment;
    private volatile ArtifactReference artifact;

    public JobInstance(PipelineId pipelineId, JobNode node) {
        if (pipelineId == null) {
            throw new IllegalArgumentException("pipelineId cannot be null");
        }
        if (node == null) {
            throw new IllegalArgumentException("node cannot be null");
        }
        this.pipelineId = pipelineId;
        this.node = node;
    }

    /**
     * 상태 전이 (검증 후).
     *
     * @param next 다음 상태
     * @throws IllegalStateException 허용되지 않은 전이인 경우
     */
    public void transitionTo(JobState next) {
        this.state = StateTransition.transition(state, next);
    }

    /**
     * 디스패치 직전 호출: RUNNING 전이, 시도 횟수 증가, 실행 환경 기록.
     *
     * @param environment 이번 시도의 실행 환경
     * @param now 시작 시각
     */
    public void start(ExecutionEnvironment environment, Instant now) {
        transitionTo(JobState.RUNNING);
        this.attemptCount++;
        this.environment = environment;
        if (startedAt == null) {
            startedAt = now;
        }
        this.failureReason = null;
        this.message = null;
    }

    public void succeed(Instant now) {
        transitionTo(JobState.SUCCESS);
        this.finishedAt = now;
    }

    public void fail(FailureReason reason, String message, Instant now) {
        transitionTo(JobState.FAILED);
        this.failureReason = reason;
        this.message = message;
        this.finishedAt = now;
    }

    /**
     * 재시도를 위해 FAILED에서 READY로 되돌림.
     */
    public void requeue() {
        transitionTo(JobState.READY);
        this.finishedAt = null;
    }

    public void skip(SkipReason reason, Instant now) {
        transitionTo(JobState.SKIPPED);
        this.skipReason = reason;
        this.finishedAt = now;
    }

    public void cancel(String message, Instant now) {
        transitionTo(JobState.CANCELED);
        this.message = message;
        this.finishedAt = now;
    }

    public void attachArtifact(ArtifactReference artifact) {
        this.artifact = artifact;
    }

    public String id() {
        return pipelineId.getValue() + "/" + node.name().getValue();
    }

    public PipelineId pipelineId() {
        return pipelineId;
    }

    public JobNode node() {
        return node;
    }

    public JobName name() {
        return node.name();
    }

    public JobDefinition definition() {
        return node.definition();
    }

    public JobState state() {
        return state;
    }

    /**
     * 지금까지의 디스패치 횟수.
     */
    public int attemptCount() {
        return attemptCount;
    }

    public SkipReason skipReason() {
        return skipReason;
    }

    public FailureReason failureReason() {
        return failureReason;
    }

    public String message() {
        return message;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant finishedAt() {
        return finishedAt;
    }

    /**
     * 마지막 디스패치의 실행 환경.
     *
     * @return 아직 디스패치되지 않았으면 null
     */
    public ExecutionEnvironment environment() {
        return environment;
    }

    public ArtifactReference artifact() {
        return artifact;
    }

    @Override
    public String toString() {
        return "JobInstance{" + id() + ", state=" + state + ", attempts=" + attemptCount + '}';
    }
}
