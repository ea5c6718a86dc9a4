package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.application.result.JobResult;
import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.application.result.PipelineStatus;
import com.ryuqq.pipeline.application.scheduler.PipelineHandle;
import com.ryuqq.pipeline.application.scheduler.RunOptions;
import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.error.DependencyUnavailableException;
import com.ryuqq.pipeline.core.executor.ExecutionEnvironment;
import com.ryuqq.pipeline.core.executor.JobInstance;
import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.graph.JobNode;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;
import com.ryuqq.pipeline.core.model.VariableExpander;
import com.ryuqq.pipeline.core.outcome.Canceled;
import com.ryuqq.pipeline.core.outcome.ExecutionOutcome;
import com.ryuqq.pipeline.core.outcome.JobFailed;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.outcome.SystemFailed;
import com.ryuqq.pipeline.core.protection.Bulkhead;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.retry.RetryPolicy;
import com.ryuqq.pipeline.core.rule.JobInclusion;
import com.ryuqq.pipeline.core.statemachine.JobState;
import com.ryuqq.pipeline.core.statemachine.SkipReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 파이프라인 한 번의 실행 상태.
 *
 * <p>모든 상태 전이는 이 실행의 락 안에서 일어납니다. Executor 완료는 임의 스레드에서
 * 도착하며 락으로 직렬화됩니다. 다른 실행의 락은 절대 함께 잡지 않습니다.</p>
 *
 * <p>완료 콜백은 디스패치 시점의 시도 번호를 함께 받아, 강제 취소나 타임아웃 이후
 * 늦게 도착한 결과를 무시합니다.</p>
 */
final class PipelineRun implements PipelineHandle {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private final DagScheduler scheduler;
    private final JobGraph graph;
    private final RunOptions options;
    private final Map<JobName, JobInstance> jobs = new LinkedHashMap<>();
    private final Instant startedAt;
    private final CompletableFuture<PipelineResult> completion = new CompletableFuture<>();

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<JobName, List<Bulkhead>> heldSlots = new HashMap<>();
    private final Map<JobName, ScheduledFuture<?>> timeouts = new HashMap<>();
    private final Set<JobName> timedOut = new HashSet<>();
    private final Set<JobName> awaitingRetry = new HashSet<>();
    private boolean canceled;
    private String cancelReason;
    private boolean finished;

    PipelineRun(DagScheduler scheduler, JobGraph graph, RunOptions options) {
        this.scheduler = scheduler;
        this.graph = graph;
        this.options = options;
        this.startedAt = scheduler.clock().instant();
        for (JobNode node : graph.nodes()) {
            jobs.put(node.name(), new JobInstance(options.pipelineId(), node));
        }
    }

    @Override
    public PipelineId pipelineId() {
        return options.pipelineId();
    }

    @Override
    public CompletableFuture<PipelineResult> completion() {
        return completion;
    }

    @Override
    public List<JobResult> snapshot() {
        lock.lock();
        try {
            return results();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 진행 가능한 Job을 모두 진행시키고, 모든 Job이 종료되었으면 결과를 완료합니다.
     */
    void pump() {
        PipelineResult result = null;
        lock.lock();
        try {
            if (finished) {
                return;
            }
            advance();
            result = finishIfTerminal();
        } finally {
            lock.unlock();
        }
        if (result != null) {
            scheduler.unregister(this);
            log.info("Pipeline {} finished: status={}, duration={}",
                pipelineId().getValue(), result.status(), result.duration());
            completion.complete(result);
        }
    }

    private void advance() {
        boolean progress = true;
        while (progress) {
            progress = false;
            for (JobInstance job : jobs.values()) {
                if (job.state() == JobState.PENDING) {
                    progress |= evaluatePending(job);
                }
                if (job.state() == JobState.READY && !awaitingRetry.contains(job.name())) {
                    progress |= tryDispatch(job);
                }
            }
        }
    }

    // ============================================================
    // PENDING → READY / SKIPPED
    // ============================================================

    private boolean evaluatePending(JobInstance job) {
        boolean upstreamFailed = false;
        boolean upstreamCanceled = false;
        Set<JobName> skippedUpstream = new HashSet<>();
        for (JobName predecessor : job.node().predecessors()) {
            JobInstance upstream = jobs.get(predecessor);
            JobState state = upstream.state();
            if (!state.isTerminal()) {
                return false;
            }
            if (state == JobState.FAILED) {
                upstreamFailed |= !upstream.definition().allowFailure();
            } else if (state == JobState.CANCELED) {
                upstreamCanceled = true;
            } else if (state == JobState.SKIPPED) {
                if (upstream.skipReason().isLegitimate()) {
                    skippedUpstream.add(predecessor);
                } else {
                    upstreamFailed = true;
                }
            }
        }

        JobInclusion inclusion = job.node().inclusion();
        Instant now = scheduler.clock().instant();
        // when: always 포함
        if (upstreamCanceled) {
            job.cancel("upstream job canceled", now);
            log.info("Job {} canceled: upstream canceled", job.id());
            return true;
        }
        if (inclusion != JobInclusion.ALWAYS) {
            if (upstreamFailed) {
                job.skip(SkipReason.UPSTREAM_FAILED, now);
                log.info("Job {} skipped: upstream failed", job.id());
                return true;
            }
            // 필수 아티팩트의 생산자가 skip되었으면 디스패치에서 missing_dependency_failure
            if (!skippedUpstream.isEmpty() && job.definition().hasNeeds()
                && !requiresArtifactsOf(job, skippedUpstream)) {
                job.skip(SkipReason.UPSTREAM_SKIPPED, now);
                log.info("Job {} skipped: a needed job was skipped", job.id());
                return true;
            }
            if (inclusion == JobInclusion.MANUAL && !options.isPlayed(job.name())) {
                job.skip(SkipReason.MANUAL_NOT_PLAYED, now);
                log.info("Job {} skipped: manual job not played", job.id());
                return true;
            }
        }
        job.transitionTo(JobState.READY);
        log.debug("Job {} ready", job.id());
        return true;
    }

    private static boolean requiresArtifactsOf(JobInstance job, Set<JobName> producers) {
        return job.node().artifactSources().stream()
            .anyMatch(source -> source.required() && producers.contains(source.job()));
    }

    // ============================================================
    // READY → RUNNING / FAILED (디스패치 전 실패)
    // ============================================================

    private boolean tryDispatch(JobInstance job) {
        JobDefinition definition = job.definition();
        Map<String, String> contextVariables = graph.context().allVariables();

        String environment = VariableExpander.expand(definition.environment(), contextVariables);
        if (!scheduler.config().environmentProtection().isAllowed(environment, graph.context().refName())) {
            failBeforeDispatch(job, FailureReason.PROTECTED_ENVIRONMENT_FAILURE,
                "Ref '" + graph.context().refName() + "' may not deploy to protected environment '" + environment + "'");
            return true;
        }

        if (!acquireSlots(job, contextVariables)) {
            return false;
        }

        ExecutionEnvironment executionEnvironment;
        try {
            executionEnvironment = scheduler.broker().prepare(job, graph.context());
        } catch (DependencyUnavailableException e) {
            releaseSlots(job.name());
            failBeforeDispatch(job, FailureReason.MISSING_DEPENDENCY_FAILURE, e.getMessage());
            return true;
        } catch (RuntimeException e) {
            releaseSlots(job.name());
            log.error("Failed to prepare environment of job {}", job.id(), e);
            failBeforeDispatch(job, FailureReason.DATA_INTEGRITY_FAILURE,
                "Failed to prepare artifacts or cache: " + describe(e));
            return true;
        }

        job.start(executionEnvironment, scheduler.clock().instant());
        int attempt = job.attemptCount();
        scheduleTimeout(job, attempt);
        log.info("Job {} dispatched (attempt {})", job.id(), attempt);

        CompletableFuture<ExecutionOutcome> future;
        try {
            future = scheduler.executor().dispatch(job, executionEnvironment);
            if (future == null) {
                future = CompletableFuture.failedFuture(new IllegalStateException("Executor returned no future"));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        JobName name = job.name();
        future.whenCompleteAsync((outcome, error) -> onCompletion(name, attempt, outcome, error),
            scheduler.callbackExecutor());
        return true;
    }

    private void failBeforeDispatch(JobInstance job, FailureReason reason, String message) {
        job.fail(reason, message, scheduler.clock().instant());
        log.warn("Job {} failed before dispatch ({}): {}", job.id(), reason.wireValue(), message);
    }

    private boolean acquireSlots(JobInstance job, Map<String, String> contextVariables) {
        List<Bulkhead> required = new ArrayList<>();
        String resourceGroup = VariableExpander.expand(job.definition().resourceGroup(), contextVariables);
        if (resourceGroup != null && !resourceGroup.isBlank()) {
            required.add(scheduler.resourceGroup(resourceGroup));
        }
        List<String> tags = job.definition().tags();
        if (tags.isEmpty()) {
            required.add(scheduler.tagPool(null));
        } else {
            tags.forEach(tag -> required.add(scheduler.tagPool(tag)));
        }

        List<Bulkhead> acquired = new ArrayList<>();
        for (Bulkhead bulkhead : required) {
            if (!bulkhead.tryAcquire(job.id())) {
                acquired.forEach(held -> held.release(job.id()));
                return false;
            }
            acquired.add(bulkhead);
        }
        heldSlots.put(job.name(), acquired);
        return true;
    }

    private void releaseSlots(JobName name) {
        List<Bulkhead> held = heldSlots.remove(name);
        if (held != null) {
            String holder = jobs.get(name).id();
            held.forEach(bulkhead -> bulkhead.release(holder));
        }
    }

    private void scheduleTimeout(JobInstance job, int attempt) {
        Duration timeout = job.definition().timeout() != null
            ? job.definition().timeout()
            : scheduler.config().defaultJobTimeout();
        if (timeout == null) {
            return;
        }
        JobName name = job.name();
        timeouts.put(name, scheduler.schedule(() -> onTimeout(name, attempt, timeout), timeout));
    }

    private void cancelTimeout(JobName name) {
        ScheduledFuture<?> timeout = timeouts.remove(name);
        if (timeout != null) {
            timeout.cancel(false);
        }
    }

    // ============================================================
    // RUNNING → 종료 (Executor 완료)
    // ============================================================

    private void onCompletion(JobName name, int attempt, ExecutionOutcome outcome, Throwable error) {
        lock.lock();
        try {
            JobInstance job = jobs.get(name);
            if (job.state() != JobState.RUNNING || job.attemptCount() != attempt) {
                log.debug("Ignoring late outcome of {} attempt {} (state={})", job.id(), attempt, job.state());
                return;
            }
            cancelTimeout(name);
            releaseSlots(name);

            ExecutionOutcome result = outcome;
            if (error != null) {
                Throwable cause = error instanceof CompletionException && error.getCause() != null
                    ? error.getCause()
                    : error;
                log.warn("Executor failed for job {}", job.id(), cause);
                result = SystemFailed.of(FailureReason.API_FAILURE, "Executor error: " + describe(cause));
            } else if (result == null) {
                result = SystemFailed.of(FailureReason.API_FAILURE, "Executor completed without an outcome");
            }
            applyOutcome(job, result);
        } finally {
            lock.unlock();
        }
        scheduler.wakeAll();
    }

    private void applyOutcome(JobInstance job, ExecutionOutcome outcome) {
        Instant now = scheduler.clock().instant();
        boolean timeoutExpired = timedOut.remove(job.name());

        if (outcome instanceof Succeeded succeeded) {
            publishArtifacts(job, succeeded.output(), true);
            saveCache(job, succeeded.output());
            job.succeed(now);
            log.info("Job {} succeeded (attempt {})", job.id(), job.attemptCount());
        } else if (timeoutExpired) {
            handleFailure(job, FailureReason.JOB_EXECUTION_TIMEOUT, timeoutMessage(job), outcome.output());
        } else if (outcome instanceof Canceled canceledOutcome) {
            job.cancel(canceled ? cancelReason : canceledOutcome.message(), now);
            log.info("Job {} canceled", job.id());
        } else if (outcome instanceof JobFailed jobFailed) {
            handleFailure(job, jobFailed.reason(), jobFailed.message(), jobFailed.output());
        } else if (outcome instanceof SystemFailed systemFailed) {
            handleFailure(job, systemFailed.reason(), systemFailed.message(), JobOutput.EMPTY);
        }
    }

    private void handleFailure(JobInstance job, FailureReason reason, String message, JobOutput output) {
        publishArtifacts(job, output, false);
        job.fail(reason, message, scheduler.clock().instant());

        if (!canceled && RetryPolicy.shouldRetry(job.definition().retry(), reason, job.attemptCount())) {
            job.requeue();
            long delayMs = scheduler.backoffCalculator().calculate(job.attemptCount());
            log.info("Job {} failed ({}), retrying after {}ms (attempt {} of {})", job.id(), reason.wireValue(),
                delayMs, job.attemptCount() + 1, job.definition().retry().effectiveMax() + 1);
            if (delayMs > 0) {
                JobName name = job.name();
                awaitingRetry.add(name);
                scheduler.schedule(() -> releaseRetry(name), Duration.ofMillis(delayMs));
            }
            return;
        }

        if (job.definition().allowFailure()) {
            log.warn("Job {} failed ({}) and is allowed to fail: {}", job.id(), reason.wireValue(), message);
        } else {
            log.warn("Job {} failed ({}) after {} attempt(s): {}", job.id(), reason.wireValue(),
                job.attemptCount(), message);
        }
    }

    private void releaseRetry(JobName name) {
        lock.lock();
        try {
            awaitingRetry.remove(name);
        } finally {
            lock.unlock();
        }
        pump();
    }

    private void publishArtifacts(JobInstance job, JobOutput output, boolean succeeded) {
        try {
            scheduler.broker().publish(job, output, succeeded);
        } catch (RuntimeException e) {
            log.error("Failed to publish artifacts of job {}", job.id(), e);
        }
    }

    private void saveCache(JobInstance job, JobOutput output) {
        try {
            scheduler.broker().saveCache(job, output);
        } catch (RuntimeException e) {
            log.warn("Failed to save cache of job {}", job.id(), e);
        }
    }

    // ============================================================
    // 타임아웃
    // ============================================================

    private void onTimeout(JobName name, int attempt, Duration timeout) {
        JobInstance job;
        lock.lock();
        try {
            job = jobs.get(name);
            if (job.state() != JobState.RUNNING || job.attemptCount() != attempt) {
                return;
            }
            timeouts.remove(name);
            timedOut.add(name);
            log.warn("Job {} exceeded timeout {}, sending cancel signal", job.id(), timeout);
        } finally {
            lock.unlock();
        }
        signalCancel(job);
        scheduler.schedule(() -> forceTimeout(name, attempt), scheduler.config().cancelGracePeriod());
    }

    private void forceTimeout(JobName name, int attempt) {
        lock.lock();
        try {
            JobInstance job = jobs.get(name);
            if (job.state() != JobState.RUNNING || job.attemptCount() != attempt) {
                return;
            }
            log.warn("Job {} did not stop within grace period after timeout", job.id());
            releaseSlots(name);
            timedOut.remove(name);
            handleFailure(job, FailureReason.JOB_EXECUTION_TIMEOUT, timeoutMessage(job), JobOutput.EMPTY);
        } finally {
            lock.unlock();
        }
        scheduler.wakeAll();
    }

    private String timeoutMessage(JobInstance job) {
        Duration timeout = job.definition().timeout() != null
            ? job.definition().timeout()
            : scheduler.config().defaultJobTimeout();
        return "Job exceeded timeout of " + timeout;
    }

    // ============================================================
    // 취소
    // ============================================================

    @Override
    public void cancel(String reason) {
        List<JobInstance> running = new ArrayList<>();
        lock.lock();
        try {
            if (finished || canceled) {
                return;
            }
            canceled = true;
            cancelReason = reason == null || reason.isBlank() ? "pipeline canceled" : reason;
            log.info("Pipeline {} cancel requested: {}", pipelineId().getValue(), cancelReason);

            Instant now = scheduler.clock().instant();
            awaitingRetry.clear();
            for (JobInstance job : jobs.values()) {
                if (job.state() == JobState.PENDING || job.state() == JobState.READY) {
                    job.cancel(cancelReason, now);
                } else if (job.state() == JobState.RUNNING) {
                    running.add(job);
                }
            }
        } finally {
            lock.unlock();
        }

        for (JobInstance job : running) {
            int attempt = job.attemptCount();
            signalCancel(job);
            scheduler.schedule(() -> forceCancel(job.name(), attempt), scheduler.config().cancelGracePeriod());
        }
        pump();
    }

    private void forceCancel(JobName name, int attempt) {
        lock.lock();
        try {
            JobInstance job = jobs.get(name);
            if (job.state() != JobState.RUNNING || job.attemptCount() != attempt) {
                return;
            }
            log.warn("Job {} did not acknowledge cancellation within {}, forcing CANCELED",
                job.id(), scheduler.config().cancelGracePeriod());
            cancelTimeout(name);
            releaseSlots(name);
            timedOut.remove(name);
            job.cancel(cancelReason + " (forced after grace period)", scheduler.clock().instant());
        } finally {
            lock.unlock();
        }
        scheduler.wakeAll();
    }

    private void signalCancel(JobInstance job) {
        try {
            scheduler.executor().cancel(job);
        } catch (RuntimeException e) {
            log.warn("Executor failed to cancel job {}", job.id(), e);
        }
    }

    // ============================================================
    // 결과
    // ============================================================

    private PipelineResult finishIfTerminal() {
        for (JobInstance job : jobs.values()) {
            if (!job.state().isTerminal()) {
                return null;
            }
        }
        finished = true;
        List<JobResult> results = results();
        return new PipelineResult(
            pipelineId(),
            PipelineStatus.evaluate(results, canceled),
            results,
            startedAt,
            scheduler.clock().instant()
        );
    }

    private List<JobResult> results() {
        List<JobResult> results = new ArrayList<>(jobs.size() + graph.excluded().size());
        jobs.values().forEach(job -> results.add(JobResult.from(job)));
        graph.excluded().forEach(definition -> results.add(JobResult.excluded(definition)));
        return results;
    }

    private static String describe(Throwable error) {
        return error.getMessage() == null ? error.getClass().getSimpleName() : error.getMessage();
    }

    @Override
    public String toString() {
        return "PipelineRun{" + pipelineId().getValue() + ", jobs=" + jobs.size() + ", canceled=" + canceled + '}';
    }
}
