package com.ryuqq.pipeline.testkit.executor;

import com.ryuqq.pipeline.core.executor.ExecutionEnvironment;
import com.ryuqq.pipeline.core.executor.JobExecutor;
import com.ryuqq.pipeline.core.executor.JobInstance;
import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.outcome.Canceled;
import com.ryuqq.pipeline.core.outcome.ExecutionOutcome;
import com.ryuqq.pipeline.core.outcome.JobFailed;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.outcome.SystemFailed;
import com.ryuqq.pipeline.core.retry.FailureReason;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * 테스트용 JobExecutor.
 *
 * <p>Job 이름별로 시도 순서대로 동작({@link Step})을 지정합니다. 시도 횟수가 지정한 동작 수를
 * 넘으면 마지막 동작을 반복하고, 지정하지 않은 Job은 즉시 성공합니다.</p>
 *
 * <p><strong>사용 예:</strong></p>
 * <pre>
 * executor.when("test", Step.fail(1), Step.succeed());   // 첫 시도 실패, 재시도 성공
 * executor.when("deploy", Step.gated());                 // complete() 호출까지 대기
 * executor.when("slow", Step.after(Duration.ofMillis(100), Succeeded.of()));
 * </pre>
 *
 * <p>모든 디스패치와 취소 요청을 기록하며, 동시에 실행 중인 Job 수를 태그와
 * resource group별로 추적합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ScriptedJobExecutor implements JobExecutor {

    private static final long POLL_INTERVAL_MS = 5;

    private final Map<String, List<Step>> scripts = new ConcurrentHashMap<>();
    private final List<Dispatch> dispatches = new CopyOnWriteArrayList<>();
    private final List<String> cancelRequests = new CopyOnWriteArrayList<>();
    private final Map<String, Pending> pending = new ConcurrentHashMap<>();

    private final Object concurrencyLock = new Object();
    private final Map<String, JobInstance> running = new ConcurrentHashMap<>();
    private final Map<String, Integer> maxByTag = new ConcurrentHashMap<>();
    private final Map<String, Integer> maxByResourceGroup = new ConcurrentHashMap<>();
    private int maxConcurrent;

    /**
     * Job의 시도별 동작 지정.
     *
     * @param job Job 이름
     * @param steps 시도 순서의 동작 (1개 이상)
     * @return this
     */
    public ScriptedJobExecutor when(String job, Step... steps) {
        if (steps.length == 0) {
            throw new IllegalArgumentException("At least one step is required for job " + job);
        }
        scripts.put(job, List.copyOf(Arrays.asList(steps)));
        return this;
    }

    @Override
    public CompletableFuture<ExecutionOutcome> dispatch(JobInstance job, ExecutionEnvironment environment) {
        String name = job.name().getValue();
        int attempt = job.attemptCount();
        Step step = stepFor(name, attempt);
        dispatches.add(new Dispatch(name, attempt, environment, System.nanoTime()));

        CompletableFuture<ExecutionOutcome> future = step.start(environment);
        trackStart(job);
        pending.put(name, new Pending(future, step.acknowledgesCancel()));
        // 스케줄러 콜백은 동시 실행 집계가 끝난 뒤에 실행됨
        return future.whenComplete((outcome, error) -> trackEnd(job));
    }

    @Override
    public void cancel(JobInstance job) {
        String name = job.name().getValue();
        cancelRequests.add(name);
        Pending current = pending.get(name);
        if (current != null && current.acknowledgesCancel()) {
            current.future().complete(Canceled.of());
        }
    }

    /**
     * 대기 중인 Job의 최근 디스패치를 완료.
     *
     * @param job Job 이름
     * @param outcome 결과
     * @throws IllegalStateException 해당 Job이 디스패치된 적이 없는 경우
     */
    public void complete(String job, ExecutionOutcome outcome) {
        Pending current = pending.get(job);
        if (current == null) {
            throw new IllegalStateException("Job " + job + " has not been dispatched");
        }
        current.future().complete(outcome);
    }

    /**
     * Job이 지정한 횟수만큼 디스패치될 때까지 대기.
     *
     * @param job Job 이름
     * @param times 디스패치 횟수
     * @param timeout 최대 대기 시간
     * @return 제한 시간 안에 도달하면 true
     */
    public boolean awaitDispatch(String job, int times, Duration timeout) {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (dispatchCount(job) < times) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            try {
                TimeUnit.MILLISECONDS.sleep(POLL_INTERVAL_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
        }
        return true;
    }

    public boolean awaitDispatch(String job, Duration timeout) {
        return awaitDispatch(job, 1, timeout);
    }

    public List<Dispatch> dispatches() {
        return List.copyOf(dispatches);
    }

    /**
     * 디스패치된 Job 이름 (디스패치 순서, 재시도 포함).
     */
    public List<String> dispatchOrder() {
        return dispatches.stream().map(Dispatch::job).toList();
    }

    public int dispatchCount(String job) {
        return (int) dispatches.stream().filter(dispatch -> dispatch.job().equals(job)).count();
    }

    public boolean wasDispatched(String job) {
        return dispatchCount(job) > 0;
    }

    /**
     * Job의 가장 최근 실행 환경.
     *
     * @throws IllegalStateException 디스패치된 적이 없는 경우
     */
    public ExecutionEnvironment environmentOf(String job) {
        for (int i = dispatches.size() - 1; i >= 0; i--) {
            Dispatch dispatch = dispatches.get(i);
            if (dispatch.job().equals(job)) {
                return dispatch.environment();
            }
        }
        throw new IllegalStateException("Job " + job + " has not been dispatched");
    }

    public List<String> cancelRequests() {
        return List.copyOf(cancelRequests);
    }

    public int maxConcurrent() {
        synchronized (concurrencyLock) {
            return maxConcurrent;
        }
    }

    public int maxConcurrentWithTag(String tag) {
        return maxByTag.getOrDefault(tag, 0);
    }

    public int maxConcurrentInResourceGroup(String group) {
        return maxByResourceGroup.getOrDefault(group, 0);
    }

    private Step stepFor(String job, int attempt) {
        List<Step> steps = scripts.get(job);
        if (steps == null) {
            return Step.succeed();
        }
        int index = Math.min(Math.max(attempt, 1), steps.size()) - 1;
        return steps.get(index);
    }

    private void trackStart(JobInstance job) {
        synchronized (concurrencyLock) {
            running.put(job.id(), job);
            maxConcurrent = Math.max(maxConcurrent, running.size());
            Set<String> tags = Set.copyOf(job.definition().tags());
            for (String tag : tags) {
                long count = running.values().stream().filter(other -> other.definition().tags().contains(tag)).count();
                maxByTag.merge(tag, (int) count, Math::max);
            }
            String group = job.definition().resourceGroup();
            if (group != null) {
                long count = running.values().stream().filter(other -> group.equals(other.definition().resourceGroup())).count();
                maxByResourceGroup.merge(group, (int) count, Math::max);
            }
        }
    }

    private void trackEnd(JobInstance job) {
        synchronized (concurrencyLock) {
            running.remove(job.id());
        }
    }

    /**
     * 기록된 디스패치 한 건.
     *
     * @param job Job 이름
     * @param attempt 시도 번호 (1부터)
     * @param environment 실행 환경
     * @param dispatchedAtNanos {@link System#nanoTime()} 기준 디스패치 시각
     */
    public record Dispatch(String job, int attempt, ExecutionEnvironment environment, long dispatchedAtNanos) {
    }

    private record Pending(CompletableFuture<ExecutionOutcome> future, boolean acknowledgesCancel) {
    }

    /**
     * 한 번의 시도에 대한 동작.
     */
    public static final class Step {

        private final Function<ExecutionEnvironment, CompletableFuture<ExecutionOutcome>> body;
        private final boolean acknowledgesCancel;

        private Step(Function<ExecutionEnvironment, CompletableFuture<ExecutionOutcome>> body, boolean acknowledgesCancel) {
            this.body = body;
            this.acknowledgesCancel = acknowledgesCancel;
        }

        CompletableFuture<ExecutionOutcome> start(ExecutionEnvironment environment) {
            return body.apply(environment);
        }

        boolean acknowledgesCancel() {
            return acknowledgesCancel;
        }

        public static Step outcome(ExecutionOutcome outcome) {
            return new Step(environment -> CompletableFuture.completedFuture(outcome), true);
        }

        public static Step succeed() {
            return outcome(Succeeded.of());
        }

        /**
         * 파일을 남기고 성공.
         *
         * @param output 워크스페이스 파일
         */
        public static Step succeed(JobOutput output) {
            return outcome(Succeeded.of(output));
        }

        /**
         * 스크립트 실패 (exit code).
         */
        public static Step fail(int exitCode) {
            return outcome(JobFailed.script(exitCode, "exit code " + exitCode));
        }

        public static Step systemFailure(FailureReason reason) {
            return outcome(SystemFailed.of(reason, "simulated " + reason.wireValue()));
        }

        /**
         * 실행 환경을 보고 결과를 결정.
         */
        public static Step respond(Function<ExecutionEnvironment, ExecutionOutcome> responder) {
            return new Step(environment -> CompletableFuture.completedFuture(responder.apply(environment)), true);
        }

        /**
         * 지연 후 결과 반환. 취소 신호를 받으면 즉시 Canceled로 완료합니다.
         */
        public static Step after(Duration delay, ExecutionOutcome outcome) {
            return new Step(environment -> CompletableFuture.supplyAsync(() -> outcome,
                CompletableFuture.delayedExecutor(delay.toMillis(), TimeUnit.MILLISECONDS)), true);
        }

        /**
         * {@link ScriptedJobExecutor#complete} 또는 취소 신호까지 대기.
         */
        public static Step gated() {
            return new Step(environment -> new CompletableFuture<>(), true);
        }

        /**
         * 취소 신호를 무시하고 {@link ScriptedJobExecutor#complete}까지 대기.
         */
        public static Step unresponsive() {
            return new Step(environment -> new CompletableFuture<>(), false);
        }

        /**
         * dispatch 호출 자체가 예외를 던짐.
         */
        public static Step throwing(RuntimeException error) {
            return new Step(environment -> {
                throw error;
            }, true);
        }
    }

    @Override
    public String toString() {
        return "ScriptedJobExecutor{dispatches=" + dispatchOrder() + '}';
    }
}
