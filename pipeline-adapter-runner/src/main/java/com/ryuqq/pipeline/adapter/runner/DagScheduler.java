package com.ryuqq.pipeline.adapter.runner;

import com.ryuqq.pipeline.application.scheduler.PipelineHandle;
import com.ryuqq.pipeline.application.scheduler.RunOptions;
import com.ryuqq.pipeline.application.scheduler.Scheduler;
import com.ryuqq.pipeline.core.artifact.ArtifactBroker;
import com.ryuqq.pipeline.core.executor.JobExecutor;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.protection.Bulkhead;
import com.ryuqq.pipeline.core.protection.BulkheadConfig;
import com.ryuqq.pipeline.core.protection.noop.NoOpBulkhead;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Job 완료 이벤트로 구동되는 반응형 DAG 스케줄러.
 *
 * <p><strong>동작 방식:</strong></p>
 * <pre>
 * submit(graph)
 *   ↓
 * pump: PENDING → READY (선행 Job이 모두 종료) 또는 SKIPPED
 *       READY → environment 검사 → 슬롯 획득 → 아티팩트/캐시 준비 → dispatch (RUNNING)
 *   ↓
 * Executor 완료 (임의 스레드) → 파이프라인 락 안에서 결과 반영
 *   ├─ Succeeded → 아티팩트 발행, 캐시 저장, SUCCESS
 *   ├─ JobFailed / SystemFailed → RetryPolicy → READY (재시도) 또는 FAILED
 *   └─ Canceled → CANCELED (타임아웃이면 JOB_EXECUTION_TIMEOUT 실패)
 *   ↓
 * 슬롯이 반환되면 모든 실행 중 파이프라인을 다시 pump
 * </pre>
 *
 * <p><strong>공유 자원:</strong> 태그 풀과 resource group은 이 스케줄러로 실행되는
 * 모든 파이프라인이 공유합니다. 타이머(타임아웃, 취소 유예, 재시도 backoff)와 완료 처리는
 * 하나의 {@link ScheduledExecutorService}에서 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class DagScheduler implements Scheduler, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DagScheduler.class);

    private final JobExecutor executor;
    private final ArtifactBroker broker;
    private final SchedulerConfig config;
    private final BackoffCalculator backoffCalculator;
    private final Clock clock;
    private final ScheduledExecutorService timers;

    private final Map<String, Bulkhead> tagPools = new ConcurrentHashMap<>();
    private final Map<String, Bulkhead> resourceGroups = new ConcurrentHashMap<>();
    private final Bulkhead defaultPool;
    private final Set<PipelineRun> activeRuns = ConcurrentHashMap.newKeySet();

    public DagScheduler(JobExecutor executor, ArtifactBroker broker, SchedulerConfig config) {
        this(executor, broker, config, BackoffCalculator.none(), Clock.systemUTC());
    }

    public DagScheduler(
        JobExecutor executor,
        ArtifactBroker broker,
        SchedulerConfig config,
        BackoffCalculator backoffCalculator,
        Clock clock
    ) {
        if (executor == null) {
            throw new IllegalArgumentException("executor cannot be null");
        }
        if (broker == null) {
            throw new IllegalArgumentException("broker cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.executor = executor;
        this.broker = broker;
        this.config = config;
        this.backoffCalculator = backoffCalculator;
        this.clock = clock;
        this.timers = Executors.newScheduledThreadPool(config.timerThreads(), new SchedulerThreadFactory());
        this.defaultPool = newPool("(untagged)", config.concurrencyOf(null));
    }

    @Override
    public PipelineHandle submit(JobGraph graph, RunOptions options) {
        if (graph == null) {
            throw new IllegalArgumentException("graph cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }
        if (timers.isShutdown()) {
            throw new IllegalStateException("Scheduler is closed");
        }
        PipelineRun run = new PipelineRun(this, graph, options);
        activeRuns.add(run);
        log.info("Pipeline {} submitted: ref={}, source={}, {} jobs, {} excluded",
            options.pipelineId().getValue(), graph.context().refName(), graph.context().source().wireValue(),
            graph.size(), graph.excluded().size());
        run.pump();
        return run;
    }

    /**
     * 실행 중인 모든 파이프라인을 다시 pump (슬롯 반환 후 대기 중인 Job 디스패치).
     */
    void wakeAll() {
        for (PipelineRun run : activeRuns) {
            run.pump();
        }
    }

    void unregister(PipelineRun run) {
        activeRuns.remove(run);
    }

    /**
     * 태그 풀 조회 (없으면 설정에 따라 생성).
     *
     * @param tag 태그 (null이면 태그 없는 Job의 풀)
     */
    Bulkhead tagPool(String tag) {
        if (tag == null) {
            return defaultPool;
        }
        return tagPools.computeIfAbsent(tag, name -> newPool("tag:" + name, config.concurrencyOf(name)));
    }

    Bulkhead resourceGroup(String group) {
        return resourceGroups.computeIfAbsent(group,
            name -> new SemaphoreBulkhead("resource_group:" + name, new BulkheadConfig(1)));
    }

    private static Bulkhead newPool(String name, int limit) {
        if (limit == SchedulerConfig.UNLIMITED) {
            return NoOpBulkhead.INSTANCE;
        }
        return new SemaphoreBulkhead(name, new BulkheadConfig(limit));
    }

    /**
     * 타이머 등록. 작업 중 발생한 예외는 로그로 남깁니다.
     */
    ScheduledFuture<?> schedule(Runnable task, Duration delay) {
        return timers.schedule(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Scheduler timer task failed", e);
            }
        }, Math.max(0, delay.toMillis()), TimeUnit.MILLISECONDS);
    }

    ScheduledExecutorService callbackExecutor() {
        return timers;
    }

    JobExecutor executor() {
        return executor;
    }

    ArtifactBroker broker() {
        return broker;
    }

    SchedulerConfig config() {
        return config;
    }

    BackoffCalculator backoffCalculator() {
        return backoffCalculator;
    }

    Clock clock() {
        return clock;
    }

    /**
     * 현재 실행 중인 파이프라인 수.
     */
    public int activePipelines() {
        return activeRuns.size();
    }

    /**
     * 스케줄러 종료.
     *
     * <p>실행 중인 파이프라인을 취소하고 타이머 스레드를 정리합니다.</p>
     */
    @Override
    public void close() {
        for (PipelineRun run : List.copyOf(activeRuns)) {
            run.cancel("scheduler shutting down");
        }
        timers.shutdown();
        try {
            if (!timers.awaitTermination(config.cancelGracePeriod().toMillis(), TimeUnit.MILLISECONDS)) {
                timers.shutdownNow();
            }
        } catch (InterruptedException e) {
            timers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class SchedulerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pipeline-scheduler-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
