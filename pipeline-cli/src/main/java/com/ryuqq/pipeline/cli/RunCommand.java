package com.ryuqq.pipeline.cli;

import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryArtifactStore;
import com.ryuqq.pipeline.adapter.inmemory.store.InMemoryCacheStore;
import com.ryuqq.pipeline.adapter.runner.DagScheduler;
import com.ryuqq.pipeline.adapter.runner.SchedulerConfig;
import com.ryuqq.pipeline.adapter.yaml.DurationParser;
import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.application.scheduler.PipelineHandle;
import com.ryuqq.pipeline.application.scheduler.RunOptions;
import com.ryuqq.pipeline.cli.shell.ShellJobExecutor;
import com.ryuqq.pipeline.core.artifact.ArtifactBroker;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.graph.JobGraphBuilder;
import com.ryuqq.pipeline.core.protection.EnvironmentProtection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * {@code pipeline run}: Job 그래프를 로컬 셸에서 실행.
 *
 * <p>아티팩트와 캐시는 프로세스 메모리에만 보관되며 실행이 끝나면 사라집니다.
 * SIGINT/SIGTERM을 받으면 파이프라인을 취소하고 유예 시간 동안 종료를 기다립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "run",
    mixinStandardHelpOptions = true,
    description = "Runs the pipeline on the local shell and exits with its status (0 success, 1 failed, 2 canceled)."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RunCommand.class);

    @Spec
    CommandSpec spec;

    @Mixin
    ContextOptions context;

    @Option(names = "--play", paramLabel = "JOB", split = ",",
        description = "Manual job to start; repeatable or comma separated.")
    List<String> playedJobs = new ArrayList<>();

    @Option(names = "--concurrency", paramLabel = "N", defaultValue = "0",
        description = "Concurrent jobs without a configured tag; 0 is unlimited (default: ${DEFAULT-VALUE}).")
    int concurrency;

    @Option(names = "--tag-limit", paramLabel = "TAG=N",
        description = "Concurrent jobs for a runner tag; repeatable.")
    Map<String, Integer> tagLimits = new LinkedHashMap<>();

    @Option(names = "--job-timeout", paramLabel = "DURATION", defaultValue = "1h",
        description = "Timeout of jobs without their own timeout (default: ${DEFAULT-VALUE}).")
    String jobTimeout;

    @Option(names = "--grace-period", paramLabel = "DURATION", defaultValue = "30s",
        description = "Wait after a cancel signal before jobs are forced to canceled (default: ${DEFAULT-VALUE}).")
    String gracePeriod;

    @Option(names = "--protected-environment", paramLabel = "PATTERN", split = ",",
        description = "Protected environment name or prefix wildcard (production, review/*).")
    List<String> protectedEnvironments = new ArrayList<>();

    @Option(names = "--protected-ref", paramLabel = "PATTERN", split = ",",
        description = "Ref allowed to deploy to protected environments.")
    List<String> protectedRefs = new ArrayList<>();

    @Option(names = "--workspace", paramLabel = "DIR",
        description = "Directory for job workspaces (default: a new temporary directory).")
    Path workspace;

    @Option(names = "--project-dir", paramLabel = "DIR", defaultValue = ".",
        description = "Exported to jobs as CI_PROJECT_DIR (default: ${DEFAULT-VALUE}).")
    Path projectDir;

    @Option(names = "--shell", paramLabel = "SHELL", defaultValue = ShellJobExecutor.DEFAULT_SHELL,
        description = "Shell that runs each job script as one -e session (default: ${DEFAULT-VALUE}).")
    String shell;

    @Override
    public Integer call() throws Exception {
        JobGraph graph = JobGraphBuilder.build(context.loadDefinition(), context.toPipelineContext());
        SchedulerConfig config = schedulerConfig();
        Path workspaceRoot = workspace != null ? workspace : Files.createTempDirectory("pipeline-");
        log.info("Job workspaces under {}", workspaceRoot);

        ArtifactBroker broker = new ArtifactBroker(new InMemoryArtifactStore(), new InMemoryCacheStore());
        try (ShellJobExecutor executor = new ShellJobExecutor(workspaceRoot, projectDir, shell);
             DagScheduler scheduler = new DagScheduler(executor, broker, config)) {

            RunOptions options = RunOptions.defaults().withPlayedJobs(playedJobs.toArray(new String[0]));
            PipelineHandle handle = scheduler.submit(graph, options);
            Thread shutdownHook = new Thread(() -> cancelOnShutdown(handle, config.cancelGracePeriod()),
                "pipeline-shutdown");
            Runtime.getRuntime().addShutdownHook(shutdownHook);

            PipelineResult result;
            try {
                result = handle.await();
            } finally {
                removeShutdownHook(shutdownHook);
            }

            ResultPrinter.print(result, spec.commandLine().getOut());
            return result.exitCode();
        }
    }

    private SchedulerConfig schedulerConfig() {
        try {
            SchedulerConfig config = new SchedulerConfig()
                .withDefaultConcurrency(concurrency)
                .withDefaultJobTimeout(DurationParser.parse(jobTimeout))
                .withCancelGracePeriod(DurationParser.parse(gracePeriod))
                .withEnvironmentProtection(EnvironmentProtection.of(protectedEnvironments, protectedRefs));
            for (Map.Entry<String, Integer> limit : tagLimits.entrySet()) {
                config = config.withTagConcurrency(limit.getKey(), limit.getValue());
            }
            return config;
        } catch (IllegalArgumentException e) {
            throw new ParameterException(spec.commandLine(), e.getMessage(), e);
        }
    }

    private static void cancelOnShutdown(PipelineHandle handle, Duration gracePeriod) {
        if (handle.isDone()) {
            return;
        }
        log.warn("Shutdown requested, canceling pipeline {}", handle.pipelineId().getValue());
        handle.cancel("interrupted");
        try {
            handle.await(gracePeriod.plusSeconds(1));
        } catch (TimeoutException e) {
            log.warn("Pipeline {} did not finish within {}", handle.pipelineId().getValue(), gracePeriod);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void removeShutdownHook(Thread shutdownHook) {
        try {
            Runtime.getRuntime().removeShutdownHook(shutdownHook);
        } catch (IllegalStateException e) {
            // JVM 종료 중
            log.debug("Shutdown in progress, hook stays registered");
        }
    }
}
