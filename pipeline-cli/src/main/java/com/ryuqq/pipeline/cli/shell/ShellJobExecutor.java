package com.ryuqq.pipeline.cli.shell;

import com.ryuqq.pipeline.core.executor.ExecutionEnvironment;
import com.ryuqq.pipeline.core.executor.FileContent;
import com.ryuqq.pipeline.core.executor.JobExecutor;
import com.ryuqq.pipeline.core.executor.JobInstance;
import com.ryuqq.pipeline.core.executor.JobOutput;
import com.ryuqq.pipeline.core.outcome.Canceled;
import com.ryuqq.pipeline.core.outcome.ExecutionOutcome;
import com.ryuqq.pipeline.core.outcome.JobFailed;
import com.ryuqq.pipeline.core.outcome.Succeeded;
import com.ryuqq.pipeline.core.outcome.SystemFailed;
import com.ryuqq.pipeline.core.retry.FailureReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

/**
 * 로컬 셸로 Job script를 실행하는 {@link JobExecutor}.
 *
 * <p><strong>실행 방식:</strong></p>
 * <ul>
 *   <li>Job마다 {@code <workspaceRoot>/<pipelineId>/<job>} 작업 디렉터리를 만들고
 *       upstream 아티팩트와 캐시 파일을 기록합니다.</li>
 *   <li>script 전체를 하나의 스크립트 파일로 만들어 {@code <shell> -e <file>} 한 세션에서
 *       실행합니다. 앞 줄의 {@code export}, {@code cd}, {@code source}가 다음 줄에 유지됩니다.
 *       실행 환경 변수와 {@code CI_PROJECT_DIR}, {@code CI_JOB_NAME}, {@code CI_JOB_STAGE},
 *       {@code CI_PIPELINE_ID}가 프로세스 환경에 추가됩니다.</li>
 *   <li>실패한 명령에서 중단하고 실패한 줄 번호와 함께 {@code script_failure}를 보고합니다.
 *       줄 번호는 작업 디렉터리 밖의 상태 파일에 기록됩니다.</li>
 *   <li>작업 디렉터리의 모든 파일이 바이트 그대로 Job 출력이 됩니다.</li>
 * </ul>
 *
 * <p>{@code image}는 지원하지 않으며 호스트 셸에서 실행됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ShellJobExecutor implements JobExecutor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ShellJobExecutor.class);

    public static final String DEFAULT_SHELL = "sh";

    private static final String SCRIPT_DIRECTORY = ".scripts";

    private final Path workspaceRoot;
    private final Path projectDir;
    private final String shell;
    private final ExecutorService workers;
    private final Map<String, RunningJob> running = new ConcurrentHashMap<>();

    public ShellJobExecutor(Path workspaceRoot, Path projectDir) {
        this(workspaceRoot, projectDir, DEFAULT_SHELL);
    }

    public ShellJobExecutor(Path workspaceRoot, Path projectDir, String shell) {
        if (workspaceRoot == null) {
            throw new IllegalArgumentException("workspaceRoot cannot be null");
        }
        if (projectDir == null) {
            throw new IllegalArgumentException("projectDir cannot be null");
        }
        if (shell == null || shell.isBlank()) {
            throw new IllegalArgumentException("shell cannot be null or blank");
        }
        this.workspaceRoot = workspaceRoot.toAbsolutePath().normalize();
        this.projectDir = projectDir.toAbsolutePath().normalize();
        this.shell = shell;
        this.workers = Executors.newCachedThreadPool(new WorkerThreadFactory());
    }

    @Override
    public CompletableFuture<ExecutionOutcome> dispatch(JobInstance job, ExecutionEnvironment environment) {
        String id = job.id();
        RunningJob handle = new RunningJob();
        running.put(id, handle);
        return CompletableFuture
            .supplyAsync(() -> execute(job, environment, handle), workers)
            .whenComplete((outcome, error) -> running.remove(id, handle));
    }

    @Override
    public void cancel(JobInstance job) {
        RunningJob handle = running.get(job.id());
        if (handle != null) {
            log.info("Terminating job {}", job.id());
            handle.cancel();
        }
    }

    /**
     * 작업 디렉터리 경로.
     */
    public Path workspaceOf(JobInstance job) {
        return workspaceRoot
            .resolve(job.pipelineId().getValue())
            .resolve(directoryName(job.name().getValue()));
    }

    @Override
    public void close() {
        running.values().forEach(RunningJob::cancel);
        workers.shutdownNow();
    }

    private ExecutionOutcome execute(JobInstance job, ExecutionEnvironment environment, RunningJob handle) {
        if (environment.image() != null) {
            log.warn("Job {} declares image '{}'; running on the host shell instead", job.id(), environment.image());
        }

        Path workspace = workspaceOf(job);
        try {
            prepareWorkspace(job, workspace, environment.files());
        } catch (IOException | UncheckedIOException e) {
            return SystemFailed.of(FailureReason.RUNNER_SYSTEM_FAILURE,
                "Cannot prepare workspace " + workspace + ": " + e.getMessage());
        }

        List<String> script = environment.script();
        if (script.isEmpty()) {
            log.warn("Job {} has no script", job.id());
        }
        if (handle.isCanceled()) {
            return new Canceled("canceled before script start");
        }

        Path scriptFile = scriptDirectoryOf(job).resolve(directoryName(job.name().getValue()) + ".sh");
        Path lineFile = scriptDirectoryOf(job).resolve(directoryName(job.name().getValue()) + ".line");
        int exitCode;
        try {
            writeScript(script, scriptFile, lineFile);
            exitCode = runScript(job, environment, workspace, scriptFile, handle);
        } catch (IOException e) {
            return SystemFailed.of(FailureReason.RUNNER_SYSTEM_FAILURE,
                "Cannot run '" + shell + "': " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            handle.cancel();
            return new Canceled("interrupted");
        }

        if (handle.isCanceled()) {
            return new Canceled("canceled during script");
        }
        if (exitCode != 0) {
            return new JobFailed(FailureReason.SCRIPT_FAILURE, exitCode,
                failureMessage(script, lineFile, exitCode),
                collectOutput(job, workspace));
        }
        return Succeeded.of(collectOutput(job, workspace));
    }

    /**
     * 스크립트 파일 디렉터리. 작업 디렉터리 밖에 두어 Job 출력에 섞이지 않습니다.
     */
    private Path scriptDirectoryOf(JobInstance job) {
        return workspaceRoot.resolve(SCRIPT_DIRECTORY).resolve(job.pipelineId().getValue());
    }

    private static void writeScript(List<String> script, Path scriptFile, Path lineFile) throws IOException {
        Files.createDirectories(scriptFile.getParent());
        Files.deleteIfExists(lineFile);
        String marker = quote(lineFile.toString());

        StringBuilder content = new StringBuilder("set -e\n");
        for (int i = 0; i < script.size(); i++) {
            String line = script.get(i);
            content.append("printf '%s' ").append(i + 1).append(" > ").append(marker).append('\n');
            content.append("printf '%s\\n' ").append(quote("$ " + line)).append('\n');
            content.append(line).append('\n');
        }
        Files.writeString(scriptFile, content.toString(), StandardCharsets.UTF_8);
    }

    private static String failureMessage(List<String> script, Path lineFile, int exitCode) {
        int lineNumber = 0;
        try {
            if (Files.exists(lineFile)) {
                lineNumber = Integer.parseInt(Files.readString(lineFile, StandardCharsets.UTF_8).trim());
            }
        } catch (IOException | NumberFormatException e) {
            log.debug("Cannot read failed line number from {}", lineFile, e);
        }
        if (lineNumber < 1 || lineNumber > script.size()) {
            return "Script exited with code " + exitCode;
        }
        return "Script line " + lineNumber + " exited with code " + exitCode + ": " + script.get(lineNumber - 1);
    }

    // POSIX 셸 작은따옴표 인용
    private static String quote(String value) {
        return "'" + value.replace("'", "'\\''") + "'";
    }

    private int runScript(
        JobInstance job,
        ExecutionEnvironment environment,
        Path workspace,
        Path scriptFile,
        RunningJob handle
    ) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(shell, "-e", scriptFile.toString())
            .directory(workspace.toFile())
            .redirectErrorStream(true);
        Map<String, String> processEnvironment = builder.environment();
        processEnvironment.putAll(environment.variables());
        processEnvironment.put("CI_PROJECT_DIR", projectDir.toString());
        processEnvironment.put("CI_JOB_NAME", job.name().getValue());
        processEnvironment.put("CI_JOB_STAGE", job.definition().stage());
        processEnvironment.put("CI_PIPELINE_ID", job.pipelineId().getValue());

        Process process = builder.start();
        handle.attach(process);
        try (BufferedReader reader = new BufferedReader(
            new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String output;
            while ((output = reader.readLine()) != null) {
                log.info("[{}] {}", job.name(), output);
            }
        }
        return process.waitFor();
    }

    private void prepareWorkspace(JobInstance job, Path workspace, Map<String, FileContent> files) throws IOException {
        if (Files.exists(workspace)) {
            // 재시도는 빈 작업 디렉터리에서 시작
            try (Stream<Path> paths = Files.walk(workspace)) {
                for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                    Files.delete(path);
                }
            }
        }
        Files.createDirectories(workspace);
        for (Map.Entry<String, FileContent> file : files.entrySet()) {
            Path target = workspace.resolve(file.getKey()).normalize();
            if (!target.startsWith(workspace)) {
                log.warn("Job {}: ignoring input file outside the workspace: {}", job.id(), file.getKey());
                continue;
            }
            Files.createDirectories(target.getParent());
            Files.write(target, file.getValue().bytes());
        }
    }

    private JobOutput collectOutput(JobInstance job, Path workspace) {
        Map<String, FileContent> files = new LinkedHashMap<>();
        try (Stream<Path> paths = Files.walk(workspace)) {
            for (Path path : paths.filter(Files::isRegularFile).sorted().toList()) {
                String relative = workspace.relativize(path).toString().replace('\\', '/');
                files.put(relative, FileContent.of(Files.readAllBytes(path)));
            }
        } catch (IOException e) {
            log.warn("Job {}: cannot collect output files from {}", job.id(), workspace, e);
        }
        return JobOutput.of(files);
    }

    private static String directoryName(String jobName) {
        return jobName.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /**
     * 실행 중인 Job의 프로세스와 취소 상태.
     */
    private static final class RunningJob {

        private volatile boolean canceled;
        private Process process;

        synchronized void attach(Process process) {
            this.process = process;
            if (canceled) {
                terminate(process);
            }
        }

        synchronized void cancel() {
            canceled = true;
            if (process != null && process.isAlive()) {
                terminate(process);
            }
        }

        // 셸의 자식 프로세스 포함
        private static void terminate(Process process) {
            process.descendants().forEach(ProcessHandle::destroy);
            process.destroy();
        }

        boolean isCanceled() {
            return canceled;
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger sequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "pipeline-shell-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
