package com.ryuqq.pipeline.cli;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * PipelineCommand 통합 테스트.
 *
 * <p>정의 파일을 임시 디렉터리에 쓰고 명령을 실행하여 종료 코드와 출력을 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@DisabledOnOs(OS.WINDOWS)
class PipelineCommandTest {

    private static final String PIPELINE = """
        stages: [build, test]
        compile:
          stage: build
          script: echo compile
        unit:
          stage: test
          script: echo unit
        nightly:
          stage: test
          rules:
            - if: '$CI_PIPELINE_SOURCE == "schedule"'
          script: echo nightly
        """;

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        commandLine = PipelineCommand.newCommandLine();
        commandLine.setOut(new PrintWriter(out));
        commandLine.setErr(new PrintWriter(err));
    }

    private Path definition(String yaml) throws IOException {
        return Files.writeString(tempDir.resolve("pipeline.yml"), yaml, StandardCharsets.UTF_8);
    }

    private int run(String... args) {
        return commandLine.execute(args);
    }

    private String[] runArgs(Path file, String... extra) {
        String[] base = {"run", "-f", file.toString(), "--workspace", tempDir.resolve("ws").toString(),
            "--project-dir", tempDir.toString()};
        String[] args = new String[base.length + extra.length];
        System.arraycopy(base, 0, args, 0, base.length);
        System.arraycopy(extra, 0, args, base.length, extra.length);
        return args;
    }

    // ============================================================
    // plan
    // ============================================================

    @Test
    void plan은_stage별_Job과_대기_대상을_출력() throws IOException {
        Path file = definition(PIPELINE);

        int exitCode = run("plan", "-f", file.toString());

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("Pipeline for main (source: push), 2 job(s)")
            .contains("stage build")
            .contains("compile [on_success]")
            .contains("unit [on_success] <- compile")
            .contains("excluded by rules: nightly");
    }

    @Test
    void plan은_source에_따라_rules를_평가() throws IOException {
        Path file = definition(PIPELINE);

        int exitCode = run("plan", "-f", file.toString(), "--source", "schedule");

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("nightly [on_success] <- compile")
            .doesNotContain("excluded by rules");
    }

    // ============================================================
    // 정의 / 명령행 오류
    // ============================================================

    @Test
    void 정의_파일이_없으면_종료_코드_3() {
        int exitCode = run("plan", "-f", tempDir.resolve("missing.yml").toString());

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("definition file not found");
    }

    @Test
    void 잘못된_YAML이면_종료_코드_3() throws IOException {
        Path file = definition("job: [unclosed");

        int exitCode = run("plan", "-f", file.toString());

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).startsWith("error: ");
    }

    @Test
    void 그래프_오류도_종료_코드_3() throws IOException {
        Path file = definition("""
            deploy:
              needs: [missing]
              script: echo deploy
            """);

        int exitCode = run("plan", "-f", file.toString());

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("missing");
    }

    @Test
    void 알_수_없는_옵션이면_종료_코드_3() {
        int exitCode = run("run", "--no-such-option");

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("--no-such-option");
    }

    @Test
    void 잘못된_source면_종료_코드_3() throws IOException {
        Path file = definition(PIPELINE);

        int exitCode = run("plan", "-f", file.toString(), "--source", "carrier-pigeon");

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("--source");
    }

    @Test
    void 하위_명령이_없으면_종료_코드_3() {
        int exitCode = run();

        assertThat(exitCode).isEqualTo(PipelineCommand.EXIT_CONFIGURATION_ERROR);
        assertThat(err.toString()).contains("Missing subcommand");
    }

    // ============================================================
    // run
    // ============================================================

    @Test
    void run_성공하면_종료_코드_0() throws IOException {
        Path file = definition(PIPELINE);

        int exitCode = run(runArgs(file));

        assertThat(exitCode).isZero();
        assertThat(out.toString())
            .contains("finished: success (exit 0)")
            .contains("compile")
            .contains("rules_excluded");
    }

    @Test
    void run_script_실패하면_종료_코드_1() throws IOException {
        Path file = definition("""
            stages: [build, test]
            compile:
              stage: build
              script: exit 1
            unit:
              stage: test
              script: echo unit
            """);

        int exitCode = run(runArgs(file));

        assertThat(exitCode).isEqualTo(1);
        assertThat(out.toString())
            .contains("finished: failed (exit 1)")
            .contains("script_failure")
            .contains("upstream_failed");
    }

    @Test
    void run_dotenv_변수가_다음_stage로_전달() throws IOException {
        Path file = definition("""
            stages: [build, deploy]
            version:
              stage: build
              script: echo "VERSION=1.2.3" > build.env
              artifacts:
                reports:
                  dotenv: build.env
            release:
              stage: deploy
              script: test "$VERSION" = "1.2.3"
            """);

        int exitCode = run(runArgs(file));

        assertThat(exitCode).isZero();
    }

    @Test
    void run_manual_Job은_play로_시작() throws IOException {
        Path file = definition("""
            build:
              stage: build
              script: echo build
            deploy:
              stage: deploy
              when: manual
              script: exit 4
            """);

        assertThat(run(runArgs(file))).isZero();
        assertThat(out.toString()).contains("manual_not_played");

        assertThat(run(runArgs(file, "--play", "deploy"))).isEqualTo(1);
    }
}
