package com.ryuqq.pipeline.cli;

import com.ryuqq.pipeline.core.error.PipelineException;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.NoSuchFileException;

/**
 * {@code pipeline} 최상위 명령.
 *
 * <p>정의 오류({@link PipelineException}), 정의 파일을 읽지 못한 경우, 잘못된 명령행 인자는
 * 모두 {@link #EXIT_CONFIGURATION_ERROR}로 종료합니다. 파이프라인 실행 결과는
 * {@link com.ryuqq.pipeline.application.result.PipelineStatus#exitCode()}를 그대로 사용합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "pipeline",
    mixinStandardHelpOptions = true,
    version = "pipeline-orchestrator 1.0.0",
    description = "Runs a declarative CI pipeline definition as a DAG of jobs.",
    subcommands = {RunCommand.class, PlanCommand.class}
)
public class PipelineCommand implements Runnable {

    public static final int EXIT_CONFIGURATION_ERROR = 3;

    @Spec
    CommandSpec spec;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    public static int execute(String... args) {
        return newCommandLine().execute(args);
    }

    /**
     * 예외 처리기가 설치된 CommandLine 생성.
     */
    public static CommandLine newCommandLine() {
        CommandLine commandLine = new CommandLine(new PipelineCommand());
        commandLine.setExecutionExceptionHandler(PipelineCommand::handleExecutionException);
        commandLine.setParameterExceptionHandler(PipelineCommand::handleParameterException);
        return commandLine;
    }

    @Override
    public void run() {
        throw new ParameterException(spec.commandLine(), "Missing subcommand: run or plan");
    }

    private static int handleExecutionException(
        Exception exception,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) throws Exception {
        if (exception instanceof PipelineException || exception instanceof IOException) {
            commandLine.getErr().println("error: " + describe(exception));
            return EXIT_CONFIGURATION_ERROR;
        }
        throw exception;
    }

    private static int handleParameterException(ParameterException exception, String[] args) {
        CommandLine commandLine = exception.getCommandLine();
        PrintWriter err = commandLine.getErr();
        err.println("error: " + exception.getMessage());
        if (!CommandLine.UnmatchedArgumentException.printSuggestions(exception, err)) {
            commandLine.usage(err);
        }
        return EXIT_CONFIGURATION_ERROR;
    }

    private static String describe(Exception exception) {
        if (exception instanceof NoSuchFileException) {
            return "definition file not found: " + exception.getMessage();
        }
        return exception.getMessage();
    }
}
