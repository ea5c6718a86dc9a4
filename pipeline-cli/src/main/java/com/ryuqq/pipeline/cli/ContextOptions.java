package com.ryuqq.pipeline.cli;

import com.ryuqq.pipeline.adapter.yaml.YamlPipelineLoader;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.model.PipelineSource;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@code run}과 {@code plan}이 공유하는 정의 파일 / 트리거 옵션.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class ContextOptions {

    @Spec(Spec.Target.MIXEE)
    CommandSpec mixee;

    @Option(names = {"-f", "--file"}, paramLabel = "FILE", defaultValue = ".gitlab-ci.yml",
        description = "Pipeline definition file (default: ${DEFAULT-VALUE}).")
    Path file;

    @Option(names = "--ref", paramLabel = "BRANCH", defaultValue = "main",
        description = "Branch the pipeline runs for (default: ${DEFAULT-VALUE}).")
    String ref;

    @Option(names = "--tag", paramLabel = "TAG",
        description = "Run a tag pipeline instead of a branch pipeline.")
    String tag;

    @Option(names = "--source", paramLabel = "SOURCE", defaultValue = "push",
        description = "Pipeline source: push, schedule, web, api, trigger, merge_request_event, ... (default: ${DEFAULT-VALUE}).")
    String source;

    @Option(names = {"-v", "--variable"}, paramLabel = "KEY=VALUE",
        description = "Trigger variable; repeatable. Overrides variables of the definition.")
    Map<String, String> variables = new LinkedHashMap<>();

    PipelineDefinition loadDefinition() throws IOException {
        return new YamlPipelineLoader().load(file);
    }

    /**
     * 트리거 정보로 컨텍스트 생성. 사전 정의 변수는 {@code -v}로 덮어쓸 수 없습니다.
     */
    PipelineContext toPipelineContext() {
        Map<String, String> environment = new LinkedHashMap<>(variables);
        environment.put(PipelineContext.CI_PIPELINE_SOURCE, pipelineSource().wireValue());
        environment.remove(PipelineContext.CI_COMMIT_REF_NAME);
        if (tag != null) {
            environment.put(PipelineContext.CI_COMMIT_TAG, tag);
            environment.remove(PipelineContext.CI_COMMIT_BRANCH);
        } else {
            environment.put(PipelineContext.CI_COMMIT_BRANCH, ref);
            environment.remove(PipelineContext.CI_COMMIT_TAG);
        }
        return PipelineContext.fromVariables(environment);
    }

    private PipelineSource pipelineSource() {
        try {
            return PipelineSource.fromWireValue(source);
        } catch (IllegalArgumentException e) {
            throw new ParameterException(mixee.commandLine(), "Invalid value for option '--source': " + e.getMessage());
        }
    }
}
