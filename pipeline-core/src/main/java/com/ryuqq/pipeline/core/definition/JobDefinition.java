package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.retry.RetrySpec;
import com.ryuqq.pipeline.core.rule.Rule;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * extends 해석과 기본값 적용이 끝난 실행 가능한 Job 정의.
 *
 * <p>needs가 null이면 엄격한 stage 대기를 따르고, 빈 목록을 포함해 지정되어 있으면
 * stage 대기 대신 needs 대상만 기다립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobDefinition(
    JobName name,
    String stage,
    List<Rule> rules,
    List<String> tags,
    RetrySpec retry,
    Map<String, String> variables,
    ArtifactSpec artifacts,
    CacheSpec cache,
    List<NeedSpec> needs,
    List<JobName> dependencies,
    boolean allowFailure,
    String image,
    List<String> script,
    String environment,
    String resourceGroup,
    Duration timeout
) {

    public JobDefinition {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (stage == null || stage.isBlank()) {
            throw new IllegalArgumentException("stage cannot be null or blank");
        }
        rules = rules == null ? List.of() : List.copyOf(rules);
        tags = tags == null ? List.of() : List.copyOf(tags);
        retry = retry == null ? RetrySpec.NONE : retry;
        variables = variables == null ? Map.of() : variables;
        needs = needs == null ? null : List.copyOf(needs);
        dependencies = dependencies == null ? null : List.copyOf(dependencies);
        script = script == null ? List.of() : List.copyOf(script);
    }

    /**
     * 해석된 템플릿으로부터 생성.
     *
     * @param template extends가 해석된 템플릿
     * @param stages 파이프라인 stage 목록
     * @return JobDefinition
     * @throws ConfigurationException 정의되지 않은 stage를 사용하는 경우
     */
    public static JobDefinition from(JobTemplate template, Stages stages) {
        String stage = template.stage() == null ? Stages.DEFAULT_JOB_STAGE : template.stage();
        if (!stages.contains(stage)) {
            throw new ConfigurationException(
                "Job '" + template.name() + "' uses undefined stage '" + stage + "' (stages: " + stages.names() + ")");
        }
        return new JobDefinition(
            template.name(),
            stage,
            template.rules(),
            template.tags(),
            template.retry(),
            template.variables(),
            template.artifacts(),
            template.cache(),
            template.needs(),
            template.dependencies(),
            Boolean.TRUE.equals(template.allowFailure()),
            template.image(),
            template.script(),
            template.environment(),
            template.resourceGroup(),
            template.timeout()
        );
    }

    /**
     * needs로 stage 대기를 우회하는지 확인.
     *
     * @return needs가 지정되어 있으면 true (빈 목록 포함)
     */
    public boolean hasNeeds() {
        return needs != null;
    }
}
