package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.model.JobName;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 로드된 파이프라인 정의 문서 (불변).
 *
 * @param stages stage 목록
 * @param variables 전역 변수
 * @param templates 선언 순서의 Job 템플릿 (숨김 템플릿 포함)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record PipelineDefinition(
    Stages stages,
    Map<String, String> variables,
    Map<JobName, JobTemplate> templates
) {

    public PipelineDefinition {
        if (stages == null) {
            throw new IllegalArgumentException("stages cannot be null");
        }
        if (templates == null) {
            throw new IllegalArgumentException("templates cannot be null");
        }
        templates.forEach((name, template) -> {
            if (!name.equals(template.name())) {
                throw new IllegalArgumentException(
                    "Template key '" + name + "' does not match template name '" + template.name() + "'");
            }
        });
        variables = variables == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        templates = Collections.unmodifiableMap(new LinkedHashMap<>(templates));
    }

    /**
     * 템플릿 목록으로 생성 (선언 순서 유지).
     *
     * @param stages stage 목록
     * @param variables 전역 변수
     * @param templates 템플릿 (이름 중복 시 IllegalArgumentException)
     * @return PipelineDefinition
     */
    public static PipelineDefinition of(Stages stages, Map<String, String> variables, Iterable<JobTemplate> templates) {
        Map<JobName, JobTemplate> byName = new LinkedHashMap<>();
        for (JobTemplate template : templates) {
            if (byName.putIfAbsent(template.name(), template) != null) {
                throw new IllegalArgumentException("Duplicate job: " + template.name());
            }
        }
        return new PipelineDefinition(stages, variables, byName);
    }
}
