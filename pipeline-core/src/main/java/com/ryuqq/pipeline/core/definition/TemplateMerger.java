package com.ryuqq.pipeline.core.definition;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 템플릿 필드 단위 병합.
 *
 * <p><strong>병합 규칙 (자식이 부모를 덮어씀):</strong></p>
 * <ul>
 *   <li>스칼라 (stage, image, allowFailure, environment, resourceGroup, timeout): 교체</li>
 *   <li>맵 (variables, artifacts, cache, retry): 키 단위 병합</li>
 *   <li>목록 (rules, tags, script, needs, dependencies): 통째로 교체</li>
 * </ul>
 *
 * <p>입력을 변경하지 않는 순수 함수이며, 동일 입력에 대해 항상 동일한 결과를 반환합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateMerger {

    // Utility class - prevent instantiation
    private TemplateMerger() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 부모 위에 자식을 병합.
     *
     * <p>결과의 이름은 자식의 이름이며, extends는 비워집니다 (이미 해석됨).</p>
     *
     * @param parent 부모 템플릿
     * @param child 자식 템플릿
     * @return 병합된 템플릿
     * @throws IllegalArgumentException parent 또는 child가 null인 경우
     */
    public static JobTemplate merge(JobTemplate parent, JobTemplate child) {
        if (parent == null || child == null) {
            throw new IllegalArgumentException("Templates cannot be null (parent: " + parent + ", child: " + child + ")");
        }

        Map<String, String> variables = new LinkedHashMap<>(parent.variables());
        variables.putAll(child.variables());

        return new JobTemplate(
            child.name(),
            null,
            pick(child.stage(), parent.stage()),
            pick(child.rules(), parent.rules()),
            pick(child.tags(), parent.tags()),
            child.retry() == null ? parent.retry() : child.retry().mergeOver(parent.retry()),
            variables,
            child.artifacts() == null ? parent.artifacts() : child.artifacts().mergeOver(parent.artifacts()),
            child.cache() == null ? parent.cache() : child.cache().mergeOver(parent.cache()),
            pick(child.needs(), parent.needs()),
            pick(child.dependencies(), parent.dependencies()),
            pick(child.allowFailure(), parent.allowFailure()),
            pick(child.image(), parent.image()),
            pick(child.script(), parent.script()),
            pick(child.environment(), parent.environment()),
            pick(child.resourceGroup(), parent.resourceGroup()),
            pick(child.timeout(), parent.timeout())
        );
    }

    private static <T> T pick(T childValue, T parentValue) {
        return childValue != null ? childValue : parentValue;
    }
}
