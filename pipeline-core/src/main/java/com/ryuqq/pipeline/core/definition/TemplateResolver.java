package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.model.JobName;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * extends 관계 해석.
 *
 * <p>extends 관계를 위상 순서로 따라가며 각 템플릿을 완전히 병합된 형태로 만듭니다.
 * 여러 부모를 가진 경우 선언 순서대로 왼쪽부터 병합하고(뒤쪽 부모가 우선), 마지막으로 자신을 병합합니다.</p>
 *
 * <pre>
 * .test_base  ← .pytest ← vanilla current
 *
 * vanilla current = merge(merge(.test_base, .pytest), vanilla current)
 * </pre>
 *
 * <p><strong>오류:</strong></p>
 * <ul>
 *   <li>존재하지 않는 부모 → ConfigurationException</li>
 *   <li>순환 extends → ConfigurationException</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class TemplateResolver {

    private final Map<JobName, JobTemplate> declared;
    private final Map<JobName, JobTemplate> resolved = new HashMap<>();
    private final LinkedHashSet<JobName> resolving = new LinkedHashSet<>();

    private TemplateResolver(Map<JobName, JobTemplate> declared) {
        this.declared = declared;
    }

    /**
     * 모든 템플릿의 extends 해석.
     *
     * @param templates 선언 순서의 템플릿 맵
     * @return 선언 순서를 유지한, extends가 해석된 템플릿 맵 (불변)
     * @throws ConfigurationException 알 수 없는 부모 또는 순환 extends가 있는 경우
     */
    public static Map<JobName, JobTemplate> resolveAll(Map<JobName, JobTemplate> templates) {
        TemplateResolver resolver = new TemplateResolver(templates);
        Map<JobName, JobTemplate> result = new LinkedHashMap<>();
        for (JobName name : templates.keySet()) {
            result.put(name, resolver.resolve(name));
        }
        return Collections.unmodifiableMap(result);
    }

    private JobTemplate resolve(JobName name) {
        JobTemplate cached = resolved.get(name);
        if (cached != null) {
            return cached;
        }
        if (!resolving.add(name)) {
            List<String> cycle = new ArrayList<>(resolving.stream().map(JobName::getValue).toList());
            cycle.add(name.getValue());
            throw new ConfigurationException("Cyclic extends: " + String.join(" -> ", cycle));
        }

        JobTemplate template = declared.get(name);
        JobTemplate base = null;
        for (JobName parentName : template.extendsFrom()) {
            if (!declared.containsKey(parentName)) {
                throw new ConfigurationException(
                    "Job '" + name + "' extends unknown template '" + parentName + "'");
            }
            JobTemplate parent = resolve(parentName);
            base = base == null ? parent : TemplateMerger.merge(base, parent);
        }
        // 부모가 없는 템플릿은 extends가 비어 있으므로 그대로 사용
        JobTemplate result = base == null ? template : TemplateMerger.merge(base, template);

        resolving.remove(name);
        resolved.put(name, result);
        return result;
    }
}
