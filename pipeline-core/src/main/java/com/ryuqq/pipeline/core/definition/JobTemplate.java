package com.ryuqq.pipeline.core.definition;

import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.retry.RetrySpec;
import com.ryuqq.pipeline.core.rule.Rule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 정의 문서에 선언된 Job 템플릿 (불변).
 *
 * <p>extends로 다른 템플릿을 상속할 수 있으며, 병합은 {@link TemplateMerger}가 수행합니다.
 * 각 필드의 null은 "이 템플릿에서 지정하지 않음"을 뜻하므로, 부모 값이 그대로 유지됩니다.
 * 빈 목록은 지정된 값입니다 (예: {@code needs: []}는 stage 대기 없이 즉시 실행).</p>
 *
 * <p>로드 후에는 프로세스 전역에서 공유되며 변경되지 않습니다.</p>
 *
 * @param name Job 이름 ({@code .}으로 시작하면 숨김 템플릿)
 * @param extendsFrom 상속할 템플릿 (왼쪽부터 적용, 뒤쪽이 우선)
 * @param stage stage 이름
 * @param rules 포함 규칙
 * @param tags 러너 태그
 * @param retry 재시도 설정
 * @param variables Job 변수 (null 없음, 빈 맵 가능)
 * @param artifacts 아티팩트 선언
 * @param cache 캐시 선언
 * @param needs 명시적 선행 Job
 * @param dependencies 아티팩트를 가져올 Job
 * @param allowFailure 실패 허용 여부
 * @param image 실행 이미지 참조 (엔진은 해석하지 않음)
 * @param script 스크립트 참조 (엔진은 해석하지 않음)
 * @param environment 배포 environment 이름
 * @param resourceGroup 동시 실행 배제 그룹
 * @param timeout 실행 제한 시간
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record JobTemplate(
    JobName name,
    List<JobName> extendsFrom,
    String stage,
    List<Rule> rules,
    List<String> tags,
    RetrySpec retry,
    Map<String, String> variables,
    ArtifactSpec artifacts,
    CacheSpec cache,
    List<NeedSpec> needs,
    List<JobName> dependencies,
    Boolean allowFailure,
    String image,
    List<String> script,
    String environment,
    String resourceGroup,
    Duration timeout
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException name이 null이거나 timeout이 양수가 아닌 경우
     */
    public JobTemplate {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (timeout != null && (timeout.isNegative() || timeout.isZero())) {
            throw new IllegalArgumentException("timeout must be positive (current: " + timeout + ")");
        }
        extendsFrom = extendsFrom == null ? List.of() : List.copyOf(extendsFrom);
        rules = copyOrNull(rules);
        tags = copyOrNull(tags);
        variables = variables == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        needs = copyOrNull(needs);
        dependencies = copyOrNull(dependencies);
        script = copyOrNull(script);
    }

    public static Builder builder(String name) {
        return new Builder(JobName.of(name));
    }

    public boolean isHidden() {
        return name.isHidden();
    }

    /**
     * 이 템플릿 기반의 Builder 생성.
     *
     * @return 현재 값으로 채워진 Builder
     */
    public Builder toBuilder() {
        Builder builder = new Builder(name);
        builder.extendsFrom = new ArrayList<>(extendsFrom);
        builder.stage = stage;
        builder.rules = rules;
        builder.tags = tags;
        builder.retry = retry;
        builder.variables = new LinkedHashMap<>(variables);
        builder.artifacts = artifacts;
        builder.cache = cache;
        builder.needs = needs;
        builder.dependencies = dependencies;
        builder.allowFailure = allowFailure;
        builder.image = image;
        builder.script = script;
        builder.environment = environment;
        builder.resourceGroup = resourceGroup;
        builder.timeout = timeout;
        return builder;
    }

    private static <T> List<T> copyOrNull(List<T> list) {
        return list == null ? null : List.copyOf(list);
    }

    /**
     * JobTemplate Builder.
     *
     * <p>지정하지 않은 필드는 null(미지정)로 남습니다.</p>
     */
    public static final class Builder {

        private final JobName name;
        private List<JobName> extendsFrom = new ArrayList<>();
        private String stage;
        private List<Rule> rules;
        private List<String> tags;
        private RetrySpec retry;
        private Map<String, String> variables = new LinkedHashMap<>();
        private ArtifactSpec artifacts;
        private CacheSpec cache;
        private List<NeedSpec> needs;
        private List<JobName> dependencies;
        private Boolean allowFailure;
        private String image;
        private List<String> script;
        private String environment;
        private String resourceGroup;
        private Duration timeout;

        private Builder(JobName name) {
            this.name = name;
        }

        public Builder extendsFrom(String... bases) {
            Arrays.stream(bases).map(JobName::of).forEach(extendsFrom::add);
            return this;
        }

        public Builder stage(String stage) {
            this.stage = stage;
            return this;
        }

        public Builder rules(Rule... rules) {
            this.rules = List.of(rules);
            return this;
        }

        public Builder rules(List<Rule> rules) {
            this.rules = rules;
            return this;
        }

        public Builder tags(String... tags) {
            this.tags = List.of(tags);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = tags;
            return this;
        }

        public Builder retry(RetrySpec retry) {
            this.retry = retry;
            return this;
        }

        public Builder variable(String key, String value) {
            this.variables.put(key, value);
            return this;
        }

        public Builder variables(Map<String, String> variables) {
            this.variables = new LinkedHashMap<>(variables);
            return this;
        }

        public Builder artifacts(ArtifactSpec artifacts) {
            this.artifacts = artifacts;
            return this;
        }

        public Builder cache(CacheSpec cache) {
            this.cache = cache;
            return this;
        }

        public Builder needs(String... jobs) {
            this.needs = Arrays.stream(jobs).map(NeedSpec::of).toList();
            return this;
        }

        public Builder needs(List<NeedSpec> needs) {
            this.needs = needs;
            return this;
        }

        public Builder dependencies(String... jobs) {
            this.dependencies = Arrays.stream(jobs).map(JobName::of).toList();
            return this;
        }

        public Builder dependencies(List<JobName> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder allowFailure(boolean allowFailure) {
            this.allowFailure = allowFailure;
            return this;
        }

        public Builder image(String image) {
            this.image = image;
            return this;
        }

        public Builder script(String... lines) {
            this.script = List.of(lines);
            return this;
        }

        public Builder script(List<String> lines) {
            this.script = lines;
            return this;
        }

        public Builder environment(String environment) {
            this.environment = environment;
            return this;
        }

        public Builder resourceGroup(String resourceGroup) {
            this.resourceGroup = resourceGroup;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public JobTemplate build() {
            return new JobTemplate(name, extendsFrom, stage, rules, tags, retry, variables, artifacts, cache,
                needs, dependencies, allowFailure, image, script, environment, resourceGroup, timeout);
        }
    }
}
