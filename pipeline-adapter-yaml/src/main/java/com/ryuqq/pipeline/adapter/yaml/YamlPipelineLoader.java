package com.ryuqq.pipeline.adapter.yaml;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.ryuqq.pipeline.core.definition.ArtifactSpec;
import com.ryuqq.pipeline.core.definition.ArtifactWhen;
import com.ryuqq.pipeline.core.definition.CachePolicy;
import com.ryuqq.pipeline.core.definition.CacheSpec;
import com.ryuqq.pipeline.core.definition.JobTemplate;
import com.ryuqq.pipeline.core.definition.NeedSpec;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.definition.Stages;
import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.retry.RetrySpec;
import com.ryuqq.pipeline.core.retry.RetryTrigger;
import com.ryuqq.pipeline.core.rule.Rule;
import com.ryuqq.pipeline.core.rule.When;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * YAML 파이프라인 정의 문서를 {@link PipelineDefinition}으로 로드.
 *
 * <p><strong>최상위 키:</strong></p>
 * <ul>
 *   <li>{@code stages}: stage 목록 (생략 시 {@link Stages#DEFAULT})</li>
 *   <li>{@code variables}: 전역 변수</li>
 *   <li>{@code .name}: 숨김 템플릿 (extends 전용)</li>
 *   <li>그 외 맵 값을 가진 키: Job</li>
 *   <li>{@code include}, {@code workflow}, {@code default} 등: 경고 후 무시</li>
 * </ul>
 *
 * <p>로더는 문서 구조만 해석합니다. extends 병합, rules 평가, 그래프 검증은
 * {@code JobGraphBuilder}가 수행합니다. 엔진이 다루지 않는 Job 키(before_script, services 등)는
 * 경고 후 무시하고, 알 수 없는 키나 값 형식이 잘못된 경우 {@link ConfigurationException}을 던집니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class YamlPipelineLoader {

    private static final Logger log = LoggerFactory.getLogger(YamlPipelineLoader.class);

    private static final String STAGES = "stages";
    private static final String VARIABLES = "variables";

    private static final Set<String> IGNORED_GLOBAL_KEYS = Set.of(
        "include", "workflow", "default", "image", "services", "before_script", "after_script", "cache", "spec"
    );

    private final ObjectMapper mapper;

    public YamlPipelineLoader() {
        this(new ObjectMapper(new YAMLFactory()));
    }

    public YamlPipelineLoader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 파일에서 로드.
     *
     * @param path 정의 파일 경로
     * @return PipelineDefinition
     * @throws IOException 파일을 읽을 수 없는 경우
     * @throws ConfigurationException 문서가 잘못된 경우
     */
    public PipelineDefinition load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            log.debug("Loading pipeline definition from {}", path);
            return load(in);
        }
    }

    /**
     * 스트림에서 로드. 스트림은 호출자가 닫습니다.
     */
    public PipelineDefinition load(InputStream in) throws IOException {
        JsonNode root;
        try {
            root = mapper.readTree(in);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed YAML document: " + e.getOriginalMessage(), e);
        }
        return toDefinition(root);
    }

    /**
     * 문자열에서 로드.
     *
     * @param yaml YAML 문서
     * @return PipelineDefinition
     * @throws ConfigurationException 문서가 잘못된 경우
     */
    public PipelineDefinition parse(String yaml) {
        try {
            return toDefinition(mapper.readTree(yaml));
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed YAML document: " + e.getOriginalMessage(), e);
        }
    }

    private PipelineDefinition toDefinition(JsonNode root) {
        if (root == null || root.isMissingNode() || root.isNull()) {
            throw new ConfigurationException("Pipeline definition is empty");
        }
        if (!root.isObject()) {
            throw new ConfigurationException("Pipeline definition must be a mapping at the top level");
        }

        Stages stages = root.has(STAGES) ? Stages.of(stringList(root.get(STAGES), STAGES)) : Stages.DEFAULT;
        Map<String, String> variables = root.has(VARIABLES)
            ? variables(root.get(VARIABLES), VARIABLES)
            : Map.of();

        List<JobTemplate> templates = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            JsonNode value = field.getValue();
            if (STAGES.equals(key) || VARIABLES.equals(key)) {
                continue;
            }
            if (IGNORED_GLOBAL_KEYS.contains(key)) {
                log.warn("Ignoring unsupported top-level key '{}'", key);
                continue;
            }
            if (!value.isObject()) {
                if (key.startsWith(".")) {
                    log.debug("Skipping hidden non-mapping key '{}'", key);
                    continue;
                }
                throw new ConfigurationException("Job '" + key + "' must be a mapping");
            }
            templates.add(JobYamlReader.read(key, value));
        }

        log.debug("Loaded pipeline definition: {} stages, {} templates, {} variables",
            stages.names().size(), templates.size(), variables.size());
        try {
            return PipelineDefinition.of(stages, variables, templates);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }
    }

    /**
     * 변수 맵 변환. 값은 스칼라 또는 {@code {value: ..., description: ...}} 형태.
     */
    static Map<String, String> variables(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return Map.of();
        }
        if (!node.isObject()) {
            throw new ConfigurationException("'" + where + "' must be a mapping");
        }
        Map<String, String> result = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isObject()) {
                value = value.path("value");
            }
            result.put(field.getKey(), scalar(value, where + "." + field.getKey()));
        }
        return result;
    }

    /**
     * 문자열 또는 문자열 목록을 목록으로 변환.
     */
    static List<String> stringList(JsonNode node, String where) {
        if (node == null || node.isNull()) {
            return List.of();
        }
        if (node.isValueNode()) {
            return List.of(scalar(node, where));
        }
        if (!node.isArray()) {
            throw new ConfigurationException("'" + where + "' must be a string or a list of strings");
        }
        List<String> result = new ArrayList<>();
        for (JsonNode element : node) {
            if (element.isArray()) {
                result.addAll(stringList(element, where));
            } else {
                result.add(scalar(element, where));
            }
        }
        return result;
    }

    static String scalar(JsonNode node, String where) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return "";
        }
        if (!node.isValueNode()) {
            throw new ConfigurationException("'" + where + "' must be a scalar value");
        }
        return node.asText();
    }

    /**
     * Job 하나의 키를 해석하는 읽기 도우미.
     */
    private static final class JobYamlReader {

        private static final Set<String> IGNORED_JOB_KEYS = Set.of(
            "before_script", "after_script", "services", "coverage", "interruptible", "parallel", "only",
            "except", "trigger", "release", "secrets", "id_tokens", "hooks", "inherit", "pages", "description",
            "dast_configuration", "identity", "manual_confirmation"
        );

        private final String name;
        private final JobTemplate.Builder builder;

        private JobYamlReader(String name) {
            this.name = name;
            this.builder = JobTemplate.builder(name);
        }

        static JobTemplate read(String name, JsonNode node) {
            JobYamlReader reader = new JobYamlReader(name);
            try {
                reader.readAll(node);
                return reader.builder.build();
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Invalid job '" + name + "': " + e.getMessage(), e);
            }
        }

        private void readAll(JsonNode node) {
            if (node.has("rules") && node.has("when")) {
                throw new ConfigurationException(
                    "Job '" + name + "' cannot declare both 'rules' and a job-level 'when'");
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                readKey(field.getKey(), field.getValue());
            }
        }

        private void readKey(String key, JsonNode value) {
            switch (key) {
                case "extends" -> builder.extendsFrom(stringList(value, where(key)).toArray(String[]::new));
                case "stage" -> builder.stage(scalar(value, where(key)));
                case "rules" -> builder.rules(rules(value));
                case "when" -> builder.rules(Rule.unconditional(When.fromWireValue(scalar(value, where(key)))));
                case "tags" -> builder.tags(stringList(value, where(key)));
                case "retry" -> builder.retry(retry(value));
                case "variables" -> builder.variables(variables(value, where(key)));
                case "artifacts" -> builder.artifacts(artifacts(value));
                case "cache" -> builder.cache(cache(value));
                case "needs" -> builder.needs(needs(value));
                case "dependencies" -> builder.dependencies(
                    stringList(value, where(key)).stream().map(JobName::of).toList());
                case "allow_failure" -> builder.allowFailure(allowFailure(value));
                case "image" -> builder.image(nameOf(value, key));
                case "script" -> builder.script(stringList(value, where(key)));
                case "environment" -> builder.environment(nameOf(value, key));
                case "resource_group" -> builder.resourceGroup(scalar(value, where(key)));
                case "timeout" -> builder.timeout(DurationParser.parse(scalar(value, where(key))));
                default -> {
                    if (IGNORED_JOB_KEYS.contains(key)) {
                        log.warn("Job '{}': ignoring unsupported key '{}'", name, key);
                    } else {
                        throw new ConfigurationException("Job '" + name + "' has unknown key '" + key + "'");
                    }
                }
            }
        }

        private List<Rule> rules(JsonNode node) {
            if (!node.isArray()) {
                throw new ConfigurationException("'" + where("rules") + "' must be a list");
            }
            List<Rule> rules = new ArrayList<>();
            for (JsonNode ruleNode : node) {
                if (!ruleNode.isObject()) {
                    throw new ConfigurationException("Each entry of '" + where("rules") + "' must be a mapping");
                }
                When when = ruleNode.has("when")
                    ? When.fromWireValue(scalar(ruleNode.get("when"), where("rules.when")))
                    : When.ON_SUCCESS;
                ruleNode.fieldNames().forEachRemaining(ruleKey -> {
                    if (!"if".equals(ruleKey) && !"when".equals(ruleKey)) {
                        log.warn("Job '{}': ignoring unsupported rule key '{}'", name, ruleKey);
                    }
                });
                if (ruleNode.has("if")) {
                    rules.add(Rule.of(scalar(ruleNode.get("if"), where("rules.if")), when));
                } else {
                    rules.add(Rule.unconditional(when));
                }
            }
            return rules;
        }

        private RetrySpec retry(JsonNode node) {
            if (node.isIntegralNumber()) {
                return RetrySpec.of(node.intValue());
            }
            if (!node.isObject()) {
                throw new ConfigurationException("'" + where("retry") + "' must be an integer or a mapping");
            }
            Integer max = null;
            if (node.has("max")) {
                JsonNode maxNode = node.get("max");
                if (!maxNode.isIntegralNumber()) {
                    throw new ConfigurationException("'" + where("retry.max") + "' must be an integer");
                }
                max = maxNode.intValue();
            }
            RetryTrigger trigger = node.has("when")
                ? RetryTrigger.fromWireValues(stringList(node.get("when"), where("retry.when")))
                : null;
            return new RetrySpec(max, trigger);
        }

        private ArtifactSpec artifacts(JsonNode node) {
            if (!node.isObject()) {
                throw new ConfigurationException("'" + where("artifacts") + "' must be a mapping");
            }
            String artifactName = node.has("name") ? scalar(node.get("name"), where("artifacts.name")) : null;
            List<String> paths = node.has("paths") ? stringList(node.get("paths"), where("artifacts.paths")) : null;
            ArtifactWhen when = node.has("when")
                ? ArtifactWhen.fromWireValue(scalar(node.get("when"), where("artifacts.when")))
                : null;
            Duration expireIn = node.has("expire_in")
                ? DurationParser.parse(scalar(node.get("expire_in"), where("artifacts.expire_in")))
                : null;
            String dotenv = null;
            JsonNode reports = node.get("reports");
            if (reports != null && reports.isObject()) {
                Iterator<Map.Entry<String, JsonNode>> kinds = reports.fields();
                while (kinds.hasNext()) {
                    Map.Entry<String, JsonNode> kind = kinds.next();
                    if ("dotenv".equals(kind.getKey())) {
                        dotenv = singleDotenv(stringList(kind.getValue(), where("artifacts.reports.dotenv")));
                    } else {
                        log.warn("Job '{}': ignoring unsupported report type '{}'", name, kind.getKey());
                    }
                }
            }
            node.fieldNames().forEachRemaining(artifactKey -> {
                if (!Set.of("name", "paths", "when", "expire_in", "reports").contains(artifactKey)) {
                    log.warn("Job '{}': ignoring unsupported artifacts key '{}'", name, artifactKey);
                }
            });
            return new ArtifactSpec(artifactName, paths, when, expireIn, dotenv);
        }

        private String singleDotenv(List<String> files) {
            if (files.size() != 1) {
                throw new ConfigurationException(
                    "'" + where("artifacts.reports.dotenv") + "' must name exactly one file (found " + files.size() + ")");
            }
            return files.get(0);
        }

        private CacheSpec cache(JsonNode node) {
            if (!node.isObject()) {
                throw new ConfigurationException("'" + where("cache") + "' must be a single mapping");
            }
            String key = null;
            if (node.has("key")) {
                JsonNode keyNode = node.get("key");
                if (!keyNode.isValueNode()) {
                    throw new ConfigurationException("'" + where("cache.key") + "' must be a string");
                }
                key = keyNode.asText();
            }
            List<String> paths = node.has("paths") ? stringList(node.get("paths"), where("cache.paths")) : null;
            CachePolicy policy = node.has("policy")
                ? CachePolicy.fromWireValue(scalar(node.get("policy"), where("cache.policy")))
                : null;
            return new CacheSpec(key, paths, policy);
        }

        private List<NeedSpec> needs(JsonNode node) {
            if (node.isNull()) {
                return List.of();
            }
            if (!node.isArray()) {
                throw new ConfigurationException("'" + where("needs") + "' must be a list");
            }
            List<NeedSpec> needs = new ArrayList<>();
            for (JsonNode need : node) {
                if (need.isValueNode()) {
                    needs.add(NeedSpec.of(need.asText()));
                    continue;
                }
                if (!need.isObject() || !need.has("job")) {
                    throw new ConfigurationException(
                        "Each entry of '" + where("needs") + "' must be a job name or a mapping with 'job'");
                }
                if (need.has("pipeline") || need.has("project")) {
                    throw new ConfigurationException(
                        "Job '" + name + "': cross-pipeline needs are not supported");
                }
                needs.add(new NeedSpec(
                    JobName.of(scalar(need.get("job"), where("needs.job"))),
                    need.path("artifacts").asBoolean(true),
                    need.path("optional").asBoolean(false)
                ));
            }
            return needs;
        }

        private boolean allowFailure(JsonNode node) {
            if (node.isBoolean()) {
                return node.booleanValue();
            }
            throw new ConfigurationException("'" + where("allow_failure") + "' must be a boolean");
        }

        /**
         * {@code image: ref} 또는 {@code image: {name: ref}} 형태.
         */
        private String nameOf(JsonNode node, String key) {
            if (node.isObject()) {
                if (!node.has("name")) {
                    throw new ConfigurationException("'" + where(key) + "' mapping must have 'name'");
                }
                return scalar(node.get("name"), where(key + ".name"));
            }
            return scalar(node, where(key));
        }

        private String where(String key) {
            return name + "." + key;
        }
    }
}
