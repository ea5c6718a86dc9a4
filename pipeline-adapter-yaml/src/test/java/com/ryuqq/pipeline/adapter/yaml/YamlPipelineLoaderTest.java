package com.ryuqq.pipeline.adapter.yaml;

import com.ryuqq.pipeline.core.definition.ArtifactWhen;
import com.ryuqq.pipeline.core.definition.CachePolicy;
import com.ryuqq.pipeline.core.definition.JobTemplate;
import com.ryuqq.pipeline.core.definition.NeedSpec;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.definition.Stages;
import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.retry.RetryTrigger;
import com.ryuqq.pipeline.core.rule.When;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * YamlPipelineLoader 유닛 테스트.
 *
 * <p>문서 구조 해석만 검증합니다. 병합과 그래프는 {@link CiDefinitionGraphTest}에서 다룹니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class YamlPipelineLoaderTest {

    private final YamlPipelineLoader loader = new YamlPipelineLoader();

    // ============================================================
    // 1. 최상위 키
    // ============================================================

    @Test
    void stages와_전역_변수_로드() {
        PipelineDefinition definition = loader.parse("""
            stages: [build, test]
            variables:
              PLAIN: value
              NUMBER: 3
              DESCRIBED:
                value: x
                description: explained
            job:
              script: make
            """);

        assertThat(definition.stages().names()).containsExactly(Stages.PRE, "build", "test", Stages.POST);
        assertThat(definition.variables())
            .containsEntry("PLAIN", "value")
            .containsEntry("NUMBER", "3")
            .containsEntry("DESCRIBED", "x");
    }

    @Test
    void stages_생략_시_기본_목록() {
        PipelineDefinition definition = loader.parse("job: {script: make}");

        assertThat(definition.stages()).isEqualTo(Stages.DEFAULT);
    }

    @Test
    void include_workflow_default는_무시() {
        PipelineDefinition definition = loader.parse("""
            include:
              - template: 'Workflows/Branch-Pipelines.gitlab-ci.yml'
            workflow:
              rules:
                - when: always
            default:
              retry: 1
            job:
              script: make
            """);

        assertThat(definition.templates().keySet()).containsExactly(JobName.of("job"));
    }

    @Test
    void Job은_선언_순서를_유지하고_숨김_템플릿을_포함() {
        PipelineDefinition definition = loader.parse("""
            .base:
              tags: [docker]
            second:
              extends: .base
            first:
              extends: .base
            """);

        assertThat(definition.templates().keySet())
            .extracting(JobName::getValue)
            .containsExactly(".base", "second", "first");
        assertThat(template(definition, "second").extendsFrom()).containsExactly(JobName.of(".base"));
    }

    @Test
    void 맵이_아닌_Job은_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("job: make"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("job");
    }

    @Test
    void 잘못된_YAML은_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("stages: [build\njob: {"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Malformed");
    }

    @Test
    void 빈_문서는_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse(""))
            .isInstanceOf(ConfigurationException.class);
    }

    // ============================================================
    // 2. Job 키
    // ============================================================

    @Test
    void rules_if와_when_해석() {
        JobTemplate job = template(loader.parse("""
            job:
              rules:
                - if: $CI_PIPELINE_SOURCE == "schedule"
                  when: never
                - when: manual
                - if: $CI_COMMIT_TAG
            """), "job");

        assertThat(job.rules()).hasSize(3);
        assertThat(job.rules().get(0).when()).isEqualTo(When.NEVER);
        assertThat(job.rules().get(0).expression()).isEqualTo("$CI_PIPELINE_SOURCE == \"schedule\"");
        assertThat(job.rules().get(1).when()).isEqualTo(When.MANUAL);
        assertThat(job.rules().get(1).expression()).isNull();
        assertThat(job.rules().get(2).when()).isEqualTo(When.ON_SUCCESS);
    }

    @Test
    void 잘못된_조건식은_로드_시점에_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("""
            job:
              rules:
                - if: $A ==
            """))
            .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void 알_수_없는_when_값은_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("""
            job:
              rules:
                - when: sometimes
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("sometimes");
    }

    @Test
    void Job_수준_when은_무조건_rule로_변환() {
        JobTemplate job = template(loader.parse("deploy: {when: manual}"), "deploy");

        assertThat(job.rules()).hasSize(1);
        assertThat(job.rules().get(0).when()).isEqualTo(When.MANUAL);
    }

    @Test
    void rules와_Job_수준_when을_함께_쓰면_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("""
            job:
              when: manual
              rules:
                - when: always
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("rules");
    }

    @Test
    void retry_정수와_맵_형태() {
        PipelineDefinition definition = loader.parse("""
            simple:
              retry: 2
            listed:
              retry:
                max: 1
                when:
                  - runner_system_failure
                  - api_failure
            always:
              retry:
                max: 2
                when: always
            """);

        assertThat(template(definition, "simple").retry().max()).isEqualTo(2);
        assertThat(template(definition, "simple").retry().when()).isNull();

        RetryTrigger listed = template(definition, "listed").retry().when();
        assertThat(listed.reasons())
            .containsExactlyInAnyOrder(FailureReason.RUNNER_SYSTEM_FAILURE, FailureReason.API_FAILURE);
        assertThat(template(definition, "always").retry().when()).isEqualTo(RetryTrigger.ALWAYS);
    }

    @Test
    void retry_max_범위_초과는_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("job: {retry: 11}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("job");
    }

    @Test
    void artifacts_전체_키() {
        JobTemplate job = template(loader.parse("""
            job:
              artifacts:
                name: "$CI_JOB_STAGE-$CI_COMMIT_REF_SLUG"
                when: always
                expire_in: 3 months
                paths:
                  - coverage*
                  - reports/
                reports:
                  dotenv: out.env
                  junit: test_results.xml
            """), "job");

        assertThat(job.artifacts().name()).isEqualTo("$CI_JOB_STAGE-$CI_COMMIT_REF_SLUG");
        assertThat(job.artifacts().when()).isEqualTo(ArtifactWhen.ALWAYS);
        assertThat(job.artifacts().expireIn()).isEqualTo(Duration.ofDays(90));
        assertThat(job.artifacts().paths()).containsExactly("coverage*", "reports/");
        assertThat(job.artifacts().dotenvReport()).isEqualTo("out.env");
    }

    @Test
    void cache_키_경로_정책() {
        JobTemplate job = template(loader.parse("""
            job:
              cache:
                key: same_db_on_all_runners
                policy: pull
                paths:
                  - .hypothesis
            """), "job");

        assertThat(job.cache().key()).isEqualTo("same_db_on_all_runners");
        assertThat(job.cache().policy()).isEqualTo(CachePolicy.PULL);
        assertThat(job.cache().paths()).containsExactly(".hypothesis");
    }

    @Test
    void cache_key_맵_형태는_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("""
            job:
              cache:
                key:
                  files: [Gemfile.lock]
            """))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("cache.key");
    }

    @Test
    void needs_문자열과_맵_형태() {
        JobTemplate job = template(loader.parse("""
            job:
              needs:
                - build
                - job: lint
                  artifacts: false
                - job: docs
                  optional: true
            """), "job");

        assertThat(job.needs()).containsExactly(
            NeedSpec.of("build"),
            new NeedSpec(JobName.of("lint"), false, false),
            NeedSpec.optional("docs")
        );
    }

    @Test
    void 빈_needs는_지정된_빈_목록() {
        JobTemplate job = template(loader.parse("job: {needs: []}"), "job");

        assertThat(job.needs()).isEmpty();
    }

    @Test
    void 이미지와_environment의_문자열_및_맵_형태() {
        PipelineDefinition definition = loader.parse("""
            plain:
              image: alpine:3
              environment: production
            mapped:
              image:
                name: alpine:3
              environment:
                name: safe
                url: https://example.org
            """);

        assertThat(template(definition, "plain").image()).isEqualTo("alpine:3");
        assertThat(template(definition, "plain").environment()).isEqualTo("production");
        assertThat(template(definition, "mapped").image()).isEqualTo("alpine:3");
        assertThat(template(definition, "mapped").environment()).isEqualTo("safe");
    }

    @Test
    void script_문자열과_목록() {
        PipelineDefinition definition = loader.parse("""
            single:
              script: ./run.sh
            multi:
              script:
                - . /venv/bin/activate
                - ./run.sh
            """);

        assertThat(template(definition, "single").script()).containsExactly("./run.sh");
        assertThat(template(definition, "multi").script()).containsExactly(". /venv/bin/activate", "./run.sh");
    }

    @Test
    void 나머지_스칼라_키() {
        JobTemplate job = template(loader.parse("""
            job:
              stage: deploy
              tags: [mike]
              allow_failure: true
              resource_group: docs_deploy
              timeout: 5h
              dependencies: [build, lint]
              variables:
                EMPTY: ""
            """), "job");

        assertThat(job.stage()).isEqualTo("deploy");
        assertThat(job.tags()).containsExactly("mike");
        assertThat(job.allowFailure()).isTrue();
        assertThat(job.resourceGroup()).isEqualTo("docs_deploy");
        assertThat(job.timeout()).isEqualTo(Duration.ofHours(5));
        assertThat(job.dependencies()).containsExactly(JobName.of("build"), JobName.of("lint"));
        assertThat(job.variables()).containsEntry("EMPTY", "");
    }

    @Test
    void 엔진이_다루지_않는_키는_무시() {
        JobTemplate job = template(loader.parse("""
            job:
              before_script: [echo hi]
              interruptible: true
              script: make
            """), "job");

        assertThat(job.script()).containsExactly("make");
    }

    @Test
    void 알_수_없는_키는_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("job: {scirpt: make}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("scirpt");
    }

    @Test
    void allow_failure_맵_형태는_ConfigurationException() {
        assertThatThrownBy(() -> loader.parse("job: {allow_failure: {exit_codes: [1]}}"))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("allow_failure");
    }

    private static JobTemplate template(PipelineDefinition definition, String name) {
        JobTemplate template = definition.templates().get(JobName.of(name));
        assertThat(template).as("template %s", name).isNotNull();
        return template;
    }
}
