package com.ryuqq.pipeline.adapter.yaml;

import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.error.GraphException;
import com.ryuqq.pipeline.core.graph.ArtifactSource;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.graph.JobGraphBuilder;
import com.ryuqq.pipeline.core.graph.JobNode;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.model.PipelineSource;
import com.ryuqq.pipeline.core.retry.FailureReason;
import com.ryuqq.pipeline.core.rule.JobInclusion;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 실제 CI 정의 문서(fixtures/ci.yml)를 로드해 트리거별 그래프를 검증.
 *
 * <p>문서 구성: 숨김 템플릿 4개, Job 26개, stage 4개 (preflight, docker images, test/build, deploy).</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class CiDefinitionGraphTest {

    private PipelineDefinition definition;

    @BeforeEach
    void setUp() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/fixtures/ci.yml")) {
            assertThat(in).as("fixtures/ci.yml on the test classpath").isNotNull();
            definition = new YamlPipelineLoader().load(in);
        }
    }

    @Test
    void 문서_전체_로드() {
        assertThat(definition.stages().names())
            .containsExactly(".pre", "preflight", "docker images", "test/build", "deploy", ".post");
        assertThat(definition.templates()).hasSize(30);
        assertThat(definition.templates().keySet().stream().filter(JobName::isHidden))
            .extracting(JobName::getValue)
            .containsExactly(".test_base", ".pytest", ".pytest_weekly", ".submit");
    }

    // ============================================================
    // 1. main 브랜치 push
    // ============================================================

    @Test
    void main_push_주간_Job만_제외() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        assertThat(graph.size()).isEqualTo(23);
        assertThat(graph.excluded())
            .extracting(job -> job.name().getValue())
            .containsExactlyInAnyOrder("vanilla current weekly", "vanilla oldest weekly", "submit coverage weekly");
    }

    @Test
    void main_push_extends_병합_결과() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        JobNode vanilla = graph.node(JobName.of("vanilla current"));
        assertThat(vanilla.definition().stage()).isEqualTo("test/build");
        assertThat(vanilla.definition().tags()).containsExactly("long execution time", "autoscaling");
        assertThat(vanilla.definition().environment()).isEqualTo("unsafe");
        assertThat(vanilla.definition().retry().effectiveMax()).isEqualTo(2);
        assertThat(vanilla.definition().retry().effectiveWhen().matches(FailureReason.RUNNER_SYSTEM_FAILURE)).isTrue();
        assertThat(vanilla.definition().retry().effectiveWhen().matches(FailureReason.SCRIPT_FAILURE)).isFalse();
        assertThat(vanilla.definition().artifacts().expireIn()).isEqualTo(Duration.ofDays(90));
        assertThat(vanilla.definition().cache().key()).isEqualTo("same_db_on_all_runners");
        assertThat(vanilla.definition().variables())
            .containsEntry("PYMOR_HYPOTHESIS_PROFILE", "ci")
            .containsEntry("PYMOR_PYTEST_EXTRA", "");

        JobNode mpi = graph.node(JobName.of("mpi current"));
        assertThat(mpi.definition().retry().effectiveWhen().matches(FailureReason.SCRIPT_FAILURE)).isTrue();
        assertThat(mpi.definition().variables()).containsEntry("PYMOR_CONFIG_DISABLE", "");
    }

    @Test
    void main_push_stage_순서_대기() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        JobNode buildImage = graph.node(JobName.of("build current image"));
        assertThat(buildImage.predecessors()).containsExactly(JobName.of("preflight"));

        JobNode vanilla = graph.node(JobName.of("vanilla current"));
        assertThat(vanilla.predecessors()).containsExactly(
            JobName.of("preflight"),
            JobName.of("build current image"),
            JobName.of("build oldest image"),
            JobName.of("build fenics image"));
    }

    @Test
    void main_push_needs는_stage_대기를_우회() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        JobNode coverageHtml = graph.node(JobName.of("coverage html"));
        assertThat(coverageHtml.predecessors())
            .containsExactly(JobName.of("submit coverage"), JobName.of("preflight"));
        assertThat(graph.hasEdge(JobName.of("submit coverage"), JobName.of("coverage html"))).isTrue();

        JobNode docs = graph.node(JobName.of("docs"));
        assertThat(docs.predecessors()).containsExactly(JobName.of("docs build"), JobName.of("preflight"));
        assertThat(docs.definition().resourceGroup()).isEqualTo("docs_deploy");
        assertThat(docs.definition().tags()).containsExactly("mike");
    }

    @Test
    void main_push_dependencies는_아티팩트_출처() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        JobNode submit = graph.node(JobName.of("submit coverage"));
        assertThat(submit.artifactSources())
            .extracting(ArtifactSource::job)
            .extracting(JobName::getValue)
            .containsExactly("mpi current", "tutorials current", "vanilla current", "ngsolve current",
                "dunegdt current", "scikit_fem current", "fenics", "fenics mpi", "preflight");
        assertThat(submit.artifactSources()).allMatch(ArtifactSource::required);

        JobNode tagImages = graph.node(JobName.of("tag docker images"));
        assertThat(tagImages.artifactSources())
            .containsExactly(new ArtifactSource(JobName.of("preflight"), true));
    }

    @Test
    void 위상_정렬은_선행_Job을_먼저_배치() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.PUSH));

        assertThat(graph.nodes()).first()
            .extracting(JobNode::name)
            .isEqualTo(JobName.of("preflight"));
        int position = 0;
        Map<JobName, Integer> positions = new HashMap<>();
        for (JobNode node : graph.nodes()) {
            positions.put(node.name(), position++);
        }
        for (JobNode node : graph.nodes()) {
            for (JobName predecessor : node.predecessors()) {
                assertThat(positions.get(predecessor)).isLessThan(positions.get(node.name()));
            }
        }
    }

    // ============================================================
    // 2. 다른 트리거
    // ============================================================

    @Test
    void schedule_파이프라인은_주간_Job과_이미지_Job만_실행() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forBranch("main", PipelineSource.SCHEDULE));

        assertThat(graph.nodes())
            .extracting(node -> node.name().getValue())
            .containsExactlyInAnyOrder("preflight", "build current image", "build oldest image",
                "build fenics image", "vanilla current weekly", "vanilla oldest weekly",
                "submit coverage weekly", "tag docker images");
        assertThat(graph.excluded()).hasSize(18);

        JobNode weekly = graph.node(JobName.of("vanilla current weekly"));
        assertThat(weekly.inclusion()).isEqualTo(JobInclusion.ALWAYS);
        assertThat(weekly.definition().timeout()).isEqualTo(Duration.ofHours(5));
        assertThat(weekly.definition().variables()).containsEntry("PYMOR_HYPOTHESIS_PROFILE", "ci_large");
    }

    @Test
    void feature_브랜치에서는_이미지_태그_Job_제외() {
        JobGraph graph = JobGraphBuilder.build(definition,
            PipelineContext.forBranch("feature/x", PipelineSource.PUSH));

        assertThat(graph.contains(JobName.of("tag docker images"))).isFalse();
        assertThat(graph.contains(JobName.of("docs"))).isTrue();
    }

    @Test
    void 태그_파이프라인에서는_이미지_태그_Job_포함() {
        JobGraph graph = JobGraphBuilder.build(definition, PipelineContext.forTag("2024.1.0"));

        assertThat(graph.contains(JobName.of("tag docker images"))).isTrue();
    }

    @Test
    void staging_브랜치는_preflight가_제외되어_needs_검증_실패() {
        PipelineContext staging = PipelineContext.forBranch("staging-next", PipelineSource.PUSH);

        assertThatThrownBy(() -> JobGraphBuilder.build(definition, staging))
            .isInstanceOf(GraphException.class)
            .hasMessageContaining("preflight");
    }
}
