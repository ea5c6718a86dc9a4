package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.definition.ArtifactSpec;
import com.ryuqq.pipeline.core.definition.JobTemplate;
import com.ryuqq.pipeline.core.definition.NeedSpec;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.definition.Stages;
import com.ryuqq.pipeline.core.error.GraphException;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.model.PipelineSource;
import com.ryuqq.pipeline.core.rule.JobInclusion;
import com.ryuqq.pipeline.core.rule.Rule;
import com.ryuqq.pipeline.core.rule.When;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JobGraphBuilder 테스트.
 *
 * <p>stage 순서 기반 간선, needs 기반 간선, rules 제외와 그래프 오류를 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class JobGraphBuilderTest {

    private static final Stages STAGES = Stages.of(List.of("build", "test", "deploy"));
    private static final PipelineContext MAIN = PipelineContext.forBranch("main", PipelineSource.PUSH);

    private static PipelineDefinition pipeline(JobTemplate... jobs) {
        return PipelineDefinition.of(STAGES, Map.of(), List.of(jobs));
    }

    private static JobName name(String value) {
        return JobName.of(value);
    }

    // ========== stage 기반 간선 ==========

    @Test
    void build_StageOrder_EveryEarlierJobIsPredecessor() {
        // Given
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").build(),
            JobTemplate.builder("docs").stage("build").build(),
            JobTemplate.builder("unit").stage("test").build(),
            JobTemplate.builder("release").stage("deploy").build()
        );

        // When
        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        // Then
        assertEquals(4, graph.size());
        assertEquals(List.of(name("compile"), name("docs")), graph.predecessors(name("unit")));
        assertEquals(List.of(name("compile"), name("docs"), name("unit")), graph.predecessors(name("release")));
        assertTrue(graph.predecessors(name("compile")).isEmpty());
        assertEquals(List.of(name("unit"), name("release")), graph.successors(name("compile")));
        assertEquals(5, graph.edgeCount());
    }

    @Test
    void build_TopologicalOrderFollowsDeclarationWithinStage() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("zeta").stage("test").build(),
            JobTemplate.builder("alpha").stage("test").build(),
            JobTemplate.builder("compile").stage("build").build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        List<JobName> order = graph.nodes().stream().map(JobNode::name).toList();
        assertEquals(List.of(name("compile"), name("zeta"), name("alpha")), order);
    }

    @Test
    void build_HiddenTemplatesAreNotJobs() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder(".base").stage("build").image("alpine").build(),
            JobTemplate.builder("compile").extendsFrom(".base").build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertEquals(1, graph.size());
        assertFalse(graph.contains(name(".base")));
        assertEquals("alpine", graph.node(name("compile")).definition().image());
        assertEquals("build", graph.node(name("compile")).definition().stage());
    }

    // ========== needs 기반 간선 ==========

    @Test
    void build_Needs_ReplaceStageEdges() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").build(),
            JobTemplate.builder("docs").stage("build").build(),
            JobTemplate.builder("unit").stage("test").needs("compile").build(),
            JobTemplate.builder("lint").stage("test").needs().build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertEquals(List.of(name("compile")), graph.predecessors(name("unit")));
        assertTrue(graph.predecessors(name("lint")).isEmpty());
        assertTrue(graph.hasEdge(name("compile"), name("unit")));
        assertFalse(graph.hasEdge(name("docs"), name("unit")));
    }

    @Test
    void build_NeedsWithinSameStage_Allowed() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("unit").stage("test").build(),
            JobTemplate.builder("coverage").stage("test").needs("unit").build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertEquals(List.of(name("unit")), graph.predecessors(name("coverage")));
    }

    @Test
    void build_NeedsUnknownJob_ThrowsGraphException() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("unit").stage("test").needs("compile").build()
        );

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(definition, MAIN));
        assertTrue(exception.getMessage().contains("needs unknown job"));
    }

    @Test
    void build_NeedsItself_ThrowsGraphException() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("unit").stage("test").needs("unit").build()
        );

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(definition, MAIN));
        assertTrue(exception.getMessage().contains("cannot need itself"));
    }

    @Test
    void build_NeedsLaterStage_ThrowsGraphException() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").needs("unit").build(),
            JobTemplate.builder("unit").stage("test").build()
        );

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(definition, MAIN));
        assertTrue(exception.getMessage().contains("from later stage"));
    }

    @Test
    void build_NeedsCycle_ThrowsGraphException() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("a").stage("test").needs("b").build(),
            JobTemplate.builder("b").stage("test").needs("a").build()
        );

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(definition, MAIN));
        assertTrue(exception.getMessage().contains("Dependency cycle detected"));
    }

    // ========== rules 제외 ==========

    @Test
    void build_ExcludedJob_RecordedAndRemovedFromStageEdges() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").build(),
            JobTemplate.builder("nightly").stage("build")
                .rules(Rule.of("$CI_PIPELINE_SOURCE == \"schedule\"", When.ON_SUCCESS))
                .build(),
            JobTemplate.builder("unit").stage("test").build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertFalse(graph.contains(name("nightly")));
        assertEquals(1, graph.excluded().size());
        assertEquals(name("nightly"), graph.excluded().get(0).name());
        assertEquals(List.of(name("compile")), graph.predecessors(name("unit")));
    }

    @Test
    void build_NeedsExcludedJob_RequiresOptional() {
        JobTemplate nightly = JobTemplate.builder("nightly").stage("build")
            .rules(Rule.of("$CI_PIPELINE_SOURCE == \"schedule\"", When.ON_SUCCESS))
            .build();

        PipelineDefinition strict = pipeline(nightly, JobTemplate.builder("unit").stage("test").needs("nightly").build());
        PipelineDefinition lenient = pipeline(nightly, JobTemplate.builder("unit").stage("test")
            .needs(List.of(NeedSpec.optional("nightly"))).build());

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(strict, MAIN));
        assertTrue(exception.getMessage().contains("which is excluded by rules"));
        assertTrue(JobGraphBuilder.build(lenient, MAIN).predecessors(name("unit")).isEmpty());
    }

    @Test
    void build_RulesSeeDefinitionVariables() {
        PipelineDefinition definition = PipelineDefinition.of(STAGES, Map.of("DEPLOY_ENABLED", "true"), List.of(
            JobTemplate.builder("release").stage("deploy")
                .rules(Rule.of("$DEPLOY_ENABLED == \"true\"", When.MANUAL))
                .build()
        ));

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertEquals(JobInclusion.MANUAL, graph.node(name("release")).inclusion());
        assertEquals("true", graph.context().variable("DEPLOY_ENABLED"));
    }

    // ========== 아티팩트 소스 ==========

    @Test
    void build_ArtifactSources_RequiredOnlyForNeedsOnArtifactProducers() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").artifacts(ArtifactSpec.of(List.of("build/"))).build(),
            JobTemplate.builder("docs").stage("build").build(),
            JobTemplate.builder("unit").stage("test").build(),
            JobTemplate.builder("package").stage("test").needs("compile", "docs").build(),
            JobTemplate.builder("lint").stage("test").needs(List.of(NeedSpec.withoutArtifacts("compile"))).build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertEquals(
            List.of(new ArtifactSource(name("compile"), false), new ArtifactSource(name("docs"), false)),
            graph.node(name("unit")).artifactSources());
        assertEquals(
            List.of(new ArtifactSource(name("compile"), true), new ArtifactSource(name("docs"), false)),
            graph.node(name("package")).artifactSources());
        assertTrue(graph.node(name("lint")).artifactSources().isEmpty());
    }

    @Test
    void build_DependenciesOutsideNeeds_ThrowsGraphException() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").build(),
            JobTemplate.builder("docs").stage("build").build(),
            JobTemplate.builder("unit").stage("test").needs("compile").dependencies("docs").build()
        );

        GraphException exception = assertThrows(GraphException.class, () -> JobGraphBuilder.build(definition, MAIN));
        assertTrue(exception.getMessage().contains("not in its needs"));
    }

    @Test
    void build_EmptyDependencies_NoArtifactSources() {
        PipelineDefinition definition = pipeline(
            JobTemplate.builder("compile").stage("build").artifacts(ArtifactSpec.of(List.of("build/"))).build(),
            JobTemplate.builder("unit").stage("test").dependencies().build()
        );

        JobGraph graph = JobGraphBuilder.build(definition, MAIN);

        assertTrue(graph.node(name("unit")).artifactSources().isEmpty());
        assertEquals(List.of(name("compile")), graph.predecessors(name("unit")));
    }
}
