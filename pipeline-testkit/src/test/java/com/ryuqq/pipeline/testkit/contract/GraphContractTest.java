package com.ryuqq.pipeline.testkit.contract;

import com.ryuqq.pipeline.application.result.PipelineResult;
import com.ryuqq.pipeline.application.result.PipelineStatus;
import com.ryuqq.pipeline.core.definition.NeedSpec;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.error.ConfigurationException;
import com.ryuqq.pipeline.core.error.GraphException;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.graph.JobNode;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.rule.JobInclusion;
import com.ryuqq.pipeline.core.rule.Rule;
import com.ryuqq.pipeline.core.rule.When;
import com.ryuqq.pipeline.core.statemachine.SkipReason;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: rule evaluation and graph construction.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>The first matching rule decides inclusion</li>
 *   <li>needs pointing at a later stage, a cycle, or an excluded job is rejected</li>
 *   <li>Building twice from the same input yields the same graph</li>
 *   <li>A pipeline whose jobs are all excluded succeeds without dispatching</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
class GraphContractTest extends AbstractPipelineContractTest {

    @Test
    void testRules_FirstMatchWins() {
        // Given: manual on main, never elsewhere
        PipelineDefinition definition = definition(List.of("deploy"),
            job("release").stage("deploy").rules(
                Rule.of("$CI_COMMIT_BRANCH == \"main\"", When.MANUAL),
                Rule.of("$CI_COMMIT_BRANCH", When.ALWAYS),
                Rule.unconditional(When.NEVER)
            ).build());

        // When
        JobGraph main = graph(definition, push("main"));
        JobGraph feature = graph(definition, push("feature/login"));

        // Then
        assertEquals(JobInclusion.MANUAL, main.node(JobName.of("release")).inclusion());
        assertEquals(JobInclusion.ALWAYS, feature.node(JobName.of("release")).inclusion());
    }

    @Test
    void testRules_NoMatch_ExcludesJob() {
        PipelineDefinition definition = definition(List.of("test"),
            job("nightly").stage("test").rules(Rule.of("$CI_PIPELINE_SOURCE == \"schedule\"", When.ON_SUCCESS)).build(),
            job("unit").stage("test").build());

        JobGraph graph = graph(definition, push("main"));

        assertFalse(graph.contains(JobName.of("nightly")));
        assertTrue(graph.contains(JobName.of("unit")));
        assertEquals(1, graph.excluded().size());
        assertEquals(JobName.of("nightly"), graph.excluded().get(0).name());
    }

    @Test
    void testNeeds_LaterStage_ThrowsGraphException() {
        PipelineDefinition definition = definition(List.of("build", "test"),
            job("compile").stage("build").needs("unit").build(),
            job("unit").stage("test").build());

        GraphException exception = assertThrows(GraphException.class,
            () -> graph(definition, push("main")));
        assertTrue(exception.getMessage().contains("later stage"), exception.getMessage());
    }

    @Test
    void testNeeds_Cycle_ThrowsGraphException() {
        PipelineDefinition definition = definition(List.of("test"),
            job("a").stage("test").needs("b").build(),
            job("b").stage("test").needs("a").build());

        assertThrows(GraphException.class, () -> graph(definition, push("main")));
    }

    @Test
    void testNeeds_UnknownJob_ThrowsGraphException() {
        PipelineDefinition definition = definition(List.of("test"),
            job("unit").stage("test").needs("compile").build());

        assertThrows(GraphException.class, () -> graph(definition, push("main")));
    }

    @Test
    void testNeeds_ExcludedJob_RequiresOptional() {
        Rule neverRule = Rule.unconditional(When.NEVER);
        PipelineDefinition strict = definition(List.of("build", "test"),
            job("compile").stage("build").rules(neverRule).build(),
            job("unit").stage("test").needs("compile").build());
        PipelineDefinition optional = definition(List.of("build", "test"),
            job("compile").stage("build").rules(neverRule).build(),
            job("unit").stage("test").needs(List.of(NeedSpec.optional("compile"))).build());

        assertThrows(GraphException.class, () -> graph(strict, push("main")));

        JobGraph graph = graph(optional, push("main"));
        assertTrue(graph.node(JobName.of("unit")).predecessors().isEmpty());
    }

    @Test
    void testUndefinedStage_ThrowsConfigurationException() {
        PipelineDefinition definition = definition(List.of("build"),
            job("unit").stage("verify").build());

        assertThrows(ConfigurationException.class, () -> graph(definition, push("main")));
    }

    @Test
    void testBuild_SameInput_SameGraph() {
        // Given
        PipelineDefinition definition = definition(List.of("build", "test", "deploy"),
            job(".base").tags("docker").build(),
            job("compile").extendsFrom(".base").stage("build").build(),
            job("lint").stage("build").build(),
            job("unit").stage("test").needs("compile").build(),
            job("e2e").stage("test").build(),
            job("ship").stage("deploy").build());

        // When
        JobGraph first = graph(definition, push("main"));
        JobGraph second = graph(definition, push("main"));

        // Then
        assertEquals(names(first), names(second));
        assertEquals(first.edgeCount(), second.edgeCount());
        for (JobNode node : first.nodes()) {
            assertEquals(node.predecessors(), second.node(node.name()).predecessors());
            assertEquals(node.artifactSources(), second.node(node.name()).artifactSources());
        }
        assertEquals(List.of("docker"), first.node(JobName.of("compile")).definition().tags());
    }

    @Test
    void testAllJobsExcluded_PipelineSucceedsWithoutDispatch() {
        PipelineDefinition definition = definition(List.of("test"),
            job("nightly").stage("test").rules(Rule.of("$CI_PIPELINE_SOURCE == \"schedule\"", When.ALWAYS)).build());

        PipelineResult result = run(definition);

        assertEquals(PipelineStatus.SUCCESS, result.status());
        assertSkipped(result, "nightly", SkipReason.RULES_EXCLUDED);
        assertTrue(executor.dispatches().isEmpty());
    }

    private static List<String> names(JobGraph graph) {
        return graph.nodes().stream().map(node -> node.name().getValue()).toList();
    }
}
