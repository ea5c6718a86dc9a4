package com.ryuqq.pipeline.cli;

import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.graph.JobGraph;
import com.ryuqq.pipeline.core.graph.JobGraphBuilder;
import com.ryuqq.pipeline.core.graph.JobNode;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineContext;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;
import java.util.stream.Collectors;

/**
 * {@code pipeline plan}: 실행 없이 Job 그래프만 출력.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@Command(
    name = "plan",
    mixinStandardHelpOptions = true,
    description = "Prints the job graph the definition produces for the given ref, source and variables."
)
public class PlanCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Mixin
    ContextOptions context;

    @Override
    public Integer call() throws Exception {
        PipelineDefinition definition = context.loadDefinition();
        PipelineContext pipelineContext = context.toPipelineContext();
        JobGraph graph = JobGraphBuilder.build(definition, pipelineContext);

        PrintWriter out = spec.commandLine().getOut();
        out.printf("Pipeline for %s (source: %s), %d job(s)%n",
            pipelineContext.refName(), pipelineContext.source().wireValue(), graph.size());
        for (String stage : graph.stages().names()) {
            List<JobNode> jobs = graph.nodes().stream()
                .filter(node -> node.definition().stage().equals(stage))
                .toList();
            if (jobs.isEmpty()) {
                continue;
            }
            out.printf("stage %s%n", stage);
            for (JobNode node : jobs) {
                out.printf("  %s [%s]%s%n", node.name(), node.inclusion().name().toLowerCase(Locale.ROOT), describeWaits(node));
            }
        }
        List<JobDefinition> excluded = graph.excluded();
        if (!excluded.isEmpty()) {
            out.printf("excluded by rules: %s%n",
                excluded.stream().map(job -> job.name().getValue()).collect(Collectors.joining(", ")));
        }
        out.flush();
        return 0;
    }

    private static String describeWaits(JobNode node) {
        if (node.predecessors().isEmpty()) {
            return "";
        }
        return " <- " + node.predecessors().stream()
            .map(JobName::getValue)
            .collect(Collectors.joining(", "));
    }
}
