package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.definition.JobTemplate;
import com.ryuqq.pipeline.core.definition.NeedSpec;
import com.ryuqq.pipeline.core.definition.PipelineDefinition;
import com.ryuqq.pipeline.core.definition.Stages;
import com.ryuqq.pipeline.core.definition.TemplateResolver;
import com.ryuqq.pipeline.core.error.GraphException;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineContext;
import com.ryuqq.pipeline.core.rule.JobInclusion;
import com.ryuqq.pipeline.core.rule.RuleEvaluator;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 파이프라인 정의와 컨텍스트로부터 {@link JobGraph}를 빌드.
 *
 * <p>처리 순서:</p>
 * <ol>
 *   <li>extends 해석 후 숨김 Job(이름이 '.'으로 시작) 제외</li>
 *   <li>각 Job의 rules를 컨텍스트로 평가, EXCLUDED는 그래프에서 제외</li>
 *   <li>간선 생성: needs가 있으면 needs 대상만, 없으면 이전 stage의 모든 Job</li>
 *   <li>순환 검사 후 위상 정렬 (동률은 선언 순서)</li>
 * </ol>
 *
 * <p>빌드는 순수 함수입니다. 같은 정의와 컨텍스트는 항상 같은 그래프를 만듭니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobGraphBuilder {

    private static final Logger log = LoggerFactory.getLogger(JobGraphBuilder.class);

    private JobGraphBuilder() {
    }

    /**
     * 그래프 빌드.
     *
     * @param definition 파이프라인 정의
     * @param context 파이프라인 컨텍스트
     * @return 불변 JobGraph
     * @throws com.ryuqq.pipeline.core.error.ConfigurationException extends/stage 오류
     * @throws GraphException needs/dependencies 참조 오류 또는 순환
     */
    public static JobGraph build(PipelineDefinition definition, PipelineContext context) {
        if (definition == null) {
            throw new IllegalArgumentException("definition cannot be null");
        }
        if (context == null) {
            throw new IllegalArgumentException("context cannot be null");
        }

        Stages stages = definition.stages();
        PipelineContext effective = context.withDefaultVariables(definition.variables());

        Map<JobName, JobDefinition> visible = new LinkedHashMap<>();
        for (JobTemplate template : TemplateResolver.resolveAll(definition.templates()).values()) {
            if (!template.isHidden()) {
                visible.put(template.name(), JobDefinition.from(template, stages));
            }
        }

        Map<JobName, JobInclusion> live = new LinkedHashMap<>();
        List<JobDefinition> excluded = new ArrayList<>();
        for (JobDefinition job : visible.values()) {
            JobInclusion inclusion = RuleEvaluator.evaluate(job.rules(), effective);
            if (inclusion.isIncluded()) {
                live.put(job.name(), inclusion);
            } else {
                excluded.add(job);
            }
        }

        Map<JobName, Integer> declarationIndex = new LinkedHashMap<>();
        DirectedAcyclicGraph<JobName, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        for (JobName name : live.keySet()) {
            declarationIndex.put(name, declarationIndex.size());
            dag.addVertex(name);
        }

        Map<JobName, List<JobName>> predecessors = new LinkedHashMap<>();
        Map<JobName, List<ArtifactSource>> sources = new LinkedHashMap<>();
        for (JobName name : live.keySet()) {
            JobDefinition job = visible.get(name);
            List<JobName> upstream = upstreamOf(job, visible, live.keySet(), stages);
            for (JobName from : upstream) {
                addEdge(dag, from, name);
            }
            predecessors.put(name, upstream);
            sources.put(name, artifactSourcesOf(job, visible, live.keySet(), stages));
        }

        TopologicalOrderIterator<JobName, DefaultEdge> order =
            new TopologicalOrderIterator<>(dag, Comparator.comparing(declarationIndex::get));
        List<JobNode> nodes = new ArrayList<>(live.size());
        while (order.hasNext()) {
            JobName name = order.next();
            JobDefinition job = visible.get(name);
            nodes.add(new JobNode(job, live.get(name), stages.indexOf(job.stage()),
                predecessors.get(name), sources.get(name)));
        }

        JobGraph graph = new JobGraph(stages, effective, nodes, excluded);
        log.debug("Built job graph: ref={}, source={}, {}", context.refName(), context.source().wireValue(), graph);
        return graph;
    }

    private static List<JobName> upstreamOf(
        JobDefinition job,
        Map<JobName, JobDefinition> visible,
        Set<JobName> live,
        Stages stages
    ) {
        int stageIndex = stages.indexOf(job.stage());
        Set<JobName> upstream = new LinkedHashSet<>();

        if (!job.hasNeeds()) {
            for (JobName candidate : live) {
                if (stages.indexOf(visible.get(candidate).stage()) < stageIndex) {
                    upstream.add(candidate);
                }
            }
            return List.copyOf(upstream);
        }

        for (NeedSpec need : job.needs()) {
            JobName target = need.job();
            JobDefinition targetJob = visible.get(target);
            if (targetJob == null) {
                throw new GraphException("Job '" + job.name() + "' needs unknown job '" + target + "'");
            }
            if (target.equals(job.name())) {
                throw new GraphException("Job '" + job.name() + "' cannot need itself");
            }
            if (stages.indexOf(targetJob.stage()) > stageIndex) {
                throw new GraphException("Job '" + job.name() + "' (stage " + job.stage() + ") needs '"
                    + target + "' from later stage " + targetJob.stage());
            }
            if (!live.contains(target)) {
                if (need.optional()) {
                    continue;
                }
                throw new GraphException("Job '" + job.name() + "' needs '" + target
                    + "' which is excluded by rules (mark the need optional to allow this)");
            }
            upstream.add(target);
        }
        return List.copyOf(upstream);
    }

    private static List<ArtifactSource> artifactSourcesOf(
        JobDefinition job,
        Map<JobName, JobDefinition> visible,
        Set<JobName> live,
        Stages stages
    ) {
        int stageIndex = stages.indexOf(job.stage());
        Map<JobName, ArtifactSource> result = new LinkedHashMap<>();

        if (job.dependencies() != null) {
            Set<JobName> needed = new LinkedHashSet<>();
            if (job.hasNeeds()) {
                job.needs().forEach(need -> needed.add(need.job()));
            }
            for (JobName dependency : job.dependencies()) {
                JobDefinition upstream = visible.get(dependency);
                if (upstream == null) {
                    throw new GraphException("Job '" + job.name() + "' depends on unknown job '" + dependency + "'");
                }
                if (job.hasNeeds() && !needed.contains(dependency)) {
                    throw new GraphException("Job '" + job.name() + "' lists dependency '" + dependency
                        + "' which is not in its needs");
                }
                if (!job.hasNeeds() && stages.indexOf(upstream.stage()) >= stageIndex) {
                    throw new GraphException("Job '" + job.name() + "' depends on '" + dependency
                        + "' which is not in an earlier stage");
                }
                if (live.contains(dependency)) {
                    result.putIfAbsent(dependency, new ArtifactSource(dependency, upstream.artifacts() != null));
                }
            }
            return List.copyOf(result.values());
        }

        if (job.hasNeeds()) {
            for (NeedSpec need : job.needs()) {
                if (need.artifacts() && live.contains(need.job())) {
                    boolean required = !need.optional() && visible.get(need.job()).artifacts() != null;
                    result.putIfAbsent(need.job(), new ArtifactSource(need.job(), required));
                }
            }
            return List.copyOf(result.values());
        }

        for (JobName candidate : live) {
            if (stages.indexOf(visible.get(candidate).stage()) < stageIndex) {
                result.put(candidate, new ArtifactSource(candidate, false));
            }
        }
        return List.copyOf(result.values());
    }

    private static void addEdge(DirectedAcyclicGraph<JobName, DefaultEdge> dag, JobName from, JobName to) {
        try {
            dag.addEdge(from, to);
        } catch (IllegalArgumentException e) {
            throw new GraphException("Dependency cycle detected: '" + from + "' -> '" + to + "' closes a cycle", e);
        }
    }
}
