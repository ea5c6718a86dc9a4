package com.ryuqq.pipeline.core.graph;

import com.ryuqq.pipeline.core.definition.JobDefinition;
import com.ryuqq.pipeline.core.definition.Stages;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineContext;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 한 번의 파이프라인 실행을 위한 Job DAG (불변).
 *
 * <p>노드는 위상 순서로 보관되며, 같은 입력으로 다시 빌드하면 동일한 순서와 간선을 가집니다.
 * rules로 제외된 Job은 결과 보고를 위해 별도로 보관됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class JobGraph {

    private final Stages stages;
    private final PipelineContext context;
    private final Map<JobName, JobNode> nodes;
    private final Map<JobName, List<JobName>> successors;
    private final List<JobDefinition> excluded;

    JobGraph(Stages stages, PipelineContext context, List<JobNode> topologicalOrder, List<JobDefinition> excluded) {
        this.stages = stages;
        this.context = context;

        Map<JobName, JobNode> byName = new LinkedHashMap<>();
        Map<JobName, List<JobName>> next = new LinkedHashMap<>();
        for (JobNode node : topologicalOrder) {
            byName.put(node.name(), node);
            next.put(node.name(), new ArrayList<>());
        }
        for (JobNode node : topologicalOrder) {
            for (JobName predecessor : node.predecessors()) {
                next.get(predecessor).add(node.name());
            }
        }
        next.replaceAll((name, list) -> List.copyOf(list));

        this.nodes = Collections.unmodifiableMap(byName);
        this.successors = Collections.unmodifiableMap(next);
        this.excluded = List.copyOf(excluded);
    }

    public Stages stages() {
        return stages;
    }

    /**
     * 그래프 빌드에 사용된 컨텍스트 (정의 전역 변수 포함).
     */
    public PipelineContext context() {
        return context;
    }

    /**
     * 위상 순서의 노드 목록.
     */
    public Collection<JobNode> nodes() {
        return nodes.values();
    }

    /**
     * 노드 조회.
     *
     * @param name Job 이름
     * @return 노드
     * @throws IllegalArgumentException 그래프에 없는 Job인 경우
     */
    public JobNode node(JobName name) {
        JobNode node = nodes.get(name);
        if (node == null) {
            throw new IllegalArgumentException("Job not in graph: " + name);
        }
        return node;
    }

    public boolean contains(JobName name) {
        return nodes.containsKey(name);
    }

    public List<JobName> predecessors(JobName name) {
        return node(name).predecessors();
    }

    public List<JobName> successors(JobName name) {
        List<JobName> list = successors.get(name);
        if (list == null) {
            throw new IllegalArgumentException("Job not in graph: " + name);
        }
        return list;
    }

    public boolean hasEdge(JobName from, JobName to) {
        return contains(to) && node(to).predecessors().contains(from);
    }

    public int edgeCount() {
        return nodes.values().stream().mapToInt(node -> node.predecessors().size()).sum();
    }

    /**
     * rules로 제외된 Job (선언 순서).
     */
    public List<JobDefinition> excluded() {
        return excluded;
    }

    public int size() {
        return nodes.size();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    @Override
    public String toString() {
        return "JobGraph{jobs=" + nodes.keySet() + ", edges=" + edgeCount() + ", excluded=" + excluded.size() + '}';
    }
}
