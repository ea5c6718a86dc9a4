package com.ryuqq.pipeline.application.scheduler;

import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;

import java.util.Arrays;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 파이프라인 한 번의 실행 옵션.
 *
 * @param pipelineId 실행 ID (null이면 생성)
 * @param playedJobs 실행할 manual Job (포함되지 않은 manual Job은 SKIPPED)
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record RunOptions(PipelineId pipelineId, Set<JobName> playedJobs) {

    public RunOptions {
        pipelineId = pipelineId == null ? PipelineId.generate() : pipelineId;
        playedJobs = playedJobs == null ? Set.of() : Set.copyOf(playedJobs);
    }

    public static RunOptions defaults() {
        return new RunOptions(null, Set.of());
    }

    public RunOptions withPipelineId(PipelineId pipelineId) {
        return new RunOptions(pipelineId, playedJobs);
    }

    public RunOptions withPlayedJobs(String... names) {
        return new RunOptions(pipelineId, Arrays.stream(names).map(JobName::of).collect(Collectors.toSet()));
    }

    public boolean isPlayed(JobName name) {
        return playedJobs.contains(name);
    }
}
