package com.ryuqq.pipeline.core.spi;

import com.ryuqq.pipeline.core.artifact.ArtifactSet;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;

import java.util.Optional;

/**
 * Artifact storage SPI.
 *
 * <p>Artifacts are keyed by (pipeline id, job name). Each key is written by exactly one job of
 * one pipeline run, so implementations never see concurrent writers on the same key. A retry
 * of the same job replaces the previous attempt's artifacts.</p>
 *
 * <p><strong>Implementation Requirements:</strong> thread-safe for concurrent access to
 * different keys.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface ArtifactStore {

    /**
     * Stores an artifact set under its reference's (pipeline id, job name).
     *
     * @param artifactSet the artifact set
     * @throws IllegalArgumentException if artifactSet is null
     */
    void put(ArtifactSet artifactSet);

    /**
     * Looks up the artifact set of a job. Expiry is not checked here.
     *
     * @param pipelineId the pipeline run
     * @param job the producing job
     * @return the artifact set, or empty if none was published
     */
    Optional<ArtifactSet> get(PipelineId pipelineId, JobName job);

    /**
     * Removes the artifact set of a job, if present.
     *
     * @param pipelineId the pipeline run
     * @param job the producing job
     */
    void remove(PipelineId pipelineId, JobName job);
}
