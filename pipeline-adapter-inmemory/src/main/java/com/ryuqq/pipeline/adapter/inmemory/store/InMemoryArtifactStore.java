package com.ryuqq.pipeline.adapter.inmemory.store;

import com.ryuqq.pipeline.core.artifact.ArtifactSet;
import com.ryuqq.pipeline.core.model.JobName;
import com.ryuqq.pipeline.core.model.PipelineId;
import com.ryuqq.pipeline.core.spi.ArtifactStore;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link ArtifactStore}.
 *
 * <p><strong>Thread Safety:</strong> backed by a {@link ConcurrentHashMap}. Each key is written
 * by a single job of a single pipeline run, so plain put/get is sufficient.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ArtifactStore store = new InMemoryArtifactStore();
 * ArtifactBroker broker = new ArtifactBroker(store, new InMemoryCacheStore());
 * </pre>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<Key, ArtifactSet> store = new ConcurrentHashMap<>();

    @Override
    public void put(ArtifactSet artifactSet) {
        if (artifactSet == null) {
            throw new IllegalArgumentException("artifactSet cannot be null");
        }
        store.put(new Key(artifactSet.reference().pipelineId(), artifactSet.reference().job()), artifactSet);
    }

    @Override
    public Optional<ArtifactSet> get(PipelineId pipelineId, JobName job) {
        if (pipelineId == null || job == null) {
            throw new IllegalArgumentException("pipelineId and job cannot be null");
        }
        return Optional.ofNullable(store.get(new Key(pipelineId, job)));
    }

    @Override
    public void remove(PipelineId pipelineId, JobName job) {
        if (pipelineId == null || job == null) {
            throw new IllegalArgumentException("pipelineId and job cannot be null");
        }
        store.remove(new Key(pipelineId, job));
    }

    /**
     * Returns the number of stored artifact sets (for testing).
     */
    public int size() {
        return store.size();
    }

    /**
     * Clears all stored artifacts (for testing).
     */
    public void clear() {
        store.clear();
    }

    private record Key(PipelineId pipelineId, JobName job) {
    }
}
