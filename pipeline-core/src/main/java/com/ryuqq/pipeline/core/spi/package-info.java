/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the storage interfaces that infrastructure adapters implement
 * for the artifact and cache broker.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.spi.ArtifactStore} - per-run artifacts keyed by (pipeline id, job)</li>
 *   <li>{@link com.ryuqq.pipeline.core.spi.CacheStore} - cross-run caches keyed by cache key</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., pipeline-adapter-inmemory) provide concrete implementations.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.spi;
