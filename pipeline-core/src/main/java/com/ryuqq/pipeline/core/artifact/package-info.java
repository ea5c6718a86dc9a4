/**
 * Artifact and cache broker.
 *
 * <p>{@link com.ryuqq.pipeline.core.artifact.ArtifactBroker} moves artifacts between jobs of one
 * pipeline run and caches between runs, backed by the storage SPI in
 * {@link com.ryuqq.pipeline.core.spi}. Expiry is enforced lazily on read.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.artifact;
