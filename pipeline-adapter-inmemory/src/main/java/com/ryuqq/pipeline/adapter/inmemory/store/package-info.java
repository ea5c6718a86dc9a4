/**
 * In-memory storage adapters for the artifact and cache SPI.
 *
 * <p>Intended for tests, local runs and the CLI. Nothing is persisted across processes.</p>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.adapter.inmemory.store;
