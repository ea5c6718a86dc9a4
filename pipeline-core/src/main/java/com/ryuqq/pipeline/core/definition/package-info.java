/**
 * Pipeline definition model and template inheritance.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.definition.JobTemplate} - declared job, fields may be unset</li>
 *   <li>{@link com.ryuqq.pipeline.core.definition.TemplateMerger} - field-level override merge</li>
 *   <li>{@link com.ryuqq.pipeline.core.definition.TemplateResolver} - topological extends resolution</li>
 *   <li>{@link com.ryuqq.pipeline.core.definition.JobDefinition} - resolved job with defaults applied</li>
 *   <li>{@link com.ryuqq.pipeline.core.definition.PipelineDefinition} - stages, globals, templates</li>
 * </ul>
 *
 * <h2>Merge Rules</h2>
 * <pre>
 * scalars  : child replaces parent
 * mappings : merged key by key (variables, artifacts, cache, retry)
 * lists    : child replaces parent wholesale (rules, tags, script, needs, dependencies)
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.definition;
