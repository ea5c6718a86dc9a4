/**
 * Rule engine: first-match evaluation of ordered (condition, action) pairs.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.pipeline.core.rule.Condition} - sealed condition AST</li>
 *   <li>{@link com.ryuqq.pipeline.core.rule.ConditionParser} - expression parser, fails at load time</li>
 *   <li>{@link com.ryuqq.pipeline.core.rule.RuleEvaluator} - first-match evaluator</li>
 *   <li>{@link com.ryuqq.pipeline.core.rule.JobInclusion} - evaluation result</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>
 * List&lt;Rule&gt; rules = List.of(
 *     Rule.of("$CI_PIPELINE_SOURCE == \"schedule\"", When.NEVER),
 *     Rule.unconditional(When.ON_SUCCESS));
 *
 * JobInclusion inclusion = RuleEvaluator.evaluate(rules, context);
 * </pre>
 *
 * @since 1.0.0
 * @author Orchestrator Team
 */
package com.ryuqq.pipeline.core.rule;
