/**
 * Pluggable rule evaluators.
 *
 * <p>
 * All evaluators implement
 * {@link com.behaviourmonitor.core.rules.RuleEvaluator} and are created by
 * {@link com.behaviourmonitor.core.rules.EvaluatorFactory}. Evaluators hold
 * per-subject state; the engine owns one set per subject.
 * </p>
 *
 * <h3>Extending</h3>
 * <p>
 * To add a new rule type, implement {@code RuleEvaluator} (usually by
 * extending {@code AbstractRuleEvaluator}), add validation to
 * {@code MonitoringRule.validate()} and register the type string in
 * {@code EvaluatorFactory.create()}.
 * </p>
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.rules;
