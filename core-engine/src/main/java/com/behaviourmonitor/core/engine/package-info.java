/**
 * Rule engine, per-subject state and the in-process monitoring pipeline.
 *
 * <p>
 * {@link com.behaviourmonitor.core.engine.RuleEngine} is stateless
 * configuration over explicit
 * {@link com.behaviourmonitor.core.engine.SubjectState}s;
 * {@link com.behaviourmonitor.core.engine.MonitoringEngine} combines it with
 * intake and dispatch for in-process use.
 * </p>
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.engine;
