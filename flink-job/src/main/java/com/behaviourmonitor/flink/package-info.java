/**
 * Apache Flink streaming job for the behaviour monitor.
 *
 * <p>
 * Wires the core engine into a pipeline that consumes behaviour events from
 * Kafka, evaluates rules per subject, dispatches alerts and publishes them
 * back to Kafka.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.behaviourmonitor.flink.BehaviourMonitorJob}: main entry point</li>
 * <li>{@link com.behaviourmonitor.flink.SubjectEvaluationFunction}: keyed rule evaluation</li>
 * <li>{@link com.behaviourmonitor.flink.AlertDispatchFunction}: alert dedup and routing</li>
 * <li>{@link com.behaviourmonitor.flink.JobConfig}: environment-driven configuration</li>
 * <li>{@link com.behaviourmonitor.flink.StatusServer}: HTTP health and status endpoints</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.flink;
