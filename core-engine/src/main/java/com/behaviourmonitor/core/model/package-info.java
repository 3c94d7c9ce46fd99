/**
 * Domain model classes for Behaviour Monitor.
 *
 * <p>
 * This package contains the data objects shared between the evaluation
 * engine and the Flink job layer:
 * </p>
 * <ul>
 * <li>{@link com.behaviourmonitor.core.model.RawEvent} - free-form JSON event
 * before intake</li>
 * <li>{@link com.behaviourmonitor.core.model.Event} - validated, immutable
 * behaviour event</li>
 * <li>{@link com.behaviourmonitor.core.model.Subject} - monitored entity</li>
 * <li>{@link com.behaviourmonitor.core.model.MonitoringRule} - rule
 * configuration POJO</li>
 * <li>{@link com.behaviourmonitor.core.model.Alert} - firing decision handed
 * to the dispatcher</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.model;
