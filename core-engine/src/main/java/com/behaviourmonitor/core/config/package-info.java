/**
 * Configuration loading and validation for Behaviour Monitor.
 *
 * <p>
 * Rules and subjects are defined in YAML and loaded by
 * {@link com.behaviourmonitor.core.config.MonitoringConfigLoader} into a
 * {@link com.behaviourmonitor.core.config.MonitoringConfig}. Validation runs
 * automatically after parsing. Engine-wide defaults live in
 * {@link com.behaviourmonitor.core.config.EngineSettings}.
 * </p>
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.config;
