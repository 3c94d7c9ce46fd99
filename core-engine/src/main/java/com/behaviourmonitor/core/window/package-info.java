/**
 * Sliding-window aggregation and trigger expressions.
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.window;
