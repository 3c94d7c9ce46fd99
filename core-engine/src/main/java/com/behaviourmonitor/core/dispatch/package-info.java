/**
 * Alert deduplication and routing to notification channels.
 *
 * @since 1.0.0
 */
package com.behaviourmonitor.core.dispatch;
