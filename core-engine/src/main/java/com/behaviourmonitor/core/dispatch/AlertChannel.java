package com.behaviourmonitor.core.dispatch;

import com.behaviourmonitor.core.model.Alert;

/**
 * A notification target for alerts: e-mail, chat, pager, a message topic.
 *
 * <p>
 * Channels are external collaborators; the engine only ships a
 * {@link LoggingAlertChannel}. Implementations must be thread-safe.
 * </p>
 */
public interface AlertChannel {

    /**
     * @return the name rules and subjects use to address this channel
     */
    String name();

    /**
     * Deliver one alert.
     *
     * @param alert the alert to deliver
     * @throws AlertDeliveryException if delivery fails
     */
    void deliver(Alert alert);
}
