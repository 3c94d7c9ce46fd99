package com.behaviourmonitor.core.dispatch;

/**
 * Thrown by an {@link AlertChannel} that could not deliver an alert.
 *
 * @since 1.0.0
 */
public class AlertDeliveryException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public AlertDeliveryException(String message) {
        super(message);
    }

    public AlertDeliveryException(String message, Throwable cause) {
        super(message, cause);
    }
}
