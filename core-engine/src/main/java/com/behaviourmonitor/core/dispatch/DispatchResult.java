package com.behaviourmonitor.core.dispatch;

import java.util.List;

/**
 * Outcome of {@link AlertDispatcher#dispatch}.
 *
 * @since 1.0.0
 */
public final class DispatchResult {

    private final String alertId;
    private final boolean duplicate;
    private final List<String> delivered;
    private final List<String> failed;

    DispatchResult(String alertId, boolean duplicate, List<String> delivered, List<String> failed) {
        this.alertId = alertId;
        this.duplicate = duplicate;
        this.delivered = List.copyOf(delivered);
        this.failed = List.copyOf(failed);
    }

    static DispatchResult duplicateOf(String alertId) {
        return new DispatchResult(alertId, true, List.of(), List.of());
    }

    public String getAlertId() {
        return alertId;
    }

    /**
     * @return {@code true} if the alert had already been dispatched and was dropped
     */
    public boolean isDuplicate() {
        return duplicate;
    }

    /** Channel names that accepted the alert. */
    public List<String> getDelivered() {
        return delivered;
    }

    /** Channel names that failed or are not registered. */
    public List<String> getFailed() {
        return failed;
    }

    @Override
    public String toString() {
        return "DispatchResult{" +
                "alertId='" + alertId + '\'' +
                ", duplicate=" + duplicate +
                ", delivered=" + delivered +
                ", failed=" + failed +
                '}';
    }
}
