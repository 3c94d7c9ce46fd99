package com.behaviourmonitor.core.model;

import java.util.Locale;

/**
 * Alert severity levels, lowest first.
 *
 * @since 1.0.0
 */
public enum Severity {

    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    /**
     * Parse a severity name case-insensitively.
     *
     * @param value severity name, e.g. {@code "high"}
     * @return the matching severity
     * @throws IllegalArgumentException if {@code value} is blank or unknown
     */
    public static Severity fromString(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high, critical", e);
        }
    }
}
