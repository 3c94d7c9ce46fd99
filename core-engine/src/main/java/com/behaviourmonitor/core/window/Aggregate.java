package com.behaviourmonitor.core.window;

import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Aggregations that can be computed over a {@link SlidingWindow}.
 *
 * <p>
 * On an empty window {@code COUNT} and {@code SUM} are {@code 0}; all other
 * aggregates are absent.
 * </p>
 *
 * @since 1.0.0
 */
public enum Aggregate {

    COUNT,
    SUM,
    AVG,
    MIN,
    MAX,
    LAST;

    /**
     * @return {@code true} if the aggregate reads a field value
     */
    public boolean requiresField() {
        return this != COUNT;
    }

    public OptionalDouble apply(SlidingWindow window) {
        return switch (this) {
            case COUNT -> OptionalDouble.of(window.count());
            case SUM -> OptionalDouble.of(window.sum());
            case AVG -> window.average();
            case MIN -> window.min();
            case MAX -> window.max();
            case LAST -> window.last();
        };
    }

    public static Aggregate parse(String text) {
        try {
            return valueOf(text.trim().toUpperCase(Locale.ROOT));
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Unknown aggregate: '" + text
                    + "'. Supported: count, sum, avg, min, max, last", e);
        }
    }
}
