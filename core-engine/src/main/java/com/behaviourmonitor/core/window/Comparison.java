package com.behaviourmonitor.core.window;

import java.util.Locale;

/**
 * Comparison operators usable in rules and trigger expressions.
 *
 * @since 1.0.0
 */
public enum Comparison {

    GREATER_THAN(">", "gt"),
    GREATER_OR_EQUAL(">=", "gte"),
    LESS_THAN("<", "lt"),
    LESS_OR_EQUAL("<=", "lte"),
    EQUAL("==", "eq"),
    NOT_EQUAL("!=", "ne");

    private final String symbol;
    private final String alias;

    Comparison(String symbol, String alias) {
        this.symbol = symbol;
        this.alias = alias;
    }

    public String symbol() {
        return symbol;
    }

    /**
     * @param actual   observed value
     * @param expected configured threshold
     * @return result of {@code actual <op> expected}
     */
    public boolean test(double actual, double expected) {
        return switch (this) {
            case GREATER_THAN -> actual > expected;
            case GREATER_OR_EQUAL -> actual >= expected;
            case LESS_THAN -> actual < expected;
            case LESS_OR_EQUAL -> actual <= expected;
            case EQUAL -> Double.compare(actual, expected) == 0;
            case NOT_EQUAL -> Double.compare(actual, expected) != 0;
        };
    }

    /**
     * Parse a symbol ({@code >=}) or word alias ({@code gte}).
     *
     * @param text operator text
     * @return matching comparison
     * @throws IllegalArgumentException if the text is not a known operator
     */
    public static Comparison parse(String text) {
        if (text != null) {
            String normalized = text.trim().toLowerCase(Locale.ROOT);
            for (Comparison c : values()) {
                if (c.symbol.equals(normalized) || c.alias.equals(normalized)) {
                    return c;
                }
            }
        }
        throw new IllegalArgumentException("Unknown operator: '" + text
                + "'. Supported: >, >=, <, <=, ==, != (or gt, gte, lt, lte, eq, ne)");
    }
}
