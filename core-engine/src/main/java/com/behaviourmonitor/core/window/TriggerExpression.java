package com.behaviourmonitor.core.window;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A parsed trigger condition over a sliding window.
 *
 * <p>
 * Grammar:
 * </p>
 *
 * <pre>
 *   aggregate [ "(" field ")" ] operator number
 *
 *   count &gt; 5
 *   avg(heartRate) &gt;= 120
 *   max(speed) != 0
 * </pre>
 *
 * <p>
 * {@code count} takes no field (an empty {@code count()} is accepted); every
 * other aggregate requires one.
 * </p>
 *
 * @since 1.0.0
 */
public final class TriggerExpression implements Serializable {

    private static final long serialVersionUID = 1L;

    private static final Pattern SYNTAX = Pattern.compile(
            "^\\s*([A-Za-z]+)\\s*(?:\\(\\s*([A-Za-z0-9_.\\-]*)\\s*\\))?\\s*(>=|<=|==|!=|>|<)\\s*([-+]?\\d+(?:\\.\\d+)?)\\s*$");

    private final Aggregate aggregate;
    private final String field;
    private final Comparison comparison;
    private final double threshold;
    private final String source;

    private TriggerExpression(Aggregate aggregate, String field, Comparison comparison,
            double threshold, String source) {
        this.aggregate = aggregate;
        this.field = field;
        this.comparison = comparison;
        this.threshold = threshold;
        this.source = source;
    }

    /**
     * Parse a trigger expression.
     *
     * @param expression expression text; must not be {@code null}
     * @return parsed expression
     * @throws NullPointerException     if {@code expression} is {@code null}
     * @throws IllegalArgumentException if the expression is malformed
     */
    public static TriggerExpression parse(String expression) {
        Objects.requireNonNull(expression, "Trigger expression must not be null");
        Matcher m = SYNTAX.matcher(expression);
        if (!m.matches()) {
            throw new IllegalArgumentException("Malformed trigger expression: '" + expression
                    + "'. Expected e.g. 'count > 5' or 'avg(field) >= 10'");
        }
        Aggregate aggregate;
        try {
            aggregate = Aggregate.parse(m.group(1));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Malformed trigger expression: '" + expression
                    + "': " + e.getMessage(), e);
        }
        String field = m.group(2) == null || m.group(2).isEmpty() ? null : m.group(2);
        if (aggregate.requiresField() && field == null) {
            throw new IllegalArgumentException("Trigger expression '" + expression
                    + "': aggregate " + aggregate.name().toLowerCase(Locale.ROOT) + " requires a field");
        }
        if (!aggregate.requiresField() && field != null) {
            throw new IllegalArgumentException("Trigger expression '" + expression
                    + "': count does not take a field");
        }
        return new TriggerExpression(aggregate, field, Comparison.parse(m.group(3)),
                Double.parseDouble(m.group(4)), expression.trim());
    }

    /**
     * @param window window to aggregate
     * @return {@code true} if the aggregate exists and satisfies the comparison
     */
    public boolean test(SlidingWindow window) {
        OptionalDouble value = aggregate.apply(window);
        return value.isPresent() && comparison.test(value.getAsDouble(), threshold);
    }

    public Aggregate getAggregate() {
        return aggregate;
    }

    /**
     * @return the aggregated field, or {@code null} for {@code count}
     */
    public String getField() {
        return field;
    }

    public Comparison getComparison() {
        return comparison;
    }

    public double getThreshold() {
        return threshold;
    }

    @Override
    public String toString() {
        return source;
    }
}
