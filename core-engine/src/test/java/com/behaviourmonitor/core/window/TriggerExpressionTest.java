package com.behaviourmonitor.core.window;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TriggerExpression} and {@link Comparison}.
 */
class TriggerExpressionTest {

    @Test
    @DisplayName("Should parse an aggregate with a field")
    void shouldParseFieldAggregate() {
        TriggerExpression expr = TriggerExpression.parse("avg(heartRate) > 120");

        assertThat(expr.getAggregate()).isEqualTo(Aggregate.AVG);
        assertThat(expr.getField()).isEqualTo("heartRate");
        assertThat(expr.getComparison()).isEqualTo(Comparison.GREATER_THAN);
        assertThat(expr.getThreshold()).isEqualTo(120.0);
        assertThat(expr).hasToString("avg(heartRate) > 120");
    }

    @Test
    @DisplayName("Should parse count without a field and tolerate spacing")
    void shouldParseCount() {
        TriggerExpression expr = TriggerExpression.parse("  COUNT>=3 ");

        assertThat(expr.getAggregate()).isEqualTo(Aggregate.COUNT);
        assertThat(expr.getField()).isNull();
        assertThat(expr.getComparison()).isEqualTo(Comparison.GREATER_OR_EQUAL);
    }

    @Test
    @DisplayName("Should reject malformed expressions")
    void shouldRejectMalformed() {
        assertThatThrownBy(() -> TriggerExpression.parse("avg(x) >> 1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("avg(x) >> 1");
        assertThatThrownBy(() -> TriggerExpression.parse("median(x) > 1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown aggregate");
        assertThatThrownBy(() -> TriggerExpression.parse("sum > 1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a field");
        assertThatThrownBy(() -> TriggerExpression.parse("count(x) > 1"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("does not take a field");
    }

    @Test
    @DisplayName("Should test the aggregate against a window")
    void shouldTestWindow() {
        SlidingWindow window = new SlidingWindow(60);
        Instant now = Instant.parse("2024-05-01T10:00:00Z");
        window.add(now, 100);
        window.add(now.plusSeconds(1), 150);

        assertThat(TriggerExpression.parse("avg(hr) > 120").test(window)).isTrue();
        assertThat(TriggerExpression.parse("max(hr) < 150").test(window)).isFalse();
        assertThat(TriggerExpression.parse("count == 2").test(window)).isTrue();
    }

    @Test
    @DisplayName("Comparison should accept symbols and word aliases")
    void comparisonAliases() {
        assertThat(Comparison.parse("gte")).isEqualTo(Comparison.GREATER_OR_EQUAL);
        assertThat(Comparison.parse("NE")).isEqualTo(Comparison.NOT_EQUAL);
        assertThat(Comparison.parse("<=")).isEqualTo(Comparison.LESS_OR_EQUAL);
        assertThat(Comparison.EQUAL.test(2.0, 2.0)).isTrue();
        assertThatThrownBy(() -> Comparison.parse("~"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown operator");
    }
}
