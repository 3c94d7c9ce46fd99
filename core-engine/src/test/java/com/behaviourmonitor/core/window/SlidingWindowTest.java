package com.behaviourmonitor.core.window;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlidingWindow}.
 */
class SlidingWindowTest {

    private static final Instant BASE = Instant.parse("2024-05-01T10:00:00Z");

    private SlidingWindow window;

    @BeforeEach
    void setUp() {
        window = new SlidingWindow(10);
    }

    @Test
    @DisplayName("Should compute aggregates over retained samples")
    void shouldComputeAggregates() {
        window.add(at(0), 1);
        window.add(at(5), 3);
        window.add(at(9), 2);

        assertThat(window.count()).isEqualTo(3);
        assertThat(window.sum()).isEqualTo(6.0);
        assertThat(window.average()).hasValue(2.0);
        assertThat(window.min()).hasValue(1.0);
        assertThat(window.max()).hasValue(3.0);
        assertThat(window.last()).hasValue(2.0);
    }

    @Test
    @DisplayName("Should evict samples older than the window start")
    void shouldEvictOldSamples() {
        window.add(at(0), 1);
        window.add(at(5), 1);
        window.add(at(11), 1);

        assertThat(window.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should keep a sample exactly at the window start")
    void shouldKeepSampleAtWindowBoundary() {
        window.add(at(0), 1);
        window.add(at(10), 1);

        assertThat(window.count()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should drop a late sample that is already outside the window")
    void shouldDropLateSampleOutsideWindow() {
        window.add(at(20), 1);

        assertThat(window.add(at(5), 1)).isFalse();
        assertThat(window.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should insert a late sample inside the window in time order")
    void shouldInsertLateSampleInOrder() {
        window.add(at(0), 1);
        window.add(at(5), 5);

        assertThat(window.add(at(3), 3)).isTrue();
        assertThat(window.count()).isEqualTo(3);
        assertThat(window.last()).hasValue(5.0);
    }

    @Test
    @DisplayName("Should evict on explicit time advance without new samples")
    void shouldEvictOnTimeAdvance() {
        window.add(at(0), 1);
        window.evict(at(30));

        assertThat(window.isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Empty window has zero count and sum but no average")
    void emptyWindowAggregates() {
        assertThat(window.count()).isZero();
        assertThat(window.sum()).isZero();
        assertThat(window.average()).isEmpty();
        assertThat(Aggregate.COUNT.apply(window)).hasValue(0.0);
        assertThat(Aggregate.MAX.apply(window)).isEmpty();
    }

    @Test
    @DisplayName("Should reject a non-positive window")
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new SlidingWindow(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("windowSeconds");
    }

    private static Instant at(int seconds) {
        return BASE.plusSeconds(seconds);
    }
}
