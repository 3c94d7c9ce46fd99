package com.behaviourmonitor.core.window;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.OptionalDouble;

/**
 * Time-bounded window of {@code (timestamp, value)} samples.
 *
 * <h3>Eviction</h3>
 * <p>
 * Every {@link #add} and {@link #evict} call drops samples strictly older
 * than {@code reference - windowSeconds}. Samples are assumed to arrive in
 * roughly increasing time order; a sample that is already older than the
 * current window start is ignored.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * This class is stateful and <strong>not</strong> thread-safe. One instance
 * is held per subject and rule inside
 * {@link com.behaviourmonitor.core.engine.SubjectState}.
 * </p>
 *
 * @since 1.0.0
 */
public class SlidingWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long windowMillis;

    private final Deque<Sample> samples = new ArrayDeque<>();

    /** Latest timestamp seen, used as the eviction reference. */
    private long watermark = Long.MIN_VALUE;

    /**
     * @param windowSeconds window span in seconds; must be positive
     * @throws IllegalArgumentException if {@code windowSeconds} is not positive
     */
    public SlidingWindow(int windowSeconds) {
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be > 0, got: " + windowSeconds);
        }
        this.windowMillis = windowSeconds * 1_000L;
    }

    /**
     * Record a sample and evict everything that fell out of the window.
     *
     * @param timestamp sample time
     * @param value     sample value; use {@code 1} (or anything) for pure counts
     * @return {@code true} if the sample was retained
     */
    public boolean add(Instant timestamp, double value) {
        long ts = timestamp.toEpochMilli();
        watermark = Math.max(watermark, ts);
        evictBefore(watermark - windowMillis);

        if (ts < watermark - windowMillis) {
            return false;
        }
        if (samples.isEmpty() || samples.peekLast().timestamp <= ts) {
            samples.addLast(new Sample(ts, value));
        } else {
            insertOrdered(new Sample(ts, value));
        }
        return true;
    }

    /**
     * Evict samples that are outside the window ending at {@code now}.
     *
     * @param now reference time
     */
    public void evict(Instant now) {
        long ts = now.toEpochMilli();
        watermark = Math.max(watermark, ts);
        evictBefore(watermark - windowMillis);
    }

    public int count() {
        return samples.size();
    }

    public double sum() {
        double sum = 0;
        for (Sample s : samples) {
            sum += s.value;
        }
        return sum;
    }

    public OptionalDouble average() {
        return samples.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(sum() / samples.size());
    }

    public OptionalDouble min() {
        return samples.stream().mapToDouble(s -> s.value).min();
    }

    public OptionalDouble max() {
        return samples.stream().mapToDouble(s -> s.value).max();
    }

    public OptionalDouble last() {
        return samples.isEmpty() ? OptionalDouble.empty() : OptionalDouble.of(samples.peekLast().value);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public int getWindowSeconds() {
        return (int) (windowMillis / 1_000L);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private void evictBefore(long windowStart) {
        while (!samples.isEmpty() && samples.peekFirst().timestamp < windowStart) {
            samples.pollFirst();
        }
    }

    private void insertOrdered(Sample sample) {
        Deque<Sample> tail = new ArrayDeque<>();
        while (!samples.isEmpty() && samples.peekLast().timestamp > sample.timestamp) {
            tail.addFirst(samples.pollLast());
        }
        samples.addLast(sample);
        samples.addAll(tail);
    }

    private static final class Sample implements Serializable {

        private static final long serialVersionUID = 1L;

        private final long timestamp;
        private final double value;

        private Sample(long timestamp, double value) {
            this.timestamp = timestamp;
            this.value = value;
        }
    }
}
