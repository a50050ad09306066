package com.hvac.anomaly.feature;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Time-span buffer of recent samples. A sample stays in the window while its timestamp
 * is strictly after {@code latest - span}, so a 15 minute span at 5 minute sampling
 * holds three samples. Absent values occupy a slot but are ignored by the statistics.
 */
public class RollingWindow {

    private final Duration span;
    private final Deque<Sample> samples = new ArrayDeque<>();

    public RollingWindow(Duration span) {
        if (span == null || span.isNegative() || span.isZero()) {
            throw new IllegalArgumentException("Window span must be positive: " + span);
        }
        this.span = span;
    }

    public void add(Instant timestamp, Double value) {
        samples.addLast(new Sample(timestamp, value));
        Instant cutoff = timestamp.minus(span);
        while (!samples.isEmpty() && !samples.peekFirst().timestamp().isAfter(cutoff)) {
            samples.removeFirst();
        }
    }

    /** Mean over the present values, or null if there are none. */
    public Double mean() {
        int count = 0;
        double sum = 0.0;
        for (Sample sample : samples) {
            if (sample.isPresent()) {
                sum += sample.value();
                count++;
            }
        }
        return count == 0 ? null : sum / count;
    }

    /** Sample standard deviation (n - 1), or null with fewer than two present values. */
    public Double std() {
        Double mean = mean();
        if (mean == null) return null;

        int count = 0;
        double sumSq = 0.0;
        for (Sample sample : samples) {
            if (sample.isPresent()) {
                double d = sample.value() - mean;
                sumSq += d * d;
                count++;
            }
        }
        if (count < 2) return null;
        return Math.sqrt(sumSq / (count - 1));
    }

    public int size() {
        return samples.size();
    }

    private record Sample(Instant timestamp, Double value) {
        boolean isPresent() {
            return value != null && !value.isNaN();
        }
    }
}
