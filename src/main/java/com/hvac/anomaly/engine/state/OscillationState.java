package com.hvac.anomaly.engine.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Timestamps of temperature error sign changes within the rolling window.
 * Zero is its own sign, so a pass through exactly zero counts as a change.
 */
public class OscillationState {

    private Integer lastSign;
    private final Deque<Instant> changes = new ArrayDeque<>();
    private boolean oscillating;

    /**
     * Record the sign of the current error and return the number of changes inside the window.
     */
    public int observe(Instant timestamp, double error, Duration window) {
        int sign = (int) Math.signum(error);
        if (lastSign != null && sign != lastSign) {
            changes.addLast(timestamp);
        }
        lastSign = sign;

        Instant cutoff = timestamp.minus(window);
        while (!changes.isEmpty() && !changes.peekFirst().isAfter(cutoff)) {
            changes.removeFirst();
        }
        return changes.size();
    }

    public boolean isOscillating() { return oscillating; }
    public void setOscillating(boolean oscillating) { this.oscillating = oscillating; }
}
