package com.hvac.anomaly.engine.state;

import java.time.Duration;
import java.time.Instant;

/**
 * Temperature drift state for one zone: NORMAL until the error leaves the band,
 * then DRIFTING while it stays out, accumulating duration and magnitude.
 */
public class DriftState {

    public enum Phase {
        NORMAL,
        DRIFTING
    }

    private Phase phase = Phase.NORMAL;
    private Duration duration = Duration.ZERO;
    private Instant lastTimestamp;
    private double magnitudeSum;
    private int samples;
    private boolean reported;

    public void accumulate(Instant timestamp, Duration credited, double magnitude) {
        phase = Phase.DRIFTING;
        duration = duration.plus(credited);
        lastTimestamp = timestamp;
        magnitudeSum += magnitude;
        samples++;
    }

    public void reset() {
        phase = Phase.NORMAL;
        duration = Duration.ZERO;
        lastTimestamp = null;
        magnitudeSum = 0.0;
        samples = 0;
        reported = false;
    }

    public void markReported() {
        reported = true;
    }

    public double meanMagnitude() {
        return samples == 0 ? 0.0 : magnitudeSum / samples;
    }

    public boolean isDrifting() {
        return phase == Phase.DRIFTING;
    }

    public Phase getPhase() { return phase; }
    public Duration getDuration() { return duration; }
    public Instant getLastTimestamp() { return lastTimestamp; }
    public boolean isReported() { return reported; }
}
