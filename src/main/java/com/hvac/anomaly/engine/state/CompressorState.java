package com.hvac.anomaly.engine.state;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Compressor state for one zone.
 * NORMAL -> POWER_DROPPED on a sudden drop in cooling mode, -> FAILED once the zone
 * temperature rises while power stays low. Any power recovery or leaving cooling mode
 * returns to NORMAL.
 */
public class CompressorState {

    public enum Phase {
        NORMAL,
        POWER_DROPPED,
        FAILED
    }

    private Phase phase = Phase.NORMAL;
    private final Deque<PowerSample> recent = new ArrayDeque<>();
    private Double previousTemperature;
    private double referencePower;
    private double referenceTemperature;
    private Instant dropTimestamp;

    /** Highest power recorded strictly within {@code lookback} of {@code now}, or 0 if none. */
    public double peakPower(Instant now, Duration lookback) {
        Instant cutoff = now.minus(lookback);
        while (!recent.isEmpty() && !recent.peekFirst().timestamp().isAfter(cutoff)) {
            recent.removeFirst();
        }
        double peak = 0.0;
        for (PowerSample sample : recent) {
            peak = Math.max(peak, sample.power());
        }
        return peak;
    }

    public void enterDropped(Instant timestamp, double peakPower, double currentTemperature) {
        phase = Phase.POWER_DROPPED;
        dropTimestamp = timestamp;
        referencePower = peakPower;
        referenceTemperature = previousTemperature != null ? previousTemperature : currentTemperature;
    }

    public void enterFailed() {
        phase = Phase.FAILED;
    }

    public void toNormal() {
        phase = Phase.NORMAL;
        dropTimestamp = null;
    }

    /** Leaving cooling mode: forget the lookback so a mode switch never reads as a drop. */
    public void clear(double temperature) {
        toNormal();
        recent.clear();
        previousTemperature = temperature;
    }

    public void record(Instant timestamp, double power, double temperature) {
        recent.addLast(new PowerSample(timestamp, power));
        previousTemperature = temperature;
    }

    public Phase getPhase() { return phase; }
    public double getReferencePower() { return referencePower; }
    public double getReferenceTemperature() { return referenceTemperature; }
    public Instant getDropTimestamp() { return dropTimestamp; }

    private record PowerSample(Instant timestamp, double power) {
    }
}
