package com.hvac.anomaly.engine.state;

/**
 * Run of consecutive samples on which fan speed and power were both above their zone thresholds.
 */
public class CoElevationState {

    private int consecutive;
    private double ratioSum;
    private boolean reported;

    public void extend(double ratio) {
        consecutive++;
        ratioSum += ratio;
    }

    public void reset() {
        consecutive = 0;
        ratioSum = 0.0;
        reported = false;
    }

    public void markReported() {
        reported = true;
    }

    public double meanRatio() {
        return consecutive == 0 ? 0.0 : ratioSum / consecutive;
    }

    public int getConsecutive() { return consecutive; }
    public boolean isReported() { return reported; }
}
