package com.hvac.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Maps a detector score onto fixed cut points.
     *
     * @param score    ratio of the measurement to its threshold, or an outlier score
     * @param mediumAt lowest score rated MEDIUM
     * @param highAt   lowest score rated HIGH
     */
    public static Severity fromScore(double score, double mediumAt, double highAt) {
        if (score >= highAt) return HIGH;
        if (score >= mediumAt) return MEDIUM;
        return LOW;
    }
}
