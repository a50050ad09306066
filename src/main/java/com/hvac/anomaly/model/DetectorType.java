package com.hvac.anomaly.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origin of an {@link AnomalyEvent}: one of the four deterministic rules or the outlier model.
 */
public enum DetectorType {
    TEMP_DRIFT("temp_drift", true),
    CLOGGED_FILTER("clogged_filter", true),
    COMPRESSOR_FAILURE("compressor_failure", true),
    OSCILLATING_CONTROL("oscillating_control", true),
    ISOLATION_FOREST("isolation_forest", false);

    private final String ruleName;
    private final boolean rule;

    DetectorType(String ruleName, boolean rule) {
        this.ruleName = ruleName;
        this.rule = rule;
    }

    @JsonValue
    public String getRuleName() {
        return ruleName;
    }

    public boolean isRule() {
        return rule;
    }
}
