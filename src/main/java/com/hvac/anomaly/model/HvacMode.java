package com.hvac.anomaly.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum HvacMode {
    COOLING,
    HEATING,
    OFF;

    @JsonValue
    public String getLabel() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Lenient parse used for JSON and CSV input. Returns null for blank input.
     */
    @JsonCreator
    public static HvacMode fromLabel(String label) {
        if (label == null || label.isBlank()) return null;
        return HvacMode.valueOf(label.trim().toUpperCase(Locale.ROOT));
    }
}
