package com.hvac.anomaly.exception;

/**
 * A rule needed an enriched field that is absent on the current sample.
 * The rule skips the sample; other rules and zones are unaffected.
 */
public class MissingFeatureException extends DetectionException {

    public MissingFeatureException(String field) {
        super("Missing required field: " + field);
    }

    /** Returns {@code value}, or throws if it is absent. */
    public static double require(Double value, String field) {
        if (value == null || value.isNaN()) {
            throw new MissingFeatureException(field);
        }
        return value;
    }
}
