package com.hvac.anomaly.engine;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Per-zone parameters handed to rule evaluators that can't be derived from a single
 * enriched reading (e.g., the zone's own elevated fan speed and power levels).
 */
@Value
@Builder
public class EvaluationContext {

    String zoneId;

    String ahuId;

    // Nominal sampling interval, credited to the first sample of an episode
    Duration samplingInterval;

    // Zone-specific elevated levels for the clogged filter rule
    double fanSpeedThreshold;
    double powerThreshold;
}
