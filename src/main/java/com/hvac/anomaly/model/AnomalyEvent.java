package com.hvac.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Comparator;

@Value
@Builder
@Jacksonized
@Schema(description = "An anomaly raised by a rule or by the outlier model")
public class AnomalyEvent {

    public static final Comparator<AnomalyEvent> CHRONOLOGICAL = Comparator
            .comparing(AnomalyEvent::getTimestamp)
            .thenComparing(AnomalyEvent::getZoneId)
            .thenComparing(e -> e.getRuleName().getRuleName())
            .thenComparing(AnomalyEvent::getMetric);

    @Schema(description = "Timestamp of the reading that raised the event", example = "2024-01-03T10:05:00Z")
    Instant timestamp;

    @Schema(description = "Zone identifier", example = "Z3")
    String zoneId;

    @Schema(description = "Air handling unit", example = "AHU1")
    String ahuId;

    @Schema(description = "Metric the detector looked at, or 'multiple' for the outlier model", example = "temp_zone_c")
    String metric;

    @Schema(description = "Detector score: ratio to threshold for rules, anomaly score for the outlier model", example = "1.5556")
    double score;

    @Schema(description = "Originating detector", example = "temp_drift")
    DetectorType ruleName;

    @Schema(description = "Severity", example = "medium")
    Severity severity;

    @Schema(description = "Fault type indicated by the detector; absent for the outlier model", example = "temp_drift")
    String faultTypeLabel;
}
