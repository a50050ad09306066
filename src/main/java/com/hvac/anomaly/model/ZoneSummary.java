package com.hvac.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Per-zone result of a detection run")
public class ZoneSummary {

    @Schema(description = "Zone identifier", example = "Z3")
    private String zoneId;

    @Schema(description = "Readings received for the zone", example = "288")
    private int readingCount;

    @Schema(description = "Whether the feature pass succeeded", example = "true")
    private boolean featuresComputed;

    @Schema(description = "One outcome per detector, in detector order")
    private List<DetectorOutcome> detectors;

    public int getEventCount() {
        return detectors == null ? 0 : detectors.stream().mapToInt(DetectorOutcome::getEventCount).sum();
    }

    public boolean isSucceeded() {
        return featuresComputed && detectors != null
                && detectors.stream().noneMatch(d -> d.getStatus() == OutcomeStatus.FAILED);
    }
}
