package com.hvac.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Partial-result report of a detection run: events, per-zone outcomes and isolated failures")
public class DetectionReport {

    @Schema(description = "Union of rule and outlier events, ordered by timestamp, zone and detector")
    private List<AnomalyEvent> events;

    @Schema(description = "Per-zone outcomes, ordered by zone id")
    private List<ZoneSummary> zones;

    @Schema(description = "Failures recorded during the run")
    private List<DetectionFailure> failures;

    @Schema(description = "Metadata of the outlier model used for scoring, absent when no model was available")
    private Map<String, Object> model;

    public Map<DetectorType, Long> countByDetector() {
        Map<DetectorType, Long> counts = new EnumMap<>(DetectorType.class);
        for (AnomalyEvent event : events) {
            counts.merge(event.getRuleName(), 1L, Long::sum);
        }
        return counts;
    }
}
