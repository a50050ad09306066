package com.hvac.anomaly.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "A failure isolated to one zone, one detector, or the training step")
public class DetectionFailure {

    @Schema(description = "Zone the failure is scoped to; absent for run-wide failures", example = "Z3")
    private String zoneId;

    @Schema(description = "Detector the failure is scoped to; absent when the whole zone failed", example = "temp_drift")
    private DetectorType detector;

    @Schema(description = "Pipeline stage", example = "FEATURES")
    private FailureStage stage;

    @Schema(description = "Exception type", example = "ValidationException")
    private String errorType;

    @Schema(description = "Failure message", example = "Readings for zone Z3 are not strictly increasing at index 12")
    private String message;

    public static DetectionFailure of(String zoneId, DetectorType detector, FailureStage stage, Exception e) {
        return DetectionFailure.builder()
                .zoneId(zoneId)
                .detector(detector)
                .stage(stage)
                .errorType(e.getClass().getSimpleName())
                .message(e.getMessage())
                .build();
    }
}
