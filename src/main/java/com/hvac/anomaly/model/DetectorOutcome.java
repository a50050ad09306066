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
@Schema(description = "How one detector fared on one zone")
public class DetectorOutcome {

    private DetectorType detector;

    private OutcomeStatus status;

    @Schema(description = "Events raised for the zone", example = "2")
    private int eventCount;

    @Schema(description = "Samples skipped because a required field was absent", example = "0")
    private int skippedSamples;

    @Schema(description = "Failure or skip reason")
    private String message;

    public static DetectorOutcome skipped(DetectorType detector, String message) {
        return DetectorOutcome.builder()
                .detector(detector)
                .status(OutcomeStatus.SKIPPED)
                .message(message)
                .build();
    }

    public static DetectorOutcome failed(DetectorType detector, String message) {
        return DetectorOutcome.builder()
                .detector(detector)
                .status(OutcomeStatus.FAILED)
                .message(message)
                .build();
    }
}
