package com.hvac.anomaly.controller;

import com.hvac.anomaly.feature.FeatureEngine;
import com.hvac.anomaly.model.DetectionReport;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.service.DetectionPipelineService;
import com.hvac.anomaly.service.RunOptions;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1")
@Tag(name = "Detection", description = "Run anomaly detection over a batch of HVAC readings")
public class DetectionController {

    private final DetectionPipelineService pipelineService;
    private final FeatureEngine featureEngine;

    public DetectionController(DetectionPipelineService pipelineService, FeatureEngine featureEngine) {
        this.pipelineService = pipelineService;
        this.featureEngine = featureEngine;
    }

    @Operation(summary = "Run detection over a batch of readings",
            description = "Splits the readings by zone, computes features, evaluates the four rules and scores every " +
                    "reading with the outlier model. Returns all events plus per-zone outcomes and isolated failures; " +
                    "a failing zone does not fail the request.")
    @PostMapping("/detection/run")
    public ResponseEntity<?> run(
            @RequestBody List<Reading> readings,
            @Parameter(description = "Train a new outlier model on the batch's fault-free records", example = "true")
            @RequestParam(defaultValue = "true") boolean trainModel,
            @Parameter(description = "Store a freshly trained model for later score-only runs", example = "false")
            @RequestParam(defaultValue = "false") boolean persistModel) {
        if (readings == null || readings.isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "No readings supplied"));
        }

        DetectionReport report = pipelineService.run(readings, RunOptions.builder()
                .trainModel(trainModel)
                .persistModel(persistModel)
                .build());
        return ResponseEntity.ok(report);
    }

    @Operation(summary = "Compute features for a batch of readings",
            description = "Returns one enriched reading per input reading, in input order. Fails with 400 if any zone's " +
                    "readings are unsorted or contain duplicate timestamps.")
    @PostMapping("/features")
    public ResponseEntity<List<EnrichedReading>> features(@RequestBody List<Reading> readings) {
        return ResponseEntity.ok(featureEngine.enrich(readings));
    }
}
