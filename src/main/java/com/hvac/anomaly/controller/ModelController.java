package com.hvac.anomaly.controller;

import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.service.OutlierModelService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/models")
@Tag(name = "Models", description = "Outlier model training and metadata")
public class ModelController {

    private final OutlierModelService modelService;

    public ModelController(OutlierModelService modelService) {
        this.modelService = modelService;
    }

    @Operation(summary = "Train the outlier model",
            description = "Fits an Isolation Forest on the fault-free readings of the batch across 11 feature dimensions " +
                    "and stores it as the current model for score-only runs.")
    @PostMapping("/train")
    public ResponseEntity<Map<String, Object>> train(@RequestBody List<Reading> readings) {
        return ResponseEntity.ok(modelService.trainAndStore(readings));
    }

    @Operation(summary = "Get current model metadata",
            description = "Returns algorithm, tree count, feature names, threshold, training samples and training timestamp.")
    @GetMapping("/current")
    public ResponseEntity<Map<String, Object>> current() {
        Map<String, Object> metadata = modelService.getCurrentModelMetadata();
        if (metadata == null) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.ok(metadata);
    }
}
