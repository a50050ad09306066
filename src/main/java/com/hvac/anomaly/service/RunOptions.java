package com.hvac.anomaly.service;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RunOptions {

    // Fit a new outlier model on this batch; otherwise score with the stored model
    @Builder.Default
    boolean trainModel = true;

    // Save a freshly trained model for later score-only runs
    @Builder.Default
    boolean persistModel = false;

    public static RunOptions defaults() {
        return RunOptions.builder().build();
    }
}
