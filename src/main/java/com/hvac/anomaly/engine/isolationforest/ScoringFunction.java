package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * A fitted, read-only anomaly scoring function over a fixed-length feature vector.
 * Higher scores are more anomalous. Implementations must round-trip through JSON exactly.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "algorithm")
@JsonSubTypes({
        @JsonSubTypes.Type(value = IsolationForest.class, name = IsolationForestAlgorithm.NAME)
})
public interface ScoringFunction {

    double score(double[] point);
}
