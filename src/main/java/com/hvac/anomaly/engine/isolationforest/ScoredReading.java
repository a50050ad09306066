package com.hvac.anomaly.engine.isolationforest;

import com.hvac.anomaly.model.EnrichedReading;

public record ScoredReading(EnrichedReading reading, double score, boolean flagged) {
}
