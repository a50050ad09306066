package com.hvac.anomaly.model;

public enum FailureStage {
    FEATURES,
    RULES,
    TRAINING,
    SCORING,
    PERSISTENCE
}
