package com.hvac.anomaly.model;

public enum OutcomeStatus {
    /** Ran over every sample. */
    OK,
    /** Ran, but some samples were skipped because a required field was absent. */
    DEGRADED,
    /** Aborted for this zone. */
    FAILED,
    /** Not run, e.g. no model available or the zone's features failed. */
    SKIPPED
}
