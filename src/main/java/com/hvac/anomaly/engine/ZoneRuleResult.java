package com.hvac.anomaly.engine;

import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectionFailure;
import com.hvac.anomaly.model.DetectorOutcome;

import java.util.List;

/**
 * Events, per-rule outcomes and isolated failures of evaluating every rule over one zone.
 */
public record ZoneRuleResult(String zoneId,
                             List<AnomalyEvent> events,
                             List<DetectorOutcome> outcomes,
                             List<DetectionFailure> failures) {
}
