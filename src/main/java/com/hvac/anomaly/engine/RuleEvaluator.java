package com.hvac.anomaly.engine;

import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Metric;
import com.hvac.anomaly.model.Severity;

import java.util.Optional;

/**
 * Interface for all HVAC fault rules.
 * Each implementation is a small state machine fed one zone's enriched readings in timestamp order.
 *
 * @param <S> per-zone state, created fresh for every zone stream and never shared
 */
public interface RuleEvaluator<S> {

    /**
     * The detector this evaluator implements.
     */
    DetectorType getSupportedDetector();

    /**
     * Create the state for a zone stream that is about to be evaluated.
     */
    S newState(EvaluationContext context);

    /**
     * Advance the state machine by one reading.
     *
     * @param reading the next enriched reading of the zone
     * @param state   the zone's state for this rule
     * @param context zone parameters
     * @return an event when an episode is confirmed on this reading
     * @throws com.hvac.anomaly.exception.MissingFeatureException if a required field is absent;
     *         the caller skips the sample for this rule
     */
    Optional<AnomalyEvent> evaluate(EnrichedReading reading, S state, EvaluationContext context);

    default AnomalyEvent buildEvent(EnrichedReading reading, Metric metric, double score, Severity severity) {
        return AnomalyEvent.builder()
                .timestamp(reading.getTimestamp())
                .zoneId(reading.getZoneId())
                .ahuId(reading.getAhuId())
                .metric(metric.getColumn())
                .score(Math.round(score * 10_000.0) / 10_000.0)
                .ruleName(getSupportedDetector())
                .severity(severity)
                .faultTypeLabel(getSupportedDetector().getRuleName())
                .build();
    }
}
