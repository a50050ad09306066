package com.hvac.anomaly.engine.evaluators;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.engine.EvaluationContext;
import com.hvac.anomaly.engine.RuleEvaluator;
import com.hvac.anomaly.engine.state.DriftState;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Metric;
import com.hvac.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Optional;

import static com.hvac.anomaly.exception.MissingFeatureException.require;

/**
 * Detects zone temperature drifting away from setpoint.
 *
 * Logic: while |temp error| exceeds the threshold (3.0°C) the zone is DRIFTING and each
 * drifting sample adds the time since the previous drifting sample, capped at the sampling
 * interval. Once the accumulated duration exceeds the minimum (30 min) one event is raised
 * for the episode. Returning inside the band resets the episode.
 *
 * Score = (mean |error| / threshold) * (duration / minimum duration).
 * Example: 4.0°C held for 35 minutes scores 1.333 * 1.167 = 1.56 (MEDIUM).
 * The event fires on the first sample past the minimum, so the duration term only exceeds 1
 * by at most one sampling interval (35/30 at 5 minute sampling, 40/30 at 10 minute sampling).
 * Severity therefore follows magnitude first and sampling interval second.
 */
@Component
public class TempDriftEvaluator implements RuleEvaluator<DriftState> {

    static final double MEDIUM_AT = 1.25;
    static final double HIGH_AT = 1.75;

    private final DetectionConfig config;

    public TempDriftEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetector() {
        return DetectorType.TEMP_DRIFT;
    }

    @Override
    public DriftState newState(EvaluationContext context) {
        return new DriftState();
    }

    @Override
    public Optional<AnomalyEvent> evaluate(EnrichedReading reading, DriftState state, EvaluationContext context) {
        DetectionConfig.TempDrift rule = config.getRules().getTempDrift();
        double error = require(reading.getTempErrorC(), "temp_error_c");
        double magnitude = Math.abs(error);

        if (magnitude <= rule.getErrorThresholdC()) {
            state.reset();
            return Optional.empty();
        }

        // Only observed time counts: a gap or a skipped sample never adds more than one interval.
        Duration interval = context.getSamplingInterval();
        Duration credited = interval;
        if (state.isDrifting()) {
            Duration elapsed = Duration.between(state.getLastTimestamp(), reading.getTimestamp());
            if (elapsed.compareTo(interval) < 0) credited = elapsed;
        }
        state.accumulate(reading.getTimestamp(), credited, magnitude);

        if (state.isReported() || state.getDuration().compareTo(rule.getMinDuration()) <= 0) {
            return Optional.empty();
        }
        state.markReported();

        double magnitudeRatio = state.meanMagnitude() / rule.getErrorThresholdC();
        double durationRatio = (double) state.getDuration().toMillis() / rule.getMinDuration().toMillis();
        double score = magnitudeRatio * durationRatio;

        return Optional.of(buildEvent(reading, Metric.TEMPERATURE, score,
                Severity.fromScore(score, MEDIUM_AT, HIGH_AT)));
    }
}
