package com.hvac.anomaly.engine.evaluators;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.engine.EvaluationContext;
import com.hvac.anomaly.engine.RuleEvaluator;
import com.hvac.anomaly.engine.state.OscillationState;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Metric;
import com.hvac.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.hvac.anomaly.exception.MissingFeatureException.require;

/**
 * Detects control hunting: the temperature error keeps flipping sign.
 *
 * Logic: counts sign changes of temp error inside a rolling window (1 hour). When the
 * count first exceeds {@code maxSignChanges} (6) an event is raised; the episode ends
 * once the count falls back to the limit.
 *
 * Score = sign changes in window / maxSignChanges.
 */
@Component
public class OscillatingControlEvaluator implements RuleEvaluator<OscillationState> {

    static final double MEDIUM_AT = 1.0;
    static final double HIGH_AT = 1.5;

    private final DetectionConfig config;

    public OscillatingControlEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetector() {
        return DetectorType.OSCILLATING_CONTROL;
    }

    @Override
    public OscillationState newState(EvaluationContext context) {
        return new OscillationState();
    }

    @Override
    public Optional<AnomalyEvent> evaluate(EnrichedReading reading, OscillationState state, EvaluationContext context) {
        DetectionConfig.Oscillation rule = config.getRules().getOscillation();
        double error = require(reading.getTempErrorC(), "temp_error_c");

        int changes = state.observe(reading.getTimestamp(), error, rule.getWindow());
        if (changes <= rule.getMaxSignChanges()) {
            state.setOscillating(false);
            return Optional.empty();
        }
        if (state.isOscillating()) {
            return Optional.empty();
        }
        state.setOscillating(true);

        double score = (double) changes / rule.getMaxSignChanges();
        return Optional.of(buildEvent(reading, Metric.TEMPERATURE, score,
                Severity.fromScore(score, MEDIUM_AT, HIGH_AT)));
    }
}
