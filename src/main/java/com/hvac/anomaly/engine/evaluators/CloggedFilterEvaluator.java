package com.hvac.anomaly.engine.evaluators;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.engine.EvaluationContext;
import com.hvac.anomaly.engine.RuleEvaluator;
import com.hvac.anomaly.engine.state.CoElevationState;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Metric;
import com.hvac.anomaly.model.Severity;
import org.springframework.stereotype.Component;

import java.util.Optional;

import static com.hvac.anomaly.exception.MissingFeatureException.require;

/**
 * Detects a clogged filter: the fan works harder and draws more power at the same time.
 *
 * Logic: fan speed AND power must both be above the zone's elevated levels (see
 * {@link EvaluationContext}) on every sample of a run of {@code sustainedSamples}
 * consecutive readings. A single sample below either level ends the run.
 *
 * Score: mean over the run of min(fan / fan threshold, power / power threshold).
 */
@Component
public class CloggedFilterEvaluator implements RuleEvaluator<CoElevationState> {

    static final double MEDIUM_AT = 1.05;
    static final double HIGH_AT = 1.15;

    private final DetectionConfig config;

    public CloggedFilterEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetector() {
        return DetectorType.CLOGGED_FILTER;
    }

    @Override
    public CoElevationState newState(EvaluationContext context) {
        return new CoElevationState();
    }

    @Override
    public Optional<AnomalyEvent> evaluate(EnrichedReading reading, CoElevationState state, EvaluationContext context) {
        double fan = require(reading.getReading().getFanSpeedPct(), "fan_speed_pct");
        double power = require(reading.getReading().getPowerKw(), "power_kw");

        double fanThreshold = context.getFanSpeedThreshold();
        double powerThreshold = context.getPowerThreshold();
        if (fan <= fanThreshold || power <= powerThreshold) {
            state.reset();
            return Optional.empty();
        }

        double fanRatio = fanThreshold > 0 ? fan / fanThreshold : 1.0;
        double powerRatio = powerThreshold > 0 ? power / powerThreshold : fanRatio;
        state.extend(Math.min(fanRatio, powerRatio));

        int sustained = config.getRules().getCloggedFilter().getSustainedSamples();
        if (state.isReported() || state.getConsecutive() < sustained) {
            return Optional.empty();
        }
        state.markReported();

        double score = state.meanRatio();
        return Optional.of(buildEvent(reading, Metric.FAN_SPEED, score,
                Severity.fromScore(score, MEDIUM_AT, HIGH_AT)));
    }
}
