package com.hvac.anomaly.engine.evaluators;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.engine.EvaluationContext;
import com.hvac.anomaly.engine.RuleEvaluator;
import com.hvac.anomaly.engine.state.CompressorState;
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
 * Detects compressor failure in cooling mode.
 *
 * Logic: power falls by at least {@code powerDropFraction} below the highest power seen
 * within the lookback, and within that same lookback the zone temperature climbs at least
 * {@code minTempRiseC} above its pre-drop value while power stays low. A drop without a
 * temperature rise (normal power-down) or outside cooling mode never fires.
 *
 * Score = observed drop fraction / configured drop fraction.
 * Example: an 80% drop against a 50% threshold scores 1.6 (HIGH).
 */
@Component
public class CompressorFailureEvaluator implements RuleEvaluator<CompressorState> {

    static final double MEDIUM_AT = 1.0;
    static final double HIGH_AT = 1.5;

    private final DetectionConfig config;

    public CompressorFailureEvaluator(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public DetectorType getSupportedDetector() {
        return DetectorType.COMPRESSOR_FAILURE;
    }

    @Override
    public CompressorState newState(EvaluationContext context) {
        return new CompressorState();
    }

    @Override
    public Optional<AnomalyEvent> evaluate(EnrichedReading reading, CompressorState state, EvaluationContext context) {
        DetectionConfig.CompressorFailure rule = config.getRules().getCompressorFailure();
        double power = require(reading.getReading().getPowerKw(), "power_kw");
        double temperature = require(reading.getReading().getTemperatureC(), "temp_zone_c");

        if (!reading.getReading().isCooling()) {
            state.clear(temperature);
            return Optional.empty();
        }

        Duration lookback = rule.getLookback();
        double keep = 1.0 - rule.getPowerDropFraction();
        Optional<AnomalyEvent> event = Optional.empty();

        switch (state.getPhase()) {
            case NORMAL -> {
                double peak = state.peakPower(reading.getTimestamp(), lookback);
                if (peak > 0 && power <= peak * keep) {
                    state.enterDropped(reading.getTimestamp(), peak, temperature);
                }
            }
            case POWER_DROPPED -> {
                boolean expired = Duration.between(state.getDropTimestamp(), reading.getTimestamp())
                        .compareTo(lookback) > 0;
                if (power > state.getReferencePower() * keep || expired) {
                    state.toNormal();
                }
            }
            case FAILED -> {
                if (power > state.getReferencePower() * keep) {
                    state.toNormal();
                }
            }
        }

        if (state.getPhase() == CompressorState.Phase.POWER_DROPPED
                && temperature - state.getReferenceTemperature() >= rule.getMinTempRiseC()) {
            state.enterFailed();
            double drop = 1.0 - power / state.getReferencePower();
            double score = drop / rule.getPowerDropFraction();
            event = Optional.of(buildEvent(reading, Metric.POWER, score,
                    Severity.fromScore(score, MEDIUM_AT, HIGH_AT)));
        }

        state.record(reading.getTimestamp(), power, temperature);
        return event;
    }
}
