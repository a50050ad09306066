package com.hvac.anomaly.engine;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.exception.MissingFeatureException;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectionFailure;
import com.hvac.anomaly.model.DetectorOutcome;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.FailureStage;
import com.hvac.anomaly.model.OutcomeStatus;
import io.micrometer.observation.annotation.Observed;
import io.micrometer.tracing.Span;
import io.micrometer.tracing.Tracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Core rule engine that runs every registered rule over one zone's enriched stream.
 * Uses the Strategy pattern: each DetectorType is handled by a registered RuleEvaluator.
 *
 * Failures are isolated: a missing field skips that sample for that rule only, and any
 * other error aborts only the failing rule for this zone.
 */
@Component
public class RuleEngine {

    private static final Logger log = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<DetectorType, RuleEvaluator<?>> evaluatorMap;
    private final Tracer tracer;
    private final DetectionConfig config;

    public RuleEngine(List<RuleEvaluator<?>> evaluators, Tracer tracer, DetectionConfig config) {
        this.evaluatorMap = new EnumMap<>(DetectorType.class);
        this.tracer = tracer;
        this.config = config;

        for (RuleEvaluator<?> evaluator : evaluators) {
            evaluatorMap.put(evaluator.getSupportedDetector(), evaluator);
            log.info("Registered rule evaluator: {} -> {}",
                    evaluator.getSupportedDetector(), evaluator.getClass().getSimpleName());
        }
    }

    public List<DetectorType> getRegisteredDetectors() {
        return new ArrayList<>(evaluatorMap.keySet());
    }

    /**
     * Evaluate all rules against one zone's readings, in timestamp order.
     *
     * @param zoneId   the zone
     * @param readings the zone's enriched readings, as produced by the feature engine
     * @return events, per-rule outcomes and isolated failures
     */
    @Observed(name = "rules.evaluate_zone", contextualName = "evaluate-zone-rules")
    public ZoneRuleResult evaluateZone(String zoneId, List<EnrichedReading> readings) {
        EvaluationContext context = buildContext(zoneId, readings);
        List<AnomalyEvent> events = new ArrayList<>();
        List<DetectorOutcome> outcomes = new ArrayList<>();
        List<DetectionFailure> failures = new ArrayList<>();

        for (RuleEvaluator<?> evaluator : evaluatorMap.values()) {
            DetectorType detector = evaluator.getSupportedDetector();
            Span ruleSpan = tracer.nextSpan()
                    .name("rule.evaluate." + detector.getRuleName())
                    .tag("zone.id", zoneId)
                    .tag("rule.name", detector.getRuleName())
                    .start();

            try (Tracer.SpanInScope ws = tracer.withSpan(ruleSpan)) {
                RuleRun run = runRule(evaluator, readings, context);
                events.addAll(run.events());
                outcomes.add(DetectorOutcome.builder()
                        .detector(detector)
                        .status(run.skipped() > 0 ? OutcomeStatus.DEGRADED : OutcomeStatus.OK)
                        .eventCount(run.events().size())
                        .skippedSamples(run.skipped())
                        .build());

                ruleSpan.tag("rule.events", String.valueOf(run.events().size()));
                if (run.skipped() > 0) {
                    log.warn("Rule {} skipped {} of {} samples for zone {} (missing fields)",
                            detector.getRuleName(), run.skipped(), readings.size(), zoneId);
                }
            } catch (Exception e) {
                ruleSpan.error(e);
                log.error("Error evaluating rule {} for zone {}: {}",
                        detector.getRuleName(), zoneId, e.getMessage(), e);
                // Don't let one bad rule block the other rules or zones
                outcomes.add(DetectorOutcome.failed(detector, e.getMessage()));
                failures.add(DetectionFailure.of(zoneId, detector, FailureStage.RULES, e));
            } finally {
                ruleSpan.end();
            }
        }

        log.debug("Zone {}: {} rule events from {} readings", zoneId, events.size(), readings.size());
        return new ZoneRuleResult(zoneId, events, outcomes, failures);
    }

    private <S> RuleRun runRule(RuleEvaluator<S> evaluator, List<EnrichedReading> readings,
                                EvaluationContext context) {
        S state = evaluator.newState(context);
        List<AnomalyEvent> events = new ArrayList<>();
        int skipped = 0;

        for (EnrichedReading reading : readings) {
            try {
                evaluator.evaluate(reading, state, context).ifPresent(events::add);
            } catch (MissingFeatureException e) {
                skipped++;
                log.debug("Rule {} skipped {} at {}: {}", evaluator.getSupportedDetector().getRuleName(),
                        reading.getZoneId(), reading.getTimestamp(), e.getMessage());
            }
        }
        return new RuleRun(events, skipped);
    }

    /**
     * Zone parameters. The clogged filter levels are the configured percentile of the
     * zone's own fan speed and power, never below the configured floors.
     */
    EvaluationContext buildContext(String zoneId, List<EnrichedReading> readings) {
        DetectionConfig.CloggedFilter clogged = config.getRules().getCloggedFilter();
        String ahuId = readings.stream()
                .map(EnrichedReading::getAhuId)
                .filter(Objects::nonNull)
                .findFirst()
                .orElse(null);

        double[] fan = readings.stream()
                .map(r -> r.getReading().getFanSpeedPct())
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();
        double[] power = readings.stream()
                .map(r -> r.getReading().getPowerKw())
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .toArray();

        return EvaluationContext.builder()
                .zoneId(zoneId)
                .ahuId(ahuId)
                .samplingInterval(config.getFeatures().getSamplingInterval())
                .fanSpeedThreshold(Math.max(clogged.getFanSpeedFloorPct(), percentile(fan, clogged.getPercentile())))
                .powerThreshold(Math.max(clogged.getPowerFloorKw(), percentile(power, clogged.getPercentile())))
                .build();
    }

    /**
     * Percentile with linear interpolation between closest ranks. Returns NEGATIVE_INFINITY
     * for an empty array so the configured floor applies.
     */
    static double percentile(double[] values, double pct) {
        if (values.length == 0) return Double.NEGATIVE_INFINITY;
        double[] sorted = Arrays.copyOf(values, values.length);
        Arrays.sort(sorted);
        double rank = (pct / 100.0) * (sorted.length - 1);
        int lower = (int) Math.floor(rank);
        int upper = (int) Math.ceil(rank);
        double fraction = rank - lower;
        return sorted[lower] + fraction * (sorted[upper] - sorted[lower]);
    }

    private record RuleRun(List<AnomalyEvent> events, int skipped) {
    }
}
