package com.hvac.anomaly.service;

import com.hvac.anomaly.config.MetricsConfig;
import com.hvac.anomaly.engine.RuleEngine;
import com.hvac.anomaly.engine.ZoneRuleResult;
import com.hvac.anomaly.engine.isolationforest.OutlierModel;
import com.hvac.anomaly.engine.isolationforest.OutlierScorer;
import com.hvac.anomaly.exception.InsufficientDataException;
import com.hvac.anomaly.feature.FeatureEngine;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectionFailure;
import com.hvac.anomaly.model.DetectionReport;
import com.hvac.anomaly.model.DetectorOutcome;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.FailureStage;
import com.hvac.anomaly.model.OutcomeStatus;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.model.ZoneSummary;
import com.hvac.anomaly.repository.OutlierModelRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Runs a closed batch of readings through the feature engine, the rules and the outlier model.
 *
 * Zones are processed in parallel. Training the outlier model is a single global step between
 * the rule pass and the scoring pass, since every zone scores against the same model.
 * Failures are isolated to the smallest unit possible and reported instead of thrown:
 * a failed zone never aborts the other zones, and a failed training step leaves the rule
 * results intact.
 */
@Service
public class DetectionPipelineService {

    private static final Logger log = LoggerFactory.getLogger(DetectionPipelineService.class);

    private final FeatureEngine featureEngine;
    private final RuleEngine ruleEngine;
    private final OutlierScorer outlierScorer;
    private final OutlierModelRepository modelRepository;
    private final MetricsConfig metricsConfig;
    private final ExecutorService executor;

    public DetectionPipelineService(FeatureEngine featureEngine,
                                    RuleEngine ruleEngine,
                                    OutlierScorer outlierScorer,
                                    OutlierModelRepository modelRepository,
                                    MetricsConfig metricsConfig,
                                    @Qualifier("detectionExecutor") ExecutorService executor) {
        this.featureEngine = featureEngine;
        this.ruleEngine = ruleEngine;
        this.outlierScorer = outlierScorer;
        this.modelRepository = modelRepository;
        this.metricsConfig = metricsConfig;
        this.executor = executor;
    }

    public DetectionReport run(List<Reading> readings) {
        return run(readings, RunOptions.defaults());
    }

    /**
     * Run detection over a batch of readings from any number of zones.
     *
     * @throws com.hvac.anomaly.exception.ValidationException if a reading has no zone id
     *         and so cannot be attributed to any zone
     */
    public DetectionReport run(List<Reading> readings, RunOptions options) {
        long start = System.currentTimeMillis();
        Map<String, List<Reading>> byZone = featureEngine.splitByZone(readings);
        log.info("=== Starting detection run: {} readings across {} zones ===", readings.size(), byZone.size());

        // Features and rules, zone-parallel
        Map<String, CompletableFuture<ZoneWork>> rulePass = new LinkedHashMap<>();
        for (Map.Entry<String, List<Reading>> entry : byZone.entrySet()) {
            rulePass.put(entry.getKey(), CompletableFuture.supplyAsync(
                    () -> processZone(entry.getKey(), entry.getValue()), executor));
        }
        List<ZoneWork> zones = new ArrayList<>(byZone.size());
        for (CompletableFuture<ZoneWork> future : rulePass.values()) {
            zones.add(future.join());
        }

        // Barrier: one shared model for every zone
        List<DetectionFailure> runFailures = new ArrayList<>();
        OutlierModel model = resolveModel(zones, options, runFailures);
        String noModelReason = runFailures.isEmpty() ? null : runFailures.get(0).getMessage();

        // Scoring, zone-parallel
        boolean scoring = model != null || !options.isTrainModel();
        List<CompletableFuture<Void>> scorePass = new ArrayList<>();
        for (ZoneWork zone : zones) {
            if (zone.enriched == null) {
                zone.outlierOutcome = DetectorOutcome.skipped(DetectorType.ISOLATION_FOREST, "Features not computed");
            } else if (!scoring) {
                zone.outlierOutcome = DetectorOutcome.skipped(DetectorType.ISOLATION_FOREST, noModelReason);
            } else {
                scorePass.add(CompletableFuture.runAsync(() -> scoreZone(zone, model), executor));
            }
        }
        scorePass.forEach(CompletableFuture::join);

        DetectionReport report = assemble(zones, runFailures, model);
        recordMetrics(report, zones.size(), System.currentTimeMillis() - start);

        log.info("=== Detection run complete: {} events, {} failures, {} zones in {} ms ===",
                report.getEvents().size(), report.getFailures().size(), zones.size(),
                System.currentTimeMillis() - start);
        return report;
    }

    private ZoneWork processZone(String zoneId, List<Reading> readings) {
        ZoneWork zone = new ZoneWork(zoneId, readings.size());
        try {
            zone.enriched = featureEngine.enrichZone(zoneId, readings);
        } catch (RuntimeException e) {
            log.warn("Feature pass failed for zone {}: {}", zoneId, e.getMessage());
            zone.failures.add(DetectionFailure.of(zoneId, null, FailureStage.FEATURES, e));
            return zone;
        }

        try {
            ZoneRuleResult result = ruleEngine.evaluateZone(zoneId, zone.enriched);
            zone.events.addAll(result.events());
            zone.ruleOutcomes.addAll(result.outcomes());
            zone.failures.addAll(result.failures());
        } catch (RuntimeException e) {
            log.error("Rule pass failed for zone {}", zoneId, e);
            zone.failures.add(DetectionFailure.of(zoneId, null, FailureStage.RULES, e));
            for (DetectorType detector : ruleEngine.getRegisteredDetectors()) {
                zone.ruleOutcomes.add(DetectorOutcome.failed(detector, e.getMessage()));
            }
        }
        return zone;
    }

    private OutlierModel resolveModel(List<ZoneWork> zones, RunOptions options, List<DetectionFailure> failures) {
        if (!options.isTrainModel()) {
            try {
                return modelRepository.load();
            } catch (UncheckedIOException e) {
                log.error("Could not load stored outlier model", e);
                failures.add(DetectionFailure.of(null, DetectorType.ISOLATION_FOREST, FailureStage.PERSISTENCE, e));
                return null;
            }
        }

        List<EnrichedReading> training = new ArrayList<>();
        for (ZoneWork zone : zones) {
            if (zone.enriched != null) training.addAll(zone.enriched);
        }

        OutlierModel model;
        try {
            model = outlierScorer.train(training);
            metricsConfig.recordModelTrained(model.getTrainingSamples());
        } catch (InsufficientDataException e) {
            log.warn("Outlier model not trained, rule results only: {}", e.getMessage());
            failures.add(DetectionFailure.of(null, DetectorType.ISOLATION_FOREST, FailureStage.TRAINING, e));
            return null;
        }

        if (options.isPersistModel()) {
            try {
                modelRepository.save(model);
            } catch (UncheckedIOException e) {
                log.error("Could not persist outlier model", e);
                failures.add(DetectionFailure.of(null, DetectorType.ISOLATION_FOREST, FailureStage.PERSISTENCE, e));
            }
        }
        return model;
    }

    private void scoreZone(ZoneWork zone, OutlierModel model) {
        try {
            List<AnomalyEvent> events = outlierScorer.detect(model, zone.enriched);
            zone.events.addAll(events);
            zone.outlierOutcome = DetectorOutcome.builder()
                    .detector(DetectorType.ISOLATION_FOREST)
                    .status(OutcomeStatus.OK)
                    .eventCount(events.size())
                    .build();
        } catch (RuntimeException e) {
            log.warn("Scoring failed for zone {}: {}", zone.zoneId, e.getMessage());
            zone.failures.add(DetectionFailure.of(zone.zoneId, DetectorType.ISOLATION_FOREST, FailureStage.SCORING, e));
            zone.outlierOutcome = DetectorOutcome.failed(DetectorType.ISOLATION_FOREST, e.getMessage());
        }
    }

    private DetectionReport assemble(List<ZoneWork> zones, List<DetectionFailure> runFailures, OutlierModel model) {
        List<AnomalyEvent> events = new ArrayList<>();
        List<ZoneSummary> summaries = new ArrayList<>(zones.size());
        List<DetectionFailure> failures = new ArrayList<>();

        for (ZoneWork zone : zones) {
            events.addAll(zone.events);
            failures.addAll(zone.failures);

            List<DetectorOutcome> outcomes = new ArrayList<>();
            if (zone.enriched == null) {
                for (DetectorType detector : ruleEngine.getRegisteredDetectors()) {
                    outcomes.add(DetectorOutcome.skipped(detector, "Features not computed"));
                }
            } else {
                outcomes.addAll(zone.ruleOutcomes);
            }
            outcomes.add(zone.outlierOutcome);

            summaries.add(ZoneSummary.builder()
                    .zoneId(zone.zoneId)
                    .readingCount(zone.readingCount)
                    .featuresComputed(zone.enriched != null)
                    .detectors(outcomes)
                    .build());
        }
        failures.addAll(runFailures);
        events.sort(AnomalyEvent.CHRONOLOGICAL);

        return DetectionReport.builder()
                .events(events)
                .zones(summaries)
                .failures(failures)
                .model(model == null ? null : model.getMetadata())
                .build();
    }

    private void recordMetrics(DetectionReport report, int zoneCount, long elapsedMillis) {
        report.countByDetector().forEach((detector, count) -> metricsConfig.recordEvents(detector, count.intValue()));
        for (DetectionFailure failure : report.getFailures()) {
            metricsConfig.recordFailure(failure.getStage());
        }
        metricsConfig.recordRun(zoneCount, elapsedMillis);
    }

    /** Mutable per-zone working set, only touched by one worker at a time. */
    private static final class ZoneWork {
        final String zoneId;
        final int readingCount;
        final List<AnomalyEvent> events = new ArrayList<>();
        final List<DetectorOutcome> ruleOutcomes = new ArrayList<>();
        final List<DetectionFailure> failures = new ArrayList<>();
        List<EnrichedReading> enriched;
        DetectorOutcome outlierOutcome;

        ZoneWork(String zoneId, int readingCount) {
            this.zoneId = zoneId;
            this.readingCount = readingCount;
        }
    }
}
