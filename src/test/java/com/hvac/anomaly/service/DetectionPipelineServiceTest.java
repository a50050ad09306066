package com.hvac.anomaly.service;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.config.MetricsConfig;
import com.hvac.anomaly.engine.RuleEngine;
import com.hvac.anomaly.engine.evaluators.CloggedFilterEvaluator;
import com.hvac.anomaly.engine.evaluators.CompressorFailureEvaluator;
import com.hvac.anomaly.engine.evaluators.OscillatingControlEvaluator;
import com.hvac.anomaly.engine.evaluators.TempDriftEvaluator;
import com.hvac.anomaly.engine.isolationforest.IsolationForestAlgorithm;
import com.hvac.anomaly.engine.isolationforest.OutlierScorer;
import com.hvac.anomaly.exception.ValidationException;
import com.hvac.anomaly.feature.FeatureEngine;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectionFailure;
import com.hvac.anomaly.model.DetectionReport;
import com.hvac.anomaly.model.DetectorOutcome;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.FailureStage;
import com.hvac.anomaly.model.OutcomeStatus;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.model.Severity;
import com.hvac.anomaly.model.ZoneSummary;
import com.hvac.anomaly.repository.OutlierModelRepository;
import com.hvac.anomaly.testutil.TestDataFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.tracing.Tracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;

import static com.hvac.anomaly.testutil.TestDataFactory.COMPRESSOR_EPISODE_START;
import static com.hvac.anomaly.testutil.TestDataFactory.at;
import static com.hvac.anomaly.testutil.TestDataFactory.baseReading;
import static com.hvac.anomaly.testutil.TestDataFactory.readingWithError;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetectionPipelineServiceTest {

    @TempDir
    Path tempDir;

    private ExecutorService executor;
    private SimpleMeterRegistry meterRegistry;
    private OutlierModelRepository repository;
    private DetectionPipelineService pipeline;

    @BeforeEach
    void setUp() {
        DetectionConfig config = TestDataFactory.defaultConfig();
        config.getOutlier().setNumTrees(50);
        executor = Executors.newFixedThreadPool(3);
        meterRegistry = new SimpleMeterRegistry();
        repository = new OutlierModelRepository(tempDir.resolve("model.json"));

        RuleEngine ruleEngine = new RuleEngine(List.of(
                new TempDriftEvaluator(config),
                new CloggedFilterEvaluator(config),
                new CompressorFailureEvaluator(config),
                new OscillatingControlEvaluator(config)), Tracer.NOOP, config);
        pipeline = new DetectionPipelineService(
                new FeatureEngine(config),
                ruleEngine,
                new OutlierScorer(new IsolationForestAlgorithm(config), config),
                repository,
                new MetricsConfig(meterRegistry),
                executor);
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static List<AnomalyEvent> eventsOf(DetectionReport report, DetectorType detector) {
        return report.getEvents().stream()
                .filter(e -> e.getRuleName() == detector)
                .collect(Collectors.toList());
    }

    private static ZoneSummary zone(DetectionReport report, String zoneId) {
        return report.getZones().stream()
                .filter(z -> z.getZoneId().equals(zoneId))
                .findFirst()
                .orElseThrow();
    }

    private static DetectorOutcome outcome(ZoneSummary zone, DetectorType detector) {
        return zone.getDetectors().stream()
                .filter(o -> o.getDetector() == detector)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void run_detectsCompressorFailureInDayOfData() {
        DetectionReport report = pipeline.run(TestDataFactory.dayWithCompressorFailure("Z1", 11L));

        List<AnomalyEvent> compressor = eventsOf(report, DetectorType.COMPRESSOR_FAILURE);
        assertThat(compressor).hasSize(1);
        AnomalyEvent event = compressor.get(0);
        assertThat(event.getTimestamp()).isBetween(at(COMPRESSOR_EPISODE_START), at(COMPRESSOR_EPISODE_START + 2));
        assertThat(event.getZoneId()).isEqualTo("Z1");
        assertThat(event.getSeverity()).isEqualTo(Severity.HIGH);

        assertThat(eventsOf(report, DetectorType.TEMP_DRIFT)).isEmpty();
        assertThat(eventsOf(report, DetectorType.CLOGGED_FILTER)).isEmpty();
        assertThat(eventsOf(report, DetectorType.OSCILLATING_CONTROL)).isEmpty();

        assertThat(report.getFailures()).isEmpty();
        assertThat(report.getModel()).containsEntry("trainingSamples", 285);
        ZoneSummary summary = zone(report, "Z1");
        assertThat(summary.getReadingCount()).isEqualTo(288);
        assertThat(summary.isSucceeded()).isTrue();
        assertThat(summary.getDetectors()).hasSize(5);
    }

    @Test
    void run_eventsAreChronological() {
        List<Reading> readings = new ArrayList<>(TestDataFactory.dayWithCompressorFailure("Z2", 3L));
        readings.addAll(TestDataFactory.dayWithCompressorFailure("Z1", 4L));

        DetectionReport report = pipeline.run(readings);

        List<AnomalyEvent> sorted = new ArrayList<>(report.getEvents());
        sorted.sort(AnomalyEvent.CHRONOLOGICAL);
        assertThat(report.getEvents()).isEqualTo(sorted);
        assertThat(report.getZones()).extracting(ZoneSummary::getZoneId).containsExactly("Z1", "Z2");
    }

    @Test
    void run_isRepeatable() {
        List<Reading> readings = new ArrayList<>();
        for (String zoneId : List.of("Z1", "Z2", "Z3")) {
            readings.addAll(TestDataFactory.dayWithCompressorFailure(zoneId, zoneId.hashCode()));
        }

        DetectionReport first = pipeline.run(readings);
        DetectionReport second = pipeline.run(readings);

        assertThat(second.getEvents()).isEqualTo(first.getEvents());
        assertThat(eventsOf(first, DetectorType.COMPRESSOR_FAILURE)).hasSize(3);
    }

    @Test
    void run_invalidZoneDoesNotAbortOtherZones() {
        List<Reading> readings = new ArrayList<>(TestDataFactory.dayWithCompressorFailure("Z1", 5L));
        readings.add(readingWithError("Z2", 0, 0.5));
        readings.add(readingWithError("Z2", 0, 0.5));

        DetectionReport report = pipeline.run(readings);

        assertThat(eventsOf(report, DetectorType.COMPRESSOR_FAILURE)).hasSize(1);
        assertThat(report.getFailures()).hasSize(1);
        DetectionFailure failure = report.getFailures().get(0);
        assertThat(failure.getZoneId()).isEqualTo("Z2");
        assertThat(failure.getStage()).isEqualTo(FailureStage.FEATURES);
        assertThat(failure.getErrorType()).isEqualTo(ValidationException.class.getSimpleName());

        ZoneSummary broken = zone(report, "Z2");
        assertThat(broken.isFeaturesComputed()).isFalse();
        assertThat(broken.getDetectors()).allMatch(o -> o.getStatus() == OutcomeStatus.SKIPPED);
        assertThat(zone(report, "Z1").isSucceeded()).isTrue();
    }

    @Test
    void run_insufficientTrainingDataKeepsRuleResults() {
        List<Reading> readings = TestDataFactory.series("Z1", 40, i -> baseReading("Z1", i)
                .temperatureC(i >= 10 && i < 20 ? 26.5 : 22.5)
                .faultType(i >= 10 && i < 20 ? "temp_drift" : Reading.NO_FAULT)
                .build());

        DetectionReport report = pipeline.run(readings);

        assertThat(eventsOf(report, DetectorType.TEMP_DRIFT)).hasSize(1);
        assertThat(eventsOf(report, DetectorType.ISOLATION_FOREST)).isEmpty();
        assertThat(report.getModel()).isNull();
        assertThat(report.getFailures()).singleElement()
                .satisfies(f -> {
                    assertThat(f.getStage()).isEqualTo(FailureStage.TRAINING);
                    assertThat(f.getZoneId()).isNull();
                    assertThat(f.getErrorType()).isEqualTo("InsufficientDataException");
                });
        assertThat(outcome(zone(report, "Z1"), DetectorType.ISOLATION_FOREST).getStatus())
                .isEqualTo(OutcomeStatus.SKIPPED);
    }

    @Test
    void run_scoreOnlyWithoutStoredModelFailsScoringPerZone() {
        List<Reading> readings = new ArrayList<>(TestDataFactory.steadyZone("Z1", 20));
        readings.addAll(TestDataFactory.steadyZone("Z2", 20));

        DetectionReport report = pipeline.run(readings, RunOptions.builder().trainModel(false).build());

        assertThat(report.getFailures()).hasSize(2)
                .allMatch(f -> f.getStage() == FailureStage.SCORING)
                .allMatch(f -> "ModelNotTrainedException".equals(f.getErrorType()));
        assertThat(outcome(zone(report, "Z1"), DetectorType.TEMP_DRIFT).getStatus()).isEqualTo(OutcomeStatus.OK);
        assertThat(outcome(zone(report, "Z1"), DetectorType.ISOLATION_FOREST).getStatus())
                .isEqualTo(OutcomeStatus.FAILED);
    }

    @Test
    void run_scoreOnlyReusesPersistedModel() {
        List<Reading> readings = TestDataFactory.dayWithCompressorFailure("Z1", 21L);

        DetectionReport trained = pipeline.run(readings, RunOptions.builder().persistModel(true).build());
        repository.clearCache();
        DetectionReport scored = pipeline.run(readings, RunOptions.builder().trainModel(false).build());

        assertThat(repository.getModelPath()).exists();
        assertThat(scored.getFailures()).isEmpty();
        assertThat(eventsOf(scored, DetectorType.ISOLATION_FOREST))
                .isEqualTo(eventsOf(trained, DetectorType.ISOLATION_FOREST));
    }

    @Test
    void run_readingWithoutZoneIsRejected() {
        List<Reading> readings = List.of(baseReading(null, 0).build());

        assertThatThrownBy(() -> pipeline.run(readings)).isInstanceOf(ValidationException.class);
    }

    @Test
    void run_recordsMetrics() {
        pipeline.run(TestDataFactory.dayWithCompressorFailure("Z1", 8L));

        assertThat(meterRegistry.getMeters()).isNotEmpty();
    }
}
