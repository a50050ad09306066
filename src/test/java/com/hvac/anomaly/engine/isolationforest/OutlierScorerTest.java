package com.hvac.anomaly.engine.isolationforest;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.exception.InsufficientDataException;
import com.hvac.anomaly.exception.ModelNotTrainedException;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Reading;
import com.hvac.anomaly.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.hvac.anomaly.testutil.TestDataFactory.baseReading;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class OutlierScorerTest {

    private DetectionConfig config;
    private OutlierScorer scorer;

    @BeforeEach
    void setUp() {
        config = TestDataFactory.defaultConfig();
        scorer = new OutlierScorer(new IsolationForestAlgorithm(config), config);
    }

    private static List<EnrichedReading> faultFree(int perZone) {
        List<Reading> readings = new ArrayList<>(TestDataFactory.noisyZone("Z1", perZone, 1L));
        readings.addAll(TestDataFactory.noisyZone("Z2", perZone, 2L));
        return TestDataFactory.enrich(readings);
    }

    @Test
    void train_flagsContaminationShareOfTrainingData() {
        List<EnrichedReading> training = faultFree(500);

        OutlierModel model = scorer.train(training);
        long flagged = scorer.score(model, training).stream().filter(ScoredReading::flagged).count();

        assertThat(model.getTrainingSamples()).isEqualTo(1000);
        assertThat(model.getContamination()).isEqualTo(0.02);
        // 2% of 1000, within one percentage point
        assertThat(flagged).isBetween(10L, 30L);
    }

    @Test
    void train_recordsModelMetadata() {
        OutlierModel model = scorer.train(faultFree(100));

        assertThat(model.getAlgorithm()).isEqualTo(IsolationForestAlgorithm.NAME);
        assertThat(model.getFeatureNames()).isEqualTo(FeatureExtractor.FEATURE_NAMES);
        assertThat(model.getImputationValues()).hasSize(FeatureExtractor.FEATURE_COUNT);
        assertThat(model.getMetadata())
                .containsEntry("algorithm", "isolation_forest")
                .containsEntry("featureCount", 11)
                .containsEntry("treeCount", 100)
                .containsEntry("trainingSamples", 200);
    }

    @Test
    void train_isDeterministicForFixedSeed() {
        List<EnrichedReading> training = faultFree(100);

        OutlierModel first = scorer.train(training);
        OutlierModel second = scorer.train(training);

        assertThat(second.getThreshold()).isEqualTo(first.getThreshold());
        List<ScoredReading> a = scorer.score(first, training);
        List<ScoredReading> b = scorer.score(second, training);
        for (int i = 0; i < a.size(); i++) {
            assertThat(b.get(i).score()).isEqualTo(a.get(i).score());
        }
    }

    @Test
    void train_usesOnlyFaultFreeRecords() {
        List<Reading> readings = TestDataFactory.series("Z1", 100, i -> baseReading("Z1", i)
                .faultType(i < 60 ? "clogged_filter" : Reading.NO_FAULT)
                .build());

        assertThatThrownBy(() -> scorer.train(TestDataFactory.enrich(readings)))
                .isInstanceOf(InsufficientDataException.class)
                .satisfies(e -> {
                    InsufficientDataException ide = (InsufficientDataException) e;
                    assertThat(ide.getAvailable()).isEqualTo(40);
                    assertThat(ide.getRequired()).isEqualTo(50);
                });
    }

    @Test
    void train_emptyInputIsInsufficient() {
        assertThatThrownBy(() -> scorer.train(List.of()))
                .isInstanceOf(InsufficientDataException.class);
    }

    @Test
    void score_withoutModelFails() {
        assertThatThrownBy(() -> scorer.score(null, faultFree(10)))
                .isInstanceOf(ModelNotTrainedException.class);
    }

    @Test
    void score_imputesMissingFeatures() {
        OutlierModel model = scorer.train(faultFree(100));
        List<EnrichedReading> sparse = TestDataFactory.enrich(List.of(Reading.builder()
                .timestamp(TestDataFactory.START)
                .zoneId("Z9")
                .build()));

        List<ScoredReading> scored = scorer.score(model, sparse);

        assertThat(scored).hasSize(1);
        assertThat(scored.get(0).score()).isBetween(0.0, 1.0);
    }

    @Test
    void detect_flagsObviousOutlier() {
        List<EnrichedReading> training = faultFree(200);
        OutlierModel model = scorer.train(training);

        List<Reading> extreme = List.of(baseReading("Z9", 0)
                .temperatureC(35.0)
                .powerKw(30.0)
                .fanSpeedPct(100.0)
                .build());
        List<AnomalyEvent> events = scorer.detect(model, TestDataFactory.enrich(extreme));

        assertThat(events).hasSize(1);
        AnomalyEvent event = events.get(0);
        assertThat(event.getRuleName()).isEqualTo(DetectorType.ISOLATION_FOREST);
        assertThat(event.getMetric()).isEqualTo("multiple");
        assertThat(event.getZoneId()).isEqualTo("Z9");
        assertThat(event.getFaultTypeLabel()).isNull();
        assertThat(event.getScore()).isGreaterThan(model.getThreshold());
    }

    @Test
    void threshold_leavesTopContaminationShareAbove() {
        double[] scores = new double[100];
        for (int i = 0; i < scores.length; i++) {
            scores[i] = i / 100.0;
        }

        double threshold = OutlierScorer.threshold(scores, 0.02);

        assertThat(threshold).isCloseTo(0.97, within(1e-9));
        assertThat(OutlierScorer.threshold(scores, 0.0)).isCloseTo(0.99, within(1e-9));
    }
}
