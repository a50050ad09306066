package com.hvac.anomaly.engine.isolationforest;

import com.hvac.anomaly.config.DetectionConfig;
import com.hvac.anomaly.exception.InsufficientDataException;
import com.hvac.anomaly.exception.ModelNotTrainedException;
import com.hvac.anomaly.model.AnomalyEvent;
import com.hvac.anomaly.model.DetectorType;
import com.hvac.anomaly.model.EnrichedReading;
import com.hvac.anomaly.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Trains the outlier model on fault-free records and scores enriched readings against it.
 *
 * The decision threshold is fixed at training time from the training score distribution:
 * with contamination c over n training records, the top floor(c * n) training scores lie
 * above it. Scoring batches of any size use that same threshold.
 *
 * The model is always passed in explicitly; this component holds no fitted state.
 */
@Component
public class OutlierScorer {

    private static final Logger log = LoggerFactory.getLogger(OutlierScorer.class);

    static final String METRIC = "multiple";

    private final OutlierAlgorithm algorithm;
    private final DetectionConfig config;

    public OutlierScorer(OutlierAlgorithm algorithm, DetectionConfig config) {
        this.algorithm = algorithm;
        this.config = config;
    }

    /**
     * Fit a model on the records labelled fault-free.
     *
     * @throws InsufficientDataException if fewer than the configured minimum of fault-free records exist
     */
    public OutlierModel train(List<EnrichedReading> readings) {
        DetectionConfig.Outlier outlier = config.getOutlier();
        List<Double[]> rows = new ArrayList<>();
        for (EnrichedReading reading : readings) {
            if (reading.getReading().isFaultFree(outlier.getFaultFreeLabel())) {
                rows.add(FeatureExtractor.extract(reading));
            }
        }
        if (rows.size() < outlier.getMinTrainingRecords()) {
            throw new InsufficientDataException(rows.size(), outlier.getMinTrainingRecords());
        }

        log.info("Training {} on {} fault-free records of {}", algorithm.getName(), rows.size(), readings.size());

        double[] imputation = FeatureExtractor.medians(rows);
        double[][] data = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            data[i] = FeatureExtractor.impute(rows.get(i), imputation);
        }

        ScoringFunction scoringFunction = algorithm.fit(data);
        double[] trainingScores = algorithm.score(scoringFunction, data);
        double threshold = threshold(trainingScores, outlier.getContamination());

        OutlierModel model = OutlierModel.builder()
                .algorithm(algorithm.getName())
                .scoringFunction(scoringFunction)
                .featureNames(FeatureExtractor.FEATURE_NAMES)
                .imputationValues(imputation)
                .threshold(threshold)
                .contamination(outlier.getContamination())
                .trainingSamples(data.length)
                .trainedAt(System.currentTimeMillis())
                .build();

        log.info("Trained {}: {} samples, {} features, threshold={}",
                algorithm.getName(), data.length, FeatureExtractor.FEATURE_COUNT, String.format("%.4f", threshold));
        return model;
    }

    /**
     * Score every reading.
     *
     * @throws ModelNotTrainedException if {@code model} is null
     * @throws IllegalStateException    if the model was trained on a different feature set
     */
    public List<ScoredReading> score(OutlierModel model, List<EnrichedReading> readings) {
        if (model == null || model.getScoringFunction() == null) {
            throw new ModelNotTrainedException();
        }
        if (!FeatureExtractor.FEATURE_NAMES.equals(model.getFeatureNames())) {
            throw new IllegalStateException("Model features " + model.getFeatureNames()
                    + " do not match " + FeatureExtractor.FEATURE_NAMES);
        }

        double[] imputation = model.getImputationValues();
        List<ScoredReading> scored = new ArrayList<>(readings.size());
        for (EnrichedReading reading : readings) {
            double[] features = FeatureExtractor.impute(FeatureExtractor.extract(reading), imputation);
            double score = model.getScoringFunction().score(features);
            scored.add(new ScoredReading(reading, score, score > model.getThreshold()));
        }
        return scored;
    }

    /**
     * Score the readings and turn flagged ones into events.
     */
    public List<AnomalyEvent> detect(OutlierModel model, List<EnrichedReading> readings) {
        DetectionConfig.Outlier outlier = config.getOutlier();
        List<AnomalyEvent> events = new ArrayList<>();
        for (ScoredReading scored : score(model, readings)) {
            if (!scored.flagged()) continue;

            EnrichedReading reading = scored.reading();
            events.add(AnomalyEvent.builder()
                    .timestamp(reading.getTimestamp())
                    .zoneId(reading.getZoneId())
                    .ahuId(reading.getAhuId())
                    .metric(METRIC)
                    .score(Math.round(scored.score() * 10_000.0) / 10_000.0)
                    .ruleName(DetectorType.ISOLATION_FOREST)
                    .severity(Severity.fromScore(scored.score(),
                            outlier.getMediumSeverityScore(), outlier.getHighSeverityScore()))
                    .build());
        }
        return events;
    }

    /**
     * Score above which the top floor(c * n) of the training scores lie.
     * With no records to flag, the maximum training score.
     */
    static double threshold(double[] trainingScores, double contamination) {
        double[] sorted = Arrays.copyOf(trainingScores, trainingScores.length);
        Arrays.sort(sorted);
        int flagged = (int) Math.floor(contamination * sorted.length);
        if (flagged <= 0) return sorted[sorted.length - 1];
        return sorted[sorted.length - flagged - 1];
    }
}
