package com.hvac.anomaly.engine.isolationforest;

/**
 * Pluggable unsupervised outlier algorithm: {@code fit(features) -> model},
 * {@code score(model, features) -> scores}.
 */
public interface OutlierAlgorithm {

    /** Identifier recorded in the model artifact. */
    String getName();

    /**
     * Fit a scoring function. Must be deterministic for identical input.
     *
     * @param features training rows, all of the same length, no missing values
     */
    ScoringFunction fit(double[][] features);

    default double[] score(ScoringFunction model, double[][] features) {
        double[] scores = new double[features.length];
        for (int i = 0; i < features.length; i++) {
            scores[i] = model.score(features[i]);
        }
        return scores;
    }
}
