package com.hvac.anomaly.engine.isolationforest;

import com.hvac.anomaly.config.DetectionConfig;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest (Liu, Ting, Zhou 2008): an ensemble of random partitioning trees,
 * each grown on a sub-sample of the training data. Seeded for reproducible fits.
 */
@Component
public class IsolationForestAlgorithm implements OutlierAlgorithm {

    public static final String NAME = "isolation_forest";

    private final DetectionConfig config;

    public IsolationForestAlgorithm(DetectionConfig config) {
        this.config = config;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Train the isolation forest on the given data, using the configured tree count
     * (typically 100), sub-sampling size (typically 256) and seed.
     */
    @Override
    public IsolationForest fit(double[][] data) {
        DetectionConfig.Outlier outlier = config.getOutlier();
        int sampleSize = Math.min(outlier.getSampleSize(), data.length);
        int maxDepth = (int) Math.ceil(Math.log(sampleSize) / Math.log(2));
        List<IsolationTree> trees = new ArrayList<>(outlier.getNumTrees());

        Random random = new Random(outlier.getSeed());

        for (int i = 0; i < outlier.getNumTrees(); i++) {
            double[][] sample = subsample(data, sampleSize, random);
            trees.add(IsolationTree.grow(sample, maxDepth, random));
        }
        return new IsolationForest(trees, sampleSize);
    }

    private double[][] subsample(double[][] data, int size, Random random) {
        if (data.length <= size) {
            return Arrays.copyOf(data, data.length);
        }
        double[][] sample = new double[size][];
        // Partial Fisher-Yates shuffle on indices
        int[] indices = new int[data.length];
        for (int i = 0; i < data.length; i++) indices[i] = i;
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(data.length - i);
            int tmp = indices[i];
            indices[i] = indices[j];
            indices[j] = tmp;
            sample[i] = data[indices[i]];
        }
        return sample;
    }
}
