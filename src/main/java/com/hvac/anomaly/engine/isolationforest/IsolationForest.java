package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A fitted forest of isolation trees. Immutable once built.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class IsolationForest implements ScoringFunction {

    private final List<IsolationTree> trees;
    private final int sampleSize;

    @JsonCreator
    public IsolationForest(@JsonProperty("trees") List<IsolationTree> trees,
                           @JsonProperty("sampleSize") int sampleSize) {
        this.trees = List.copyOf(trees);
        this.sampleSize = sampleSize;
    }

    /**
     * Compute anomaly score for a single point.
     *
     * @return score between 0.0 (normal) and 1.0 (anomalous)
     *         Score > 0.5 indicates anomaly; score ≈ 0.5 is uncertain; score < 0.5 is normal
     */
    @Override
    public double score(double[] point) {
        if (trees.isEmpty()) return 0.0;

        double avgPathLength = 0.0;
        for (IsolationTree tree : trees) {
            avgPathLength += tree.pathLength(point);
        }
        avgPathLength /= trees.size();

        double c = IsolationTree.averagePathLength(sampleSize);
        if (c <= 0) return 0.0;

        // IF scoring formula: s(x, n) = 2^(-E(h(x)) / c(n))
        return Math.pow(2.0, -avgPathLength / c);
    }

    public List<IsolationTree> getTrees() { return trees; }
    public int getSampleSize() { return sampleSize; }
}
