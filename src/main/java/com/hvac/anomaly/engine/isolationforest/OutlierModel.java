package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Fitted outlier model: scoring function plus everything scoring needs without the
 * training data (feature contract, imputation values, decision threshold).
 * Immutable after fit; shared read-only across zone workers.
 */
@Value
@Builder
@Jacksonized
public class OutlierModel {

    String algorithm;

    ScoringFunction scoringFunction;

    List<String> featureNames;

    // Training-set medians, indexed like featureNames
    double[] imputationValues;

    // Records scoring strictly above this are flagged
    double threshold;

    double contamination;

    int trainingSamples;

    long trainedAt;

    public double[] getImputationValues() {
        return imputationValues.clone();
    }

    @JsonIgnore
    public Map<String, Object> getMetadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("algorithm", algorithm);
        metadata.put("featureCount", featureNames.size());
        metadata.put("featureNames", featureNames);
        if (scoringFunction instanceof IsolationForest forest) {
            metadata.put("treeCount", forest.getTrees().size());
            metadata.put("sampleSize", forest.getSampleSize());
        }
        metadata.put("threshold", threshold);
        metadata.put("contamination", contamination);
        metadata.put("trainingSamples", trainingSamples);
        metadata.put("trainedAt", trainedAt);
        return metadata;
    }
}
