package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Immutable isolation tree node. A leaf only records how many training samples reached it;
 * a split sends points with {@code point[feature] < threshold} below and all others above.
 *
 * JSON keys are single letters to keep model artifacts small. A leaf serialises as {@code {"s":n}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class IsolationNode {

    private final Integer feature;
    private final Double threshold;
    private final IsolationNode below;
    private final IsolationNode above;
    private final int size;

    @JsonCreator
    IsolationNode(@JsonProperty("f") Integer feature,
                  @JsonProperty("v") Double threshold,
                  @JsonProperty("l") IsolationNode below,
                  @JsonProperty("r") IsolationNode above,
                  @JsonProperty("s") int size) {
        boolean split = feature != null;
        if (split && (threshold == null || below == null || above == null)) {
            throw new IllegalArgumentException("Split node on feature " + feature + " needs a threshold and two children");
        }
        this.feature = feature;
        this.threshold = split ? threshold : null;
        this.below = split ? below : null;
        this.above = split ? above : null;
        this.size = size;
    }

    public static IsolationNode leaf(int size) {
        return new IsolationNode(null, null, null, null, size);
    }

    public static IsolationNode split(int feature, double threshold, IsolationNode below, IsolationNode above) {
        return new IsolationNode(feature, threshold, below, above, below.size + above.size);
    }

    @JsonIgnore
    public boolean isLeaf() {
        return feature == null;
    }

    /** Child a point descends into. Only valid on a split node. */
    IsolationNode next(double[] point) {
        return point[feature] < threshold ? below : above;
    }

    @JsonProperty("f")
    public Integer getFeature() { return feature; }

    @JsonProperty("v")
    public Double getThreshold() { return threshold; }

    @JsonProperty("l")
    public IsolationNode getBelow() { return below; }

    @JsonProperty("r")
    public IsolationNode getAbove() { return above; }

    /** Training samples that reached this node. */
    @JsonProperty("s")
    public int getSize() { return size; }
}
