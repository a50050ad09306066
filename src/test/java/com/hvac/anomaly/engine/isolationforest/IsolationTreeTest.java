package com.hvac.anomaly.engine.isolationforest;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class IsolationTreeTest {

    private static double[][] clusterWithOutlier() {
        Random random = new Random(3);
        double[][] rows = new double[64][];
        for (int i = 0; i < rows.length - 1; i++) {
            rows[i] = new double[]{random.nextGaussian(), random.nextGaussian()};
        }
        rows[rows.length - 1] = new double[]{25.0, -25.0};
        return rows;
    }

    @Test
    void grow_everyTrainingRowReachesOneLeaf() {
        double[][] rows = clusterWithOutlier();

        IsolationTree tree = IsolationTree.grow(rows, 6, new Random(42));

        assertThat(tree.getRoot().isLeaf()).isFalse();
        assertThat(tree.getRoot().getSize()).isEqualTo(rows.length);
        assertThat(tree.getRoot().getBelow().getSize() + tree.getRoot().getAbove().getSize())
                .isEqualTo(rows.length);
    }

    @Test
    void grow_constantRowsStayOneLeaf() {
        double[][] rows = {{1.0, 2.0}, {1.0, 2.0}, {1.0, 2.0}};

        IsolationTree tree = IsolationTree.grow(rows, 4, new Random(42));

        assertThat(tree.getRoot().isLeaf()).isTrue();
        assertThat(tree.pathLength(new double[]{1.0, 2.0})).isCloseTo(IsolationTree.averagePathLength(3), within(1e-12));
    }

    @Test
    void pathLength_isolatedPointIsShallowerOnAverage() {
        double[][] rows = clusterWithOutlier();
        Random random = new Random(42);
        double outlierDepth = 0.0;
        double inlierDepth = 0.0;
        for (int t = 0; t < 50; t++) {
            IsolationTree tree = IsolationTree.grow(rows, 8, random);
            outlierDepth += tree.pathLength(new double[]{25.0, -25.0});
            inlierDepth += tree.pathLength(new double[]{0.0, 0.0});
        }

        assertThat(outlierDepth).isLessThan(inlierDepth);
    }

    @Test
    void averagePathLength_smallSamples() {
        assertThat(IsolationTree.averagePathLength(1)).isEqualTo(0.0);
        assertThat(IsolationTree.averagePathLength(2)).isEqualTo(1.0);
        assertThat(IsolationTree.averagePathLength(256)).isCloseTo(10.24, within(0.01));
    }

    @Test
    void node_leafSerialisesAsSizeOnly() throws Exception {
        ObjectMapper mapper = new ObjectMapper();

        assertThat(mapper.writeValueAsString(IsolationNode.leaf(3))).isEqualTo("{\"s\":3}");
    }

    @Test
    void node_splitRoundTripsThroughJson() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        IsolationTree tree = IsolationTree.grow(clusterWithOutlier(), 6, new Random(7));

        String json = mapper.writeValueAsString(tree);
        IsolationTree restored = mapper.readValue(json, IsolationTree.class);

        assertThat(mapper.writeValueAsString(restored)).isEqualTo(json);
        double[] point = {0.5, -0.5};
        assertThat(restored.pathLength(point)).isEqualTo(tree.pathLength(point));
    }

    @Test
    void node_splitWithoutChildrenIsRejected() {
        assertThatThrownBy(() -> new IsolationNode(0, 1.0, IsolationNode.leaf(1), null, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
