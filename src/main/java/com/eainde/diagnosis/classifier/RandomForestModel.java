package com.eainde.diagnosis.classifier;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Random forest evaluated from the node arrays of exported sklearn trees.
 *
 * <p>Each tree is stored the way sklearn keeps {@code tree_} internally: parallel
 * arrays indexed by node id. A node is a leaf when {@code children_left} is -1.
 * Leaf {@code value} rows hold per-class sample counts (or fractions); they are
 * normalised per tree and averaged across trees, which is what
 * {@code RandomForestClassifier.predict_proba} does.</p>
 */
public final class RandomForestModel implements ProbabilisticModel {

    private static final int LEAF = -1;

    private final List<Tree> trees;
    private final int featureCount;
    private final int classCount;

    public RandomForestModel(Artifact artifact) {
        if (artifact.trees() == null || artifact.trees().isEmpty()) {
            throw new IllegalArgumentException("Random forest has no trees");
        }
        if (artifact.classCount() <= 0) {
            throw new IllegalArgumentException("Random forest declares no classes");
        }
        this.trees = artifact.trees().stream().map(Tree::checked).toList();
        this.featureCount = artifact.featureCount();
        this.classCount = artifact.classCount();
    }

    @Override
    public double[] predictProba(double[] features) {
        if (features.length != featureCount) {
            throw new IllegalArgumentException("Expected " + featureCount
                    + " features, got " + features.length);
        }
        double[] sum = new double[classCount];
        for (Tree tree : trees) {
            double[] leaf = tree.leafFor(features);
            double total = 0.0;
            for (int c = 0; c < classCount; c++) {
                total += leaf[c];
            }
            if (total <= 0.0) {
                continue;
            }
            for (int c = 0; c < classCount; c++) {
                sum[c] += leaf[c] / total;
            }
        }
        for (int c = 0; c < classCount; c++) {
            sum[c] /= trees.size();
        }
        return sum;
    }

    @Override
    public int featureCount() {
        return featureCount;
    }

    @Override
    public int classCount() {
        return classCount;
    }

    public int treeCount() {
        return trees.size();
    }

    // =========================================================================
    //  Serialised form
    // =========================================================================

    /**
     * Root of {@code disease_model_final.json}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Artifact(
            @JsonProperty("model_type") String modelType,
            @JsonProperty("n_features") int featureCount,
            @JsonProperty("n_classes")  int classCount,
            @JsonProperty("trees")      List<Tree> trees
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Tree(
            @JsonProperty("feature")        int[] feature,
            @JsonProperty("threshold")      double[] threshold,
            @JsonProperty("children_left")  int[] childrenLeft,
            @JsonProperty("children_right") int[] childrenRight,
            @JsonProperty("value")          double[][] value
    ) {

        Tree checked() {
            int nodes = childrenLeft == null ? 0 : childrenLeft.length;
            if (nodes == 0
                    || feature == null || feature.length != nodes
                    || threshold == null || threshold.length != nodes
                    || childrenRight == null || childrenRight.length != nodes
                    || value == null || value.length != nodes) {
                throw new IllegalArgumentException("Tree node arrays are missing or of unequal length");
            }
            return this;
        }

        double[] leafFor(double[] x) {
            int node = 0;
            // depth is bounded by node count; guards against a cyclic export
            for (int steps = 0; childrenLeft[node] != LEAF; steps++) {
                if (steps > childrenLeft.length) {
                    throw new IllegalStateException("Tree traversal did not reach a leaf");
                }
                node = x[feature[node]] <= threshold[node] ? childrenLeft[node] : childrenRight[node];
            }
            return value[node];
        }
    }
}
