package com.eainde.diagnosis.model;

import java.io.Serializable;
import java.util.Arrays;
import java.util.List;

/**
 * Numeric classifier input aligned 1:1 with the loaded feature schema.
 *
 * @param featureNames schema names, in model order
 * @param values       one value per schema name
 */
public record FeatureVector(List<String> featureNames, double[] values) implements Serializable {

    public FeatureVector {
        featureNames = List.copyOf(featureNames);
        values = values.clone();
        if (featureNames.size() != values.length) {
            throw new IllegalArgumentException("Feature vector has " + values.length
                    + " values for " + featureNames.size() + " schema names");
        }
    }

    public int size() {
        return values.length;
    }

    @Override
    public double[] values() {
        return values.clone();
    }

    /**
     * Value of a named feature, or 0.0 when the schema does not contain it.
     */
    public double valueOf(String featureName) {
        int idx = featureNames.indexOf(featureName);
        return idx < 0 ? 0.0 : values[idx];
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector other)) return false;
        return featureNames.equals(other.featureNames) && Arrays.equals(values, other.values);
    }

    @Override
    public int hashCode() {
        return 31 * featureNames.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + featureNames + "=" + Arrays.toString(values);
    }
}
