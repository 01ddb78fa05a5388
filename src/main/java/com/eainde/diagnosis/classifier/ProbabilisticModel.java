package com.eainde.diagnosis.classifier;

/**
 * A trained multi-class model. Implementations are immutable and safe to share
 * between concurrent requests.
 */
public interface ProbabilisticModel {

    /**
     * @param features one value per schema feature, in schema order
     * @return one probability per class, indexed by class id
     */
    double[] predictProba(double[] features);

    int featureCount();

    int classCount();
}
