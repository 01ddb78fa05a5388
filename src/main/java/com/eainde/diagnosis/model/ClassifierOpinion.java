package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Output of the statistical classifier for one patient.
 *
 * @param label         arg-max class name
 * @param confidence    probability of {@code label}, in [0, 1]
 * @param probabilities full distribution keyed by class name, in class-index order
 */
public record ClassifierOpinion(
        @JsonProperty("label")         String label,
        @JsonProperty("confidence")    double confidence,
        @JsonProperty("probabilities") Map<String, Double> probabilities
) implements Serializable {

    public static final String MODEL_MISSING_LABEL = "System Error: Model Missing";
    public static final String PREDICTION_ERROR_LABEL = "Prediction Error";

    public ClassifierOpinion {
        probabilities = probabilities == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(probabilities));
    }

    /** Sentinel used when no model artifact was loaded at startup. */
    public static ClassifierOpinion unavailable() {
        return new ClassifierOpinion(MODEL_MISSING_LABEL, 0.0, Map.of());
    }

    /** Sentinel used when the loaded model failed on this request. */
    public static ClassifierOpinion predictionError() {
        return new ClassifierOpinion(PREDICTION_ERROR_LABEL, 0.0, Map.of());
    }
}
