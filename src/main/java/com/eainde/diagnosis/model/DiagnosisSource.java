package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which subsystem's diagnosis ended up as the primary one.
 */
public enum DiagnosisSource {
    CLASSIFIER_ONLY("classifier-only"),
    HYBRID_VALIDATED("hybrid-validated"),
    HYBRID_OVERRIDDEN("hybrid-overridden");

    private final String label;

    DiagnosisSource(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
