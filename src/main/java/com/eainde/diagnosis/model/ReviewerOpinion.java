package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Independent assessment returned by the clinical reviewer.
 *
 * <p>{@code validationVerdict} is kept as free text ("Correct", "Partially Correct",
 * "Incorrect", "Unsure", ...) because the reviewer is not bound to an enum.
 * A {@code fallback} opinion is produced locally when the reviewer answered with
 * something that could not be parsed; it carries no clinical weight.</p>
 *
 * @param diagnosis         the reviewer's own diagnosis
 * @param validationVerdict verdict on the classifier's diagnosis
 * @param certainty         reviewer certainty, in [0, 1]
 * @param clinicalReasoning explanation of the assessment
 * @param differentials     differential diagnoses, most likely first
 * @param redFlags          findings needing immediate attention
 * @param needsOverride     reviewer asks for its diagnosis to replace the classifier's
 * @param overrideReason    why the override is requested
 * @param fallback          true when locally synthesised after a malformed response
 */
public record ReviewerOpinion(
        @JsonProperty("diagnosis")          String diagnosis,
        @JsonProperty("validation_verdict") String validationVerdict,
        @JsonProperty("certainty")          double certainty,
        @JsonProperty("clinical_reasoning") String clinicalReasoning,
        @JsonProperty("differentials")      List<String> differentials,
        @JsonProperty("red_flags")          List<String> redFlags,
        @JsonProperty("needs_override")     boolean needsOverride,
        @JsonProperty("override_reason")    String overrideReason,
        @JsonProperty("fallback")           boolean fallback
) implements Serializable {

    public static final String FALLBACK_VERDICT = "unable to validate";
    public static final String FALLBACK_REASONING = "AI clinical review unavailable";
    public static final double FALLBACK_CERTAINTY = 0.5;

    public ReviewerOpinion {
        diagnosis = diagnosis == null ? "" : diagnosis;
        validationVerdict = validationVerdict == null ? "" : validationVerdict;
        clinicalReasoning = clinicalReasoning == null ? "" : clinicalReasoning;
        overrideReason = overrideReason == null ? "" : overrideReason;
        differentials = differentials == null ? List.of() : List.copyOf(differentials);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }

    /**
     * Opinion used when the reviewer replied but the payload was unusable:
     * echoes the classifier and never asks for an override.
     */
    public static ReviewerOpinion fallback(ClassifierOpinion classifierOpinion) {
        return new ReviewerOpinion(
                classifierOpinion.label(),
                FALLBACK_VERDICT,
                FALLBACK_CERTAINTY,
                FALLBACK_REASONING,
                List.of(),
                List.of(),
                false,
                "Fallback mode",
                true);
    }

    /** True when this opinion came from the reviewer itself and may influence the result. */
    @JsonIgnore
    public boolean isAuthoritative() {
        return !fallback;
    }
}
