package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.io.Serializable;
import java.util.List;

/**
 * The consensus result handed to the report layer.
 *
 * <p>Reviewer-derived fields ({@code clinicalReasoning}, {@code differentials},
 * {@code redFlags}) are empty when {@code source} is
 * {@link DiagnosisSource#CLASSIFIER_ONLY}.</p>
 *
 * @param primaryDiagnosis  winning diagnosis
 * @param confidence        confidence in {@code primaryDiagnosis}, in [0, 1]
 * @param source            which subsystem won
 * @param severityScore     vitals-only severity, in [0, 1]
 * @param urgencyLevel      tier derived from {@code severityScore}
 * @param clinicalReasoning reviewer reasoning, empty when unavailable
 * @param differentials     reviewer differentials, most likely first
 * @param redFlags          reviewer red flags
 * @param treatmentPlan     plan for {@code primaryDiagnosis}
 */
@JsonPropertyOrder({"primary_diagnosis", "confidence", "source", "severity_score", "urgency_level",
        "clinical_reasoning", "differentials", "red_flags", "treatment_plan"})
public record FinalDiagnosis(
        @JsonProperty("primary_diagnosis")  String primaryDiagnosis,
        @JsonProperty("confidence")         double confidence,
        @JsonProperty("source")             DiagnosisSource source,
        @JsonProperty("severity_score")     double severityScore,
        @JsonProperty("urgency_level")      UrgencyLevel urgencyLevel,
        @JsonProperty("clinical_reasoning") String clinicalReasoning,
        @JsonProperty("differentials")      List<String> differentials,
        @JsonProperty("red_flags")          List<String> redFlags,
        @JsonProperty("treatment_plan")     TreatmentPlan treatmentPlan
) implements Serializable {

    public FinalDiagnosis {
        clinicalReasoning = clinicalReasoning == null ? "" : clinicalReasoning;
        differentials = differentials == null ? List.of() : List.copyOf(differentials);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }
}
