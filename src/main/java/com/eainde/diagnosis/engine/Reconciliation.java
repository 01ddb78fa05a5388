package com.eainde.diagnosis.engine;

import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.DiagnosisSource;

import java.io.Serializable;
import java.util.List;

/**
 * Consensus between the classifier and the reviewer, before severity and treatment
 * are attached.
 */
public record Reconciliation(
        String primaryDiagnosis,
        double confidence,
        DiagnosisSource source,
        String clinicalReasoning,
        List<String> differentials,
        List<String> redFlags,
        OverrideDecision.Rule rule
) implements Serializable {

    public Reconciliation {
        clinicalReasoning = clinicalReasoning == null ? "" : clinicalReasoning;
        differentials = differentials == null ? List.of() : List.copyOf(differentials);
        redFlags = redFlags == null ? List.of() : List.copyOf(redFlags);
    }

    /** Classifier result with no reviewer contribution. */
    public static Reconciliation classifierOnly(ClassifierOpinion classifier) {
        return new Reconciliation(classifier.label(), classifier.confidence(),
                DiagnosisSource.CLASSIFIER_ONLY, "", List.of(), List.of(), OverrideDecision.Rule.NONE);
    }
}
