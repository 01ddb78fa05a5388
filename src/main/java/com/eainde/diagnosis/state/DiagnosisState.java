package com.eainde.diagnosis.state;

import com.eainde.diagnosis.engine.Reconciliation;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.FinalDiagnosis;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.SeverityAssessment;
import com.eainde.diagnosis.model.TreatmentPlan;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state for one diagnosis request. Every value stored here is
 * {@link java.io.Serializable}; absent opinions are absent keys, never nulls.
 */
public class DiagnosisState extends AgentState {

    public static final String PATIENT = "patient";
    public static final String VIOLATIONS = "violations";
    public static final String STAGE = "stage";
    public static final String CLASSIFIER_OPINION = "classifierOpinion";
    public static final String CLASSIFIER_AVAILABLE = "classifierAvailable";
    public static final String REVIEWER_OPINION = "reviewerOpinion";
    public static final String RECONCILED = "reconciled";
    public static final String SEVERITY = "severity";
    public static final String TREATMENT_PLAN = "treatmentPlan";
    public static final String FINAL_DIAGNOSIS = "finalDiagnosis";

    public DiagnosisState(Map<String, Object> initData) {
        super(initData);
    }

    public PatientRecord patient() {
        return (PatientRecord) data().get(PATIENT);
    }

    @SuppressWarnings("unchecked")
    public List<String> violations() {
        return (List<String>) data().getOrDefault(VIOLATIONS, List.of());
    }

    public String stage() {
        return (String) data().getOrDefault(STAGE, "");
    }

    public ClassifierOpinion classifierOpinion() {
        return (ClassifierOpinion) data().get(CLASSIFIER_OPINION);
    }

    public boolean classifierAvailable() {
        return Boolean.TRUE.equals(data().get(CLASSIFIER_AVAILABLE));
    }

    public Optional<ReviewerOpinion> reviewerOpinion() {
        return Optional.ofNullable((ReviewerOpinion) data().get(REVIEWER_OPINION));
    }

    public Optional<Reconciliation> reconciled() {
        return Optional.ofNullable((Reconciliation) data().get(RECONCILED));
    }

    public SeverityAssessment severity() {
        return (SeverityAssessment) data().get(SEVERITY);
    }

    public Optional<TreatmentPlan> treatmentPlan() {
        return Optional.ofNullable((TreatmentPlan) data().get(TREATMENT_PLAN));
    }

    public Optional<FinalDiagnosis> finalDiagnosis() {
        return Optional.ofNullable((FinalDiagnosis) data().get(FINAL_DIAGNOSIS));
    }

    public static Map<String, Object> updateStage(String stage) {
        return Map.of(STAGE, stage);
    }
}
