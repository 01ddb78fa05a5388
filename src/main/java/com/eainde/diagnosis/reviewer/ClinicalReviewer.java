package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentPlan;

import java.util.Optional;

/**
 * Second-opinion capability backed by a generative model.
 *
 * <p>Implementations never throw to the caller. An empty result means the reviewer
 * could not be consulted (not configured, timed out, exhausted its retries or was
 * interrupted); the orchestrator then continues on the classifier alone.</p>
 */
public interface ClinicalReviewer {

    /**
     * Reviews the classifier's diagnosis against the raw patient data.
     * A reply that cannot be parsed yields {@link ReviewerOpinion#fallback}.
     */
    Optional<ReviewerOpinion> review(ClassifierOpinion classifierOpinion, PatientRecord record);

    /**
     * Generates a treatment plan for the final diagnosis. Empty when the reviewer
     * is unavailable or produced no usable plan.
     */
    Optional<TreatmentPlan> planTreatment(String diagnosis, double severityScore, PatientRecord record);

    boolean isConfigured();
}
