package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentPlan;

import java.util.Optional;

/**
 * Reviewer used when no API key is configured. Every request is classifier-only.
 */
public class UnavailableClinicalReviewer implements ClinicalReviewer {

    @Override
    public Optional<ReviewerOpinion> review(ClassifierOpinion classifierOpinion, PatientRecord record) {
        return Optional.empty();
    }

    @Override
    public Optional<TreatmentPlan> planTreatment(String diagnosis, double severityScore, PatientRecord record) {
        return Optional.empty();
    }

    @Override
    public boolean isConfigured() {
        return false;
    }
}
