package com.eainde.diagnosis.workflow;

import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentPlan;
import com.eainde.diagnosis.reviewer.ClinicalReviewer;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic reviewer returning canned answers and counting calls.
 */
class StubClinicalReviewer implements ClinicalReviewer {

    private final ReviewerOpinion opinion;
    private final TreatmentPlan plan;
    final AtomicInteger reviewCalls = new AtomicInteger();
    final AtomicInteger planCalls = new AtomicInteger();

    StubClinicalReviewer(ReviewerOpinion opinion, TreatmentPlan plan) {
        this.opinion = opinion;
        this.plan = plan;
    }

    @Override
    public Optional<ReviewerOpinion> review(ClassifierOpinion classifierOpinion, PatientRecord record) {
        reviewCalls.incrementAndGet();
        return Optional.ofNullable(opinion);
    }

    @Override
    public Optional<TreatmentPlan> planTreatment(String diagnosis, double severityScore, PatientRecord record) {
        planCalls.incrementAndGet();
        return Optional.ofNullable(plan);
    }

    @Override
    public boolean isConfigured() {
        return true;
    }
}
