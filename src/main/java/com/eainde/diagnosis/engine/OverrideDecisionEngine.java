package com.eainde.diagnosis.engine;

import com.eainde.diagnosis.engine.OverrideDecision.Rule;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.DiagnosisSource;
import com.eainde.diagnosis.model.ReviewerOpinion;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether the reviewer's diagnosis replaces the classifier's, and merges the
 * two opinions into a {@link Reconciliation}.
 *
 * <p>Rules are evaluated in order and the first match wins:</p>
 * <ol>
 *   <li>classifier label is vague and the reviewer's is not</li>
 *   <li>reviewer asks for an override with certainty above 0.8</li>
 *   <li>reviewer verdict says "incorrect" with certainty above 0.7</li>
 *   <li>the diagnoses fall into different {@link ClinicalCategory} buckets with certainty above 0.6</li>
 * </ol>
 */
@Log4j2
@Component
public class OverrideDecisionEngine {

    public static final List<String> VAGUE_TERMS = List.of(
            "cardiovascular", "respiratory", "gastrointestinal", "neurological",
            "other", "unknown", "unspecified", "general", "disease", "disorder");

    static final double REQUESTED_OVERRIDE_CERTAINTY = 0.8;
    static final double INCORRECT_VERDICT_CERTAINTY = 0.7;
    static final double CATEGORY_MISMATCH_CERTAINTY = 0.6;

    public boolean shouldOverride(String mlDiagnosis, String reviewerDiagnosis, ReviewerOpinion opinion) {
        return decide(mlDiagnosis, reviewerDiagnosis, opinion).override();
    }

    public OverrideDecision decide(String mlDiagnosis, String reviewerDiagnosis, ReviewerOpinion opinion) {
        if (isBlank(mlDiagnosis) || isBlank(reviewerDiagnosis)) {
            return OverrideDecision.keep(Rule.MISSING_DIAGNOSIS);
        }
        double certainty = opinion.certainty();

        if (isVague(mlDiagnosis) && !isVague(reviewerDiagnosis)) {
            return OverrideDecision.override(Rule.VAGUE_CLASSIFIER_LABEL);
        }
        if (opinion.needsOverride() && certainty > REQUESTED_OVERRIDE_CERTAINTY) {
            return OverrideDecision.override(Rule.REVIEWER_REQUESTED);
        }
        if (opinion.validationVerdict().toLowerCase(Locale.ROOT).contains("incorrect")
                && certainty > INCORRECT_VERDICT_CERTAINTY) {
            return OverrideDecision.override(Rule.VERDICT_INCORRECT);
        }
        if (differentCategories(mlDiagnosis, reviewerDiagnosis) && certainty > CATEGORY_MISMATCH_CERTAINTY) {
            return OverrideDecision.override(Rule.CATEGORY_MISMATCH);
        }
        return OverrideDecision.keep(Rule.NONE);
    }

    /**
     * Merges both opinions. An absent or fallback reviewer opinion leaves the
     * classifier result untouched and the reviewer-derived fields empty.
     */
    public Reconciliation reconcile(ClassifierOpinion classifier, Optional<ReviewerOpinion> reviewer) {
        if (reviewer.isEmpty() || !reviewer.get().isAuthoritative()) {
            log.info("No authoritative clinical review, keeping classifier diagnosis '{}'", classifier.label());
            return Reconciliation.classifierOnly(classifier);
        }

        ReviewerOpinion opinion = reviewer.get();
        OverrideDecision decision = decide(classifier.label(), opinion.diagnosis(), opinion);
        if (decision.override()) {
            log.info("Override [{}]: '{}' -> '{}' (reviewer certainty {})",
                    decision.rule(), classifier.label(), opinion.diagnosis(), opinion.certainty());
            return new Reconciliation(opinion.diagnosis(),
                    Math.max(classifier.confidence(), opinion.certainty()),
                    DiagnosisSource.HYBRID_OVERRIDDEN,
                    opinion.clinicalReasoning(), opinion.differentials(), opinion.redFlags(),
                    decision.rule());
        }

        log.info("Reviewer validated classifier diagnosis '{}' (verdict '{}')",
                classifier.label(), opinion.validationVerdict());
        return new Reconciliation(classifier.label(), classifier.confidence(),
                DiagnosisSource.HYBRID_VALIDATED,
                opinion.clinicalReasoning(), opinion.differentials(), opinion.redFlags(),
                decision.rule());
    }

    public static boolean isVague(String diagnosis) {
        String text = diagnosis.toLowerCase(Locale.ROOT);
        for (String term : VAGUE_TERMS) {
            if (text.contains(term)) {
                return true;
            }
        }
        return false;
    }

    /**
     * True only when both diagnoses land in a known bucket and the buckets differ.
     */
    static boolean differentCategories(String first, String second) {
        ClinicalCategory a = ClinicalCategory.of(first);
        ClinicalCategory b = ClinicalCategory.of(second);
        return a != ClinicalCategory.OTHER && b != ClinicalCategory.OTHER && a != b;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
