package com.eainde.diagnosis.engine;

/**
 * Outcome of the override protocol.
 *
 * @param override true when the reviewer's diagnosis replaces the classifier's
 * @param rule     which rule decided; {@link Rule#NONE} when no rule matched
 */
public record OverrideDecision(boolean override, Rule rule) {

    public enum Rule {
        /** One of the diagnoses was empty; nothing to compare. */
        MISSING_DIAGNOSIS,
        VAGUE_CLASSIFIER_LABEL,
        REVIEWER_REQUESTED,
        VERDICT_INCORRECT,
        CATEGORY_MISMATCH,
        NONE
    }

    static OverrideDecision override(Rule rule) {
        return new OverrideDecision(true, rule);
    }

    static OverrideDecision keep(Rule rule) {
        return new OverrideDecision(false, rule);
    }
}
