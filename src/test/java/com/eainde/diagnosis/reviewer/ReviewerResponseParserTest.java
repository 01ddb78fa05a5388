package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.exception.MalformedReviewException;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentAction;
import com.eainde.diagnosis.model.TreatmentPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReviewerResponseParserTest {

    private final ReviewerResponseParser parser = new ReviewerResponseParser();

    // =========================================================================
    //  Opinions
    // =========================================================================

    @Nested
    @DisplayName("Opinion parsing")
    class Opinions {

        @Test
        @DisplayName("should map a well-formed response")
        void wellFormed() {
            String raw = """
                    {
                      "diagnosis": "Septic Shock",
                      "validation_verdict": "Incorrect",
                      "certainty": 0.92,
                      "clinical_reasoning": "Hypotension with fever and tachycardia",
                      "differentials": ["Pneumonia", "Pyelonephritis"],
                      "red_flags": ["SBP below 90"],
                      "needs_override": true,
                      "override_reason": "Shock physiology"
                    }
                    """;

            ReviewerOpinion opinion = parser.parseOpinion(raw);

            assertThat(opinion.diagnosis()).isEqualTo("Septic Shock");
            assertThat(opinion.validationVerdict()).isEqualTo("Incorrect");
            assertThat(opinion.certainty()).isEqualTo(0.92);
            assertThat(opinion.differentials()).containsExactly("Pneumonia", "Pyelonephritis");
            assertThat(opinion.redFlags()).containsExactly("SBP below 90");
            assertThat(opinion.needsOverride()).isTrue();
            assertThat(opinion.overrideReason()).isEqualTo("Shock physiology");
            assertThat(opinion.isAuthoritative()).isTrue();
        }

        @Test
        @DisplayName("should accept the historical field names")
        void aliases() {
            String raw = "{\"gemini_diagnosis\": \"Asthma\", \"ml_validation\": \"Correct\", \"certainty\": 0.8}";

            ReviewerOpinion opinion = parser.parseOpinion(raw);

            assertThat(opinion.diagnosis()).isEqualTo("Asthma");
            assertThat(opinion.validationVerdict()).isEqualTo("Correct");
        }

        @Test
        @DisplayName("should strip markdown fences and surrounding prose")
        void fencesAndProse() {
            String raw = """
                    ```json
                    Here is my review: {"diagnosis": "Pneumonia", "certainty": 0.7} hope it helps
                    ```
                    """;

            assertThat(parser.parseOpinion(raw).diagnosis()).isEqualTo("Pneumonia");
        }

        @Test
        @DisplayName("should tolerate single quotes, unquoted names, comments and trailing commas")
        void lenientSyntax() {
            String raw = "{ diagnosis: 'Migraine', // reviewer note\n 'certainty': 0.6, }";

            ReviewerOpinion opinion = parser.parseOpinion(raw);

            assertThat(opinion.diagnosis()).isEqualTo("Migraine");
            assertThat(opinion.certainty()).isEqualTo(0.6);
        }

        @Test
        @DisplayName("should coerce loosely typed fields")
        void coercion() {
            String raw = """
                    {"diagnosis": "Stroke", "certainty": "85%", "needs_override": "yes",
                     "differentials": [{"diagnosis": "TIA", "likelihood": "high"}, "Hypoglycemia"],
                     "red_flags": "facial droop, slurred speech"}
                    """;

            ReviewerOpinion opinion = parser.parseOpinion(raw);

            assertThat(opinion.certainty()).isEqualTo(0.85);
            assertThat(opinion.needsOverride()).isTrue();
            assertThat(opinion.differentials()).containsExactly("TIA", "Hypoglycemia");
            assertThat(opinion.redFlags()).containsExactly("facial droop", "slurred speech");
        }

        @Test
        @DisplayName("certainty given as a percentage number should be scaled and clamped")
        void certaintyScaling() {
            assertThat(parser.parseOpinion("{\"diagnosis\":\"X\",\"certainty\":90}").certainty()).isEqualTo(0.9);
            assertThat(parser.parseOpinion("{\"diagnosis\":\"X\",\"certainty\":250}").certainty()).isEqualTo(1.0);
            assertThat(parser.parseOpinion("{\"diagnosis\":\"X\",\"certainty\":-3}").certainty()).isEqualTo(0.0);
            assertThat(parser.parseOpinion("{\"diagnosis\":\"X\",\"certainty\":\"high\"}").certainty()).isEqualTo(0.0);
            assertThat(parser.parseOpinion("{\"diagnosis\":\"X\"}").certainty()).isEqualTo(0.0);
        }

        @Test
        @DisplayName("missing diagnosis should be malformed")
        void missingDiagnosis() {
            assertThatThrownBy(() -> parser.parseOpinion("{\"certainty\": 0.9}"))
                    .isInstanceOf(MalformedReviewException.class);
        }

        @Test
        @DisplayName("text without a JSON object should be malformed")
        void noJson() {
            assertThatThrownBy(() -> parser.parseOpinion("I cannot help with that."))
                    .isInstanceOf(MalformedReviewException.class);
            assertThatThrownBy(() -> parser.parseOpinion(""))
                    .isInstanceOf(MalformedReviewException.class);
            assertThatThrownBy(() -> parser.parseOpinion("{\"diagnosis\": }"))
                    .isInstanceOf(MalformedReviewException.class);
        }
    }

    // =========================================================================
    //  Treatment plans
    // =========================================================================

    @Nested
    @DisplayName("Plan parsing")
    class Plans {

        @Test
        @DisplayName("should flatten categories in presentation order")
        void flatten() {
            String raw = """
                    {"patient_education": ["Hydration"],
                     "immediate_interventions": ["IV antibiotics", "Fluids"],
                     "monitoring": "Lactate"}
                    """;

            TreatmentPlan plan = parser.parsePlan(raw);

            assertThat(plan.origin()).isEqualTo(TreatmentPlan.REVIEWER_ORIGIN);
            assertThat(plan.actions()).containsExactly(
                    new TreatmentAction("immediate_interventions", "IV antibiotics"),
                    new TreatmentAction("immediate_interventions", "Fluids"),
                    new TreatmentAction("monitoring", "Lactate"),
                    new TreatmentAction("patient_education", "Hydration"));
        }

        @Test
        @DisplayName("object without known categories should give an empty plan")
        void empty() {
            assertThat(parser.parsePlan("{\"plan\": \"rest\"}").isEmpty()).isTrue();
        }
    }
}
