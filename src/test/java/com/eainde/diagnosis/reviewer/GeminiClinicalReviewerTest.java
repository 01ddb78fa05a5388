package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.TestPatients;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentPlan;
import com.eainde.diagnosis.thread.MdcAwareExecutor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atMost;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class GeminiClinicalReviewerTest {

    private static final String VALID_REVIEW =
            "{\"diagnosis\":\"Septic Shock\",\"validation_verdict\":\"Incorrect\",\"certainty\":0.9}";

    private static final ClassifierOpinion CLASSIFIER =
            new ClassifierOpinion("Pneumonia", 0.7, Map.of("Pneumonia", 0.7));

    @Mock
    private ClinicalReviewAgent agent;

    private MdcAwareExecutor executor;

    @BeforeEach
    void setUp() {
        executor = new MdcAwareExecutor("reviewer-test");
    }

    @AfterEach
    void tearDown() {
        executor.close();
    }

    private GeminiClinicalReviewer reviewer(Duration timeout, int attempts) {
        ReviewerSettings settings = new ReviewerSettings("test-key", "gemini-1.5-flash", 0.1, 2000,
                timeout, attempts, Duration.ofMillis(10));
        return new GeminiClinicalReviewer(agent, settings, new ReviewerResponseParser(),
                new PatientContextFormatter(), executor);
    }

    private GeminiClinicalReviewer reviewer() {
        return reviewer(Duration.ofSeconds(5), 3);
    }

    // =========================================================================
    //  Review
    // =========================================================================

    @Nested
    @DisplayName("review")
    class Review {

        @Test
        @DisplayName("should parse the reviewer's reply and pass the classifier finding in the prompt")
        void success() {
            when(agent.review(anyString(), eq("Pneumonia"), eq("70.0%"))).thenReturn(VALID_REVIEW);

            Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

            assertThat(opinion).isPresent();
            assertThat(opinion.get().diagnosis()).isEqualTo("Septic Shock");
            assertThat(opinion.get().isAuthoritative()).isTrue();
        }

        @Test
        @DisplayName("should retry transient I/O failures and then succeed")
        void retriesTransient() {
            when(agent.review(anyString(), anyString(), anyString()))
                    .thenThrow(new UncheckedIOException(new IOException("connection reset")))
                    .thenReturn(VALID_REVIEW);

            Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

            assertThat(opinion).isPresent();
            verify(agent, times(2)).review(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should give up after the configured attempts")
        void exhaustsRetries() {
            when(agent.review(anyString(), anyString(), anyString()))
                    .thenThrow(new UncheckedIOException(new IOException("connection reset")));

            Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

            assertThat(opinion).isEmpty();
            verify(agent, times(3)).review(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should not retry non-transient failures")
        void noRetryOnPermanentFailure() {
            when(agent.review(anyString(), anyString(), anyString()))
                    .thenThrow(new IllegalArgumentException("invalid API key"));

            Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

            assertThat(opinion).isEmpty();
            verify(agent, times(1)).review(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should return a fallback opinion for a malformed reply without retrying")
        void malformed() {
            when(agent.review(anyString(), anyString(), anyString())).thenReturn("Sorry, I can't do that.");

            Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

            assertThat(opinion).isPresent();
            assertThat(opinion.get().fallback()).isTrue();
            assertThat(opinion.get().diagnosis()).isEqualTo("Pneumonia");
            assertThat(opinion.get().validationVerdict()).isEqualTo(ReviewerOpinion.FALLBACK_VERDICT);
            assertThat(opinion.get().needsOverride()).isFalse();
            verify(agent, times(1)).review(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("should treat a slow reviewer as a transient timeout")
        void timeoutCountsAsTransient() {
            when(agent.review(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(1_000);
                return VALID_REVIEW;
            });

            long started = System.nanoTime();
            Optional<ReviewerOpinion> opinion = reviewer(Duration.ofMillis(100), 2)
                    .review(CLASSIFIER, TestPatients.septicShock());
            Duration elapsed = Duration.ofNanos(System.nanoTime() - started);

            assertThat(opinion).isEmpty();
            assertThat(elapsed).isLessThan(Duration.ofMillis(900));
            verify(agent, timeout(1_000).times(2)).review(anyString(), anyString(), anyString());
        }

        @Test
        @DisplayName("interruption should degrade to empty and keep the interrupt flag")
        void interrupted() {
            // the time limiter may cancel the call before the worker reaches the agent
            lenient().when(agent.review(anyString(), anyString(), anyString())).thenAnswer(invocation -> {
                Thread.sleep(500);
                return VALID_REVIEW;
            });

            Thread.currentThread().interrupt();
            try {
                Optional<ReviewerOpinion> opinion = reviewer().review(CLASSIFIER, TestPatients.septicShock());

                assertThat(opinion).isEmpty();
                assertThat(Thread.currentThread().isInterrupted()).isTrue();
                verify(agent, atMost(1)).review(anyString(), anyString(), anyString());
            } finally {
                Thread.interrupted();
            }
        }
    }

    // =========================================================================
    //  Treatment plan
    // =========================================================================

    @Nested
    @DisplayName("planTreatment")
    class PlanTreatment {

        @Test
        @DisplayName("should return the reviewer plan")
        void success() {
            when(agent.planTreatment(eq("Septic Shock"), eq("0.79"), anyString()))
                    .thenReturn("{\"immediate_interventions\": [\"Blood cultures\"], \"medications\": [\"Ceftriaxone 2 g IV\"]}");

            Optional<TreatmentPlan> plan = reviewer().planTreatment("Septic Shock", 0.79, TestPatients.septicShock());

            assertThat(plan).isPresent();
            assertThat(plan.get().origin()).isEqualTo(TreatmentPlan.REVIEWER_ORIGIN);
            assertThat(plan.get().actions()).hasSize(2);
        }

        @Test
        @DisplayName("malformed or empty plans should be empty")
        void unusable() {
            when(agent.planTreatment(anyString(), anyString(), anyString()))
                    .thenReturn("no plan today")
                    .thenReturn("{}");

            GeminiClinicalReviewer reviewer = reviewer();

            assertThat(reviewer.planTreatment("Asthma", 0.2, TestPatients.normal())).isEmpty();
            assertThat(reviewer.planTreatment("Asthma", 0.2, TestPatients.normal())).isEmpty();
        }
    }

    @Test
    @DisplayName("transient classification")
    void transientClassification() {
        assertThat(GeminiClinicalReviewer.isTransient(new TimeoutException())).isTrue();
        assertThat(GeminiClinicalReviewer.isTransient(new UncheckedIOException(new IOException()))).isTrue();
        assertThat(GeminiClinicalReviewer.isTransient(new RuntimeException(new IOException()))).isTrue();
        assertThat(GeminiClinicalReviewer.isTransient(new IllegalStateException("bad request"))).isFalse();
    }
}
