package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.exception.MalformedReviewException;
import com.eainde.diagnosis.exception.ReviewerUnavailableException;
import com.eainde.diagnosis.model.ClassifierOpinion;
import com.eainde.diagnosis.model.PatientRecord;
import com.eainde.diagnosis.model.ReviewerOpinion;
import com.eainde.diagnosis.model.TreatmentPlan;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.extern.log4j.Log4j2;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * {@link ClinicalReviewer} backed by Gemini through {@link ClinicalReviewAgent}.
 *
 * <p>Each call runs on {@code executor} under a {@link TimeLimiter}; on timeout the
 * running future is cancelled and the caller moves on. The limited call is wrapped in
 * a {@link Retry} that only retries transient failures (timeouts, I/O, HTTP 429/5xx)
 * with exponential backoff. A malformed reply is never retried.</p>
 */
@Log4j2
public class GeminiClinicalReviewer implements ClinicalReviewer {

    private final ClinicalReviewAgent agent;
    private final ReviewerResponseParser parser;
    private final PatientContextFormatter contextFormatter;
    private final Executor executor;
    private final Retry retry;
    private final TimeLimiter timeLimiter;

    public GeminiClinicalReviewer(ClinicalReviewAgent agent,
                                  ReviewerSettings settings,
                                  ReviewerResponseParser parser,
                                  PatientContextFormatter contextFormatter,
                                  Executor executor) {
        this.agent = agent;
        this.parser = parser;
        this.contextFormatter = contextFormatter;
        this.executor = executor;
        this.retry = Retry.of("clinical-reviewer", RetryConfig.custom()
                .maxAttempts(settings.maxAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(settings.initialBackoff(), 2.0))
                .retryOnException(GeminiClinicalReviewer::isTransient)
                .build());
        this.timeLimiter = TimeLimiter.of("clinical-reviewer", TimeLimiterConfig.custom()
                .timeoutDuration(settings.timeout())
                .cancelRunningFuture(true)
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.warn("Reviewer call failed (attempt {}), retrying in {}: {}",
                        event.getNumberOfRetryAttempts(), event.getWaitInterval(),
                        String.valueOf(event.getLastThrowable())));
    }

    @Override
    public Optional<ReviewerOpinion> review(ClassifierOpinion classifierOpinion, PatientRecord record) {
        String context = contextFormatter.format(record);
        String confidence = String.format(Locale.ROOT, "%.1f%%", classifierOpinion.confidence() * 100);
        try {
            String raw = call(() -> agent.review(context, classifierOpinion.label(), confidence));
            return Optional.of(parser.parseOpinion(raw));
        } catch (MalformedReviewException e) {
            log.warn("Reviewer reply could not be parsed, using fallback opinion: {}", e.getMessage());
            return Optional.of(ReviewerOpinion.fallback(classifierOpinion));
        } catch (ReviewerUnavailableException e) {
            log.error("Clinical review unavailable, continuing classifier-only", e);
            return Optional.empty();
        }
    }

    @Override
    public Optional<TreatmentPlan> planTreatment(String diagnosis, double severityScore, PatientRecord record) {
        String context = contextFormatter.format(record);
        String severity = String.format(Locale.ROOT, "%.2f", severityScore);
        try {
            TreatmentPlan plan = parser.parsePlan(call(() -> agent.planTreatment(diagnosis, severity, context)));
            return plan.isEmpty() ? Optional.empty() : Optional.of(plan);
        } catch (MalformedReviewException e) {
            log.warn("Treatment plan reply could not be parsed: {}", e.getMessage());
            return Optional.empty();
        } catch (ReviewerUnavailableException e) {
            log.error("Treatment planning unavailable, static protocol will be used", e);
            return Optional.empty();
        }
    }

    @Override
    public boolean isConfigured() {
        return true;
    }

    /**
     * Runs one reviewer exchange under the time limit and retry policy.
     *
     * @throws MalformedReviewException    never retried, passed through
     * @throws ReviewerUnavailableException for everything else, including interruption
     */
    private String call(Supplier<String> exchange) {
        Callable<String> limited = TimeLimiter.decorateFutureSupplier(timeLimiter,
                () -> CompletableFuture.supplyAsync(exchange, executor));
        Callable<String> retrying = Retry.decorateCallable(retry, limited);
        try {
            return retrying.call();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ReviewerUnavailableException("Interrupted while waiting for the reviewer", e);
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            if (cause instanceof MalformedReviewException malformed) {
                throw malformed;
            }
            if (cause instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new ReviewerUnavailableException("Reviewer call failed: " + cause, cause);
        }
    }

    static boolean isTransient(Throwable error) {
        Throwable t = unwrap(error);
        if (t instanceof TimeoutException
                || t instanceof dev.langchain4j.exception.TimeoutException
                || t instanceof InternalServerException
                || t instanceof IOException
                || t instanceof UncheckedIOException) {
            return true;
        }
        if (t instanceof HttpException http) {
            return http.statusCode() == 429 || http.statusCode() >= 500;
        }
        return t.getCause() instanceof IOException;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable t = error;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }
}
