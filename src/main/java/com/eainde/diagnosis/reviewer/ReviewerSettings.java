package com.eainde.diagnosis.reviewer;

import java.time.Duration;

/**
 * Everything the Gemini reviewer needs, resolved once at startup.
 *
 * @param apiKey          Gemini API key; blank means no reviewer is configured
 * @param modelName       Gemini model id
 * @param temperature     sampling temperature
 * @param maxOutputTokens response token cap
 * @param timeout         hard limit for one reviewer call
 * @param maxAttempts     total attempts for transient failures, first call included
 * @param initialBackoff  wait before the second attempt; doubles after each failure
 */
public record ReviewerSettings(
        String apiKey,
        String modelName,
        double temperature,
        int maxOutputTokens,
        Duration timeout,
        int maxAttempts,
        Duration initialBackoff
) {

    public static final String DEFAULT_MODEL = "gemini-1.5-flash";

    public ReviewerSettings {
        modelName = modelName == null || modelName.isBlank() ? DEFAULT_MODEL : modelName;
        timeout = timeout == null ? Duration.ofSeconds(30) : timeout;
        initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (maxOutputTokens < 1) {
            throw new IllegalArgumentException("maxOutputTokens must be positive");
        }
    }

    public static ReviewerSettings defaults(String apiKey) {
        return new ReviewerSettings(apiKey, DEFAULT_MODEL, 0.1, 2000,
                Duration.ofSeconds(30), 3, Duration.ofSeconds(1));
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        // keep the key out of logs
        return "ReviewerSettings[model=" + modelName + ", temperature=" + temperature
                + ", maxOutputTokens=" + maxOutputTokens + ", timeout=" + timeout
                + ", maxAttempts=" + maxAttempts + ", initialBackoff=" + initialBackoff + "]";
    }
}
