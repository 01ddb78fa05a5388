package com.eainde.diagnosis.config;

import com.eainde.diagnosis.reviewer.ReviewerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Bound from the {@code diagnosis.*} keys of {@code application.yml}.
 */
@ConfigurationProperties(prefix = "diagnosis")
public record DiagnosisProperties(
        @DefaultValue Model model,
        @DefaultValue Reviewer reviewer
) {

    /**
     * @param directory folder holding the classifier artifacts
     */
    public record Model(@DefaultValue("./output") Path directory) {}

    public record Reviewer(
            @DefaultValue("") String apiKey,
            @DefaultValue(ReviewerSettings.DEFAULT_MODEL) String modelName,
            @DefaultValue("0.1") double temperature,
            @DefaultValue("2000") int maxOutputTokens,
            @DefaultValue("30s") Duration timeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("1s") Duration initialBackoff
    ) {

        public ReviewerSettings toSettings() {
            return new ReviewerSettings(apiKey, modelName, temperature, maxOutputTokens,
                    timeout, maxAttempts, initialBackoff);
        }
    }
}
