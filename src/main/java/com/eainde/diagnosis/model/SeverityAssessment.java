package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Vitals-only severity result.
 *
 * @param points        raw tier points summed across all vitals
 * @param severityScore points / 14, clamped to [0, 1], rounded to 2 decimals
 * @param urgencyLevel  tier derived from {@code severityScore}
 */
public record SeverityAssessment(
        @JsonProperty("points")         int points,
        @JsonProperty("severity_score") double severityScore,
        @JsonProperty("urgency_level")  UrgencyLevel urgencyLevel
) implements Serializable {}
