package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Readiness of the two inference subsystems.
 *
 * @param classifierLoaded   a model artifact was loaded at startup
 * @param featureCount       size of the loaded feature schema, 0 when not loaded
 * @param classCount         number of diagnosis classes, 0 when not loaded
 * @param reviewerConfigured a clinical reviewer is wired in
 */
public record SystemStatus(
        @JsonProperty("classifier_loaded")   boolean classifierLoaded,
        @JsonProperty("feature_count")       int featureCount,
        @JsonProperty("class_count")         int classCount,
        @JsonProperty("reviewer_configured") boolean reviewerConfigured
) {}
