package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * One step of a treatment plan.
 *
 * @param category grouping such as "immediate_interventions" or "monitoring"
 * @param action   the instruction itself
 */
public record TreatmentAction(
        @JsonProperty("category") String category,
        @JsonProperty("action")   String action
) implements Serializable {}
