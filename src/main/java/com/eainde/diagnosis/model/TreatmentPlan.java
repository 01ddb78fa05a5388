package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Ordered treatment plan for the final diagnosis.
 *
 * @param origin  "reviewer" when generated by the clinical reviewer,
 *                "protocol:&lt;name&gt;" when taken from the static protocol table
 * @param actions ordered (category, action) pairs
 */
public record TreatmentPlan(
        @JsonProperty("origin")  String origin,
        @JsonProperty("actions") List<TreatmentAction> actions
) implements Serializable {

    public static final String REVIEWER_ORIGIN = "reviewer";
    public static final String PROTOCOL_ORIGIN_PREFIX = "protocol:";

    public TreatmentPlan {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return actions.isEmpty();
    }
}
