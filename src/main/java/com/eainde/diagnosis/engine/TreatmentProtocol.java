package com.eainde.diagnosis.engine;

import com.eainde.diagnosis.model.TreatmentAction;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * One row of the static protocol table. An empty keyword list matches every diagnosis.
 */
public record TreatmentProtocol(
        @JsonProperty("name")     String name,
        @JsonProperty("keywords") List<String> keywords,
        @JsonProperty("actions")  List<TreatmentAction> actions
) {

    public TreatmentProtocol {
        keywords = keywords == null ? List.of() : keywords.stream()
                .map(k -> k.toLowerCase(Locale.ROOT))
                .toList();
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    @JsonIgnore
    public boolean isCatchAll() {
        return keywords.isEmpty();
    }

    public boolean matches(String diagnosis) {
        if (isCatchAll()) {
            return true;
        }
        String text = diagnosis == null ? "" : diagnosis.toLowerCase(Locale.ROOT);
        return keywords.stream().anyMatch(text::contains);
    }
}
