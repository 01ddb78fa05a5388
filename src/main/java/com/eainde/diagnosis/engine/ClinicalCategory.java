package com.eainde.diagnosis.engine;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Coarse organ-system bucket of a diagnosis, used to spot a reviewer that
 * disagrees about the affected system rather than the exact condition.
 */
public enum ClinicalCategory {
    CARDIO(Set.of("heart", "cardiac", "mi", "infarction", "angina", "myocardial", "cardiovascular")),
    RESPIRATORY(Set.of("pneumonia", "copd", "asthma", "bronchitis", "lung", "respiratory")),
    GI(Set.of("gastritis", "colitis", "hepatitis", "gi", "abdominal", "stomach", "gastrointestinal")),
    NEURO(Set.of("stroke", "seizure", "migraine", "encephalopathy", "neuro", "brain", "neurological")),
    OTHER(Set.of());

    private final Set<String> keywords;

    ClinicalCategory(Set<String> keywords) {
        this.keywords = keywords;
    }

    /**
     * First bucket, in declaration order, sharing a whole word with the text.
     */
    public static ClinicalCategory of(String diagnosis) {
        if (diagnosis == null || diagnosis.isBlank()) {
            return OTHER;
        }
        Set<String> words = Arrays.stream(diagnosis.toLowerCase(Locale.ROOT).split("[^a-z0-9]+"))
                .filter(w -> !w.isEmpty())
                .collect(Collectors.toSet());
        for (ClinicalCategory category : values()) {
            for (String keyword : category.keywords) {
                if (words.contains(keyword)) {
                    return category;
                }
            }
        }
        return OTHER;
    }
}
