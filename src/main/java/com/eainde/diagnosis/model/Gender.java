package com.eainde.diagnosis.model;

import java.util.Locale;

public enum Gender {
    MALE,
    FEMALE,
    OTHER,
    UNKNOWN;

    /**
     * Lenient mapping from free-text input. "prefer not to say", blank and
     * unrecognised values all collapse to {@link #UNKNOWN}.
     */
    public static Gender fromText(String text) {
        if (text == null || text.isBlank()) {
            return UNKNOWN;
        }
        return switch (text.trim().toLowerCase(Locale.ROOT)) {
            case "male", "m" -> MALE;
            case "female", "f" -> FEMALE;
            case "other" -> OTHER;
            default -> UNKNOWN;
        };
    }
}
