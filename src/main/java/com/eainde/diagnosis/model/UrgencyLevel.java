package com.eainde.diagnosis.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum UrgencyLevel {
    ROUTINE,
    URGENT,
    EMERGENCY;

    @JsonValue
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
