package com.eainde.diagnosis.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.io.Serializable;
import java.util.List;
import java.util.Set;

/**
 * Vital signs, demographics and history for one diagnosis request.
 *
 * <p>Built once per request and never mutated. Vital-sign defaults are the
 * "normal adult" values the intake form pre-fills, so a builder call that only
 * sets the abnormal vitals still yields a complete record.</p>
 */
@Value
@Builder(toBuilder = true)
public class PatientRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    double age;

    @Builder.Default
    Gender gender = Gender.UNKNOWN;

    @Builder.Default
    double temperature = 37.0;

    @Builder.Default
    double heartRate = 75.0;

    @Builder.Default
    double systolicBp = 120.0;

    @Builder.Default
    double diastolicBp = 80.0;

    @Builder.Default
    double respiratoryRate = 16.0;

    @Builder.Default
    double oxygenSaturation = 98.0;

    @Builder.Default
    double painScore = 0.0;

    @Singular
    Set<String> symptoms;

    @Singular("historyEntry")
    List<String> medicalHistory;

    @Singular
    List<String> allergies;

    @Singular
    List<String> medications;
}
