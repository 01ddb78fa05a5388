package com.eainde.diagnosis;

import com.eainde.diagnosis.model.Gender;
import com.eainde.diagnosis.model.PatientRecord;

/**
 * Shared patient fixtures.
 */
public final class TestPatients {

    private TestPatients() {
    }

    /** All vitals inside the normal range. */
    public static PatientRecord normal() {
        return PatientRecord.builder()
                .age(40)
                .gender(Gender.FEMALE)
                .temperature(37.0)
                .heartRate(70)
                .systolicBp(120)
                .diastolicBp(80)
                .respiratoryRate(16)
                .oxygenSaturation(99)
                .painScore(0)
                .build();
    }

    public static PatientRecord septicShock() {
        return PatientRecord.builder()
                .age(65)
                .gender(Gender.MALE)
                .temperature(39.5)
                .heartRate(115)
                .systolicBp(85)
                .diastolicBp(50)
                .respiratoryRate(28)
                .oxygenSaturation(88)
                .painScore(0)
                .symptom("fever")
                .symptom("confusion")
                .historyEntry("type 2 diabetes")
                .medication("metformin")
                .allergy("penicillin")
                .build();
    }

    public static PatientRecord tachycardic() {
        return normal().toBuilder()
                .heartRate(120)
                .painScore(6)
                .symptom("chest pain")
                .build();
    }
}
