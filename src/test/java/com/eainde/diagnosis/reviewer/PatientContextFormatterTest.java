package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.TestPatients;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class PatientContextFormatterTest {

    private final PatientContextFormatter formatter = new PatientContextFormatter();

    @Test
    @DisplayName("should list vitals and only the non-empty history sections")
    void normalPatient() {
        String context = formatter.format(TestPatients.normal());

        assertThat(context.split("\n")).containsExactly(
                "Age: 40 years",
                "Gender: female",
                "Temperature: 37°C",
                "Heart Rate: 70 bpm",
                "Blood Pressure: 120/80 mmHg",
                "Respiratory Rate: 16 /min",
                "Oxygen Saturation: 99%",
                "Pain Score: 0/10");
    }

    @Test
    @DisplayName("should append symptoms, history, medications and allergies when present")
    void fullPatient() {
        String context = formatter.format(TestPatients.septicShock());

        assertThat(context)
                .contains("Temperature: 39.5°C")
                .contains("Symptoms: fever, confusion")
                .contains("Medical History: type 2 diabetes")
                .contains("Medications: metformin")
                .endsWith("Allergies: penicillin");
    }
}
