package com.eainde.diagnosis.reviewer;

import com.eainde.diagnosis.model.PatientRecord;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * Renders the patient block shared by the review and treatment prompts.
 * Only data from the record goes in; list sections are omitted when empty.
 */
public class PatientContextFormatter {

    public String format(PatientRecord record) {
        List<String> lines = new ArrayList<>();
        lines.add("Age: " + number(record.getAge()) + " years");
        lines.add("Gender: " + (record.getGender() == null ? "unknown"
                : record.getGender().name().toLowerCase(Locale.ROOT)));
        lines.add("Temperature: " + number(record.getTemperature()) + "°C");
        lines.add("Heart Rate: " + number(record.getHeartRate()) + " bpm");
        lines.add("Blood Pressure: " + number(record.getSystolicBp()) + "/"
                + number(record.getDiastolicBp()) + " mmHg");
        lines.add("Respiratory Rate: " + number(record.getRespiratoryRate()) + " /min");
        lines.add("Oxygen Saturation: " + number(record.getOxygenSaturation()) + "%");
        lines.add("Pain Score: " + number(record.getPainScore()) + "/10");

        addIfPresent(lines, "Symptoms", record.getSymptoms());
        addIfPresent(lines, "Medical History", record.getMedicalHistory());
        addIfPresent(lines, "Medications", record.getMedications());
        addIfPresent(lines, "Allergies", record.getAllergies());
        return String.join("\n", lines);
    }

    private static void addIfPresent(List<String> lines, String title, Collection<String> values) {
        if (values != null && !values.isEmpty()) {
            lines.add(title + ": " + String.join(", ", values));
        }
    }

    private static String number(double v) {
        return v == Math.rint(v) && !Double.isInfinite(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
