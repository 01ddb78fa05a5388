package com.eainde.diagnosis.validation;

import com.eainde.diagnosis.exception.ValidationException;
import com.eainde.diagnosis.model.PatientRecord;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Re-checks the clinical ranges the intake layer is expected to enforce.
 * Collects every violation so the caller can report them all at once.
 */
@Component
public class PatientRecordValidator {

    public List<String> violations(PatientRecord record) {
        List<String> errors = new ArrayList<>();
        if (record == null) {
            errors.add("Patient record is required");
            return errors;
        }

        checkRange(errors, "Age", record.getAge(), 0, 120, "years");
        checkRange(errors, "Temperature", record.getTemperature(), 35, 43, "°C");
        checkRange(errors, "Heart rate", record.getHeartRate(), 40, 200, "bpm");
        checkRange(errors, "Systolic BP", record.getSystolicBp(), 70, 250, "mmHg");
        checkRange(errors, "Diastolic BP", record.getDiastolicBp(), 40, 150, "mmHg");
        checkRange(errors, "Respiratory rate", record.getRespiratoryRate(), 5, 40, "breaths/min");
        checkRange(errors, "Oxygen saturation", record.getOxygenSaturation(), 70, 100, "%");
        checkRange(errors, "Pain score", record.getPainScore(), 0, 10, "");

        if (record.getGender() == null) {
            errors.add("Gender is required (use UNKNOWN when not provided)");
        }
        return errors;
    }

    /**
     * @throws ValidationException listing every out-of-range field
     */
    public void validate(PatientRecord record) {
        List<String> errors = violations(record);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
    }

    private static void checkRange(List<String> errors, String field, double value,
                                   double min, double max, String unit) {
        if (Double.isNaN(value) || value < min || value > max) {
            String suffix = unit.isEmpty() ? "" : " " + unit;
            errors.add(String.format("%s must be between %s and %s%s (was %s)",
                    field, format(min), format(max), suffix, format(value)));
        }
    }

    private static String format(double v) {
        return v == Math.rint(v) && !Double.isInfinite(v) ? String.valueOf((long) v) : String.valueOf(v);
    }
}
