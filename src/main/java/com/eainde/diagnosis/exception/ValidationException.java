package com.eainde.diagnosis.exception;

import java.util.List;

/**
 * Patient data outside clinical range. Carries every violation, not just the first.
 */
public class ValidationException extends DiagnosisException {

    private final List<String> violations;

    public ValidationException(List<String> violations) {
        super("Patient record failed validation: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
