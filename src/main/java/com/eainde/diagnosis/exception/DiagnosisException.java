package com.eainde.diagnosis.exception;

/**
 * Base type for failures raised inside the diagnosis core.
 */
public class DiagnosisException extends RuntimeException {

    public DiagnosisException(String message) {
        super(message);
    }

    public DiagnosisException(String message, Throwable cause) {
        super(message, cause);
    }
}
