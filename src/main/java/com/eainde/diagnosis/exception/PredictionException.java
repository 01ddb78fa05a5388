package com.eainde.diagnosis.exception;

public class PredictionException extends DiagnosisException {

    public PredictionException(String message) {
        super(message);
    }

    public PredictionException(String message, Throwable cause) {
        super(message, cause);
    }
}
