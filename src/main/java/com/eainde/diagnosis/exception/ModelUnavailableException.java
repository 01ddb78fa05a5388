package com.eainde.diagnosis.exception;

public class ModelUnavailableException extends DiagnosisException {

    public ModelUnavailableException(String message) {
        super(message);
    }
}
