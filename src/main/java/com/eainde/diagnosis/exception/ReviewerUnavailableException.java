package com.eainde.diagnosis.exception;

/**
 * The clinical reviewer could not be reached or kept failing. Never leaves the
 * reviewer adapter: it is converted to an empty result there.
 */
public class ReviewerUnavailableException extends DiagnosisException {

    public ReviewerUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
