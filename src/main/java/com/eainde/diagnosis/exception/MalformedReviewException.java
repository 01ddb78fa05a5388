package com.eainde.diagnosis.exception;

/**
 * The reviewer answered, but nothing usable could be extracted from the payload.
 * Not retried.
 */
public class MalformedReviewException extends DiagnosisException {

    public MalformedReviewException(String message) {
        super(message);
    }

    public MalformedReviewException(String message, Throwable cause) {
        super(message, cause);
    }
}
