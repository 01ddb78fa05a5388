package com.eainde.diagnosis.exception;

/**
 * Model artifacts are missing or unreadable. Checked, so that startup code decides
 * how to degrade instead of letting the process die.
 */
public class ModelStoreException extends Exception {

    public ModelStoreException(String message) {
        super(message);
    }

    public ModelStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
