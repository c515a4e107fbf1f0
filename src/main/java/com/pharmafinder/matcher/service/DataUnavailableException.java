package com.pharmafinder.matcher.service;

/**
 * Raised when a gazetteer generation cannot be built because the reference data is
 * missing, unreadable or empty.
 */
public class DataUnavailableException extends RuntimeException {

    public DataUnavailableException(String message) {
        super(message);
    }

    public DataUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
