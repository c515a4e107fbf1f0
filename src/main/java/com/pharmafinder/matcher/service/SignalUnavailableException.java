package com.pharmafinder.matcher.service;

/**
 * An optional signal source (embedding or LLM provider) is not configured, timed out,
 * was cancelled or failed. Strategies convert it into a skipped outcome.
 */
public class SignalUnavailableException extends RuntimeException {

    public SignalUnavailableException(String message) {
        super(message);
    }

    public SignalUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
