package com.ledgermatch.verifier;

/**
 * Thrown when a verification request fails (HTTP, timeout, or an unusable response).
 */
public class VerifierException extends RuntimeException {

    public VerifierException(String message) {
        super(message);
    }

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
