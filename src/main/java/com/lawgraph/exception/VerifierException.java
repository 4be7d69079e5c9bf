package com.lawgraph.exception;

/**
 * The verifier model could not be reached or gave an unusable answer.
 */
public class VerifierException extends CitationException {

    public VerifierException(String message) {
        super(message);
    }

    public VerifierException(String message, Throwable cause) {
        super(message, cause);
    }
}
