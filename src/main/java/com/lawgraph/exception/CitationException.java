package com.lawgraph.exception;

/**
 * Infrastructure failure around the engine: an unreadable dictionary, a
 * verifier call that errored, a document the batch could not process.
 *
 * <p>Degraded extraction (an unresolved law name, a broken article title, an
 * oversized range) is never thrown; it is reported as a {@code ParseWarning}
 * on the result. Callers that catch this type record it per document and carry
 * on with the rest of the batch.
 */
public class CitationException extends RuntimeException {

    public CitationException(String message) {
        super(message);
    }

    public CitationException(String message, Throwable cause) {
        super(message, cause);
    }
}
