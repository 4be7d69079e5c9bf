package com.lawgraph.exception;

public class DictionaryLoadException extends CitationException {

    public DictionaryLoadException(String message) {
        super(message);
    }

    public DictionaryLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
