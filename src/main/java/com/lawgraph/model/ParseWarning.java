package com.lawgraph.model;

/**
 * A degraded outcome recorded during parsing or extraction. Warnings are
 * data, not failures: processing always continues.
 */
public record ParseWarning(WarningType type, String message, String location) {

    public static ParseWarning of(WarningType type, String message, String location) {
        return new ParseWarning(type, message, location);
    }
}
