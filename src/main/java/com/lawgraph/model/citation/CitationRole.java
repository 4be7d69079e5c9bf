package com.lawgraph.model.citation;

/**
 * Semantic role of a citation inside its sentence.
 */
public enum CitationRole {
    REFERENCE("reference"),
    APPLICATION("application"),
    READ_AS("read-as"),
    EXCEPTION("exception");

    private final String label;

    CitationRole(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
