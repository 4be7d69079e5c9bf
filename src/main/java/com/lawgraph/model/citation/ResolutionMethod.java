package com.lawgraph.model.citation;

/**
 * How a citation target was obtained. Precedence breaks ties when
 * overlapping citations have equal span length: higher wins.
 */
public enum ResolutionMethod {
    DIRECT_PATTERN("direct-pattern", 6),
    DICTIONARY("dictionary", 5),
    RANGE_EXPANSION("range-expansion", 4),
    CONTEXT("context", 3),
    VERIFIER("verifier", 2),
    UNRESOLVED("unresolved", 1);

    private final String label;
    private final int precedence;

    ResolutionMethod(String label, int precedence) {
        this.label = label;
        this.precedence = precedence;
    }

    public String label() {
        return label;
    }

    public int precedence() {
        return precedence;
    }
}
