package com.lawgraph.model.citation;

public enum CitationKind {
    INTERNAL("internal"),
    EXTERNAL("external"),
    EXTERNAL_UNRESOLVED("external-unresolved"),
    RELATIVE_ARTICLE("relative-article"),
    RELATIVE_PARAGRAPH("relative-paragraph"),
    RELATIVE_ITEM("relative-item"),
    STRUCTURAL("structural"),
    RANGE("range"),
    COMPOUND("compound"),
    CONTEXTUAL("contextual");

    private final String label;

    CitationKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
