package com.lawgraph.model.document;

public enum DivisionKind {
    MAIN_BODY("main-body"),
    SUPPLEMENTARY_PROVISIONS("supplementary-provisions");

    private final String label;

    DivisionKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
