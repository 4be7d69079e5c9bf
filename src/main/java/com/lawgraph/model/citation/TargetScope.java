package com.lawgraph.model.citation;

public enum TargetScope {
    EXACT,
    ALL_PRECEDING_PARAGRAPHS,
    ALL_PRECEDING_ITEMS,
    STRUCTURE,
    LAW,
    UNRESOLVED
}
