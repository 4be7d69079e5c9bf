package com.lawgraph.model;

public enum WarningType {
    STRUCTURAL_PARSE,
    NUMERAL_FALLBACK,
    IDENTITY_RESOLUTION_MISS,
    VERIFIER_FAILURE
}
