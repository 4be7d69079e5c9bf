package com.lawgraph.model.document;

/**
 * Which body of the law a node belongs to. Supplementary provisions carry
 * an index only when the law has more than one supplementary block.
 */
public record DivisionTag(DivisionKind kind, Integer index) {

    private static final DivisionTag MAIN = new DivisionTag(DivisionKind.MAIN_BODY, null);

    public static DivisionTag main() {
        return MAIN;
    }

    public static DivisionTag supplementary(Integer index) {
        return new DivisionTag(DivisionKind.SUPPLEMENTARY_PROVISIONS, index);
    }

    public boolean isSupplementary() {
        return kind == DivisionKind.SUPPLEMENTARY_PROVISIONS;
    }

    @Override
    public String toString() {
        return index == null ? kind.label() : kind.label() + "-" + index;
    }
}
