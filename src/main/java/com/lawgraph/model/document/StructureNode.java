package com.lawgraph.model.document;

/**
 * Part, chapter, section, subsection or division (編 章 節 款 目).
 */
public class StructureNode extends DocumentNode {

    public StructureNode(NodeType type, String title, String rawNumeral, int number, DivisionTag division) {
        super(type, title, rawNumeral, number, division);
        if (!type.isStructural()) {
            throw new IllegalArgumentException("Not a structural level: " + type);
        }
    }

    /**
     * Path segment such as "chapter-3".
     */
    public String pathSegment() {
        return getType().pathName() + "-" + getNumber();
    }

    @Override
    public String toString() {
        return pathSegment();
    }
}
