package com.lawgraph.model.document;

/**
 * Structural levels of a statute, outermost first.
 */
public enum NodeType {

    PART("Part", "編", "part"),
    CHAPTER("Chapter", "章", "chapter"),
    SECTION("Section", "節", "section"),
    SUBSECTION("Subsection", "款", "subsection"),
    SUBDIVISION("Division", "目", "division"),
    ARTICLE("Article", "条", "article");

    private final String elementName;
    private final String suffix;
    private final String pathName;

    NodeType(String elementName, String suffix, String pathName) {
        this.elementName = elementName;
        this.suffix = suffix;
        this.pathName = pathName;
    }

    public String elementName() {
        return elementName;
    }

    public String suffix() {
        return suffix;
    }

    public String pathName() {
        return pathName;
    }

    public boolean isStructural() {
        return this != ARTICLE;
    }

    public static NodeType fromElementName(String name) {
        for (NodeType type : values()) {
            if (type.elementName.equals(name)) {
                return type;
            }
        }
        return null;
    }

    public static NodeType fromSuffix(char suffix) {
        for (NodeType type : values()) {
            if (type.isStructural() && type.suffix.charAt(0) == suffix) {
                return type;
            }
        }
        return null;
    }
}
