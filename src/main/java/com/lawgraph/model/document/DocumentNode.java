package com.lawgraph.model.document;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Stream;

/**
 * A node of the parsed statute tree: a structural container or an article.
 * Children are kept in document order and never re-sorted.
 */
@Getter
public abstract class DocumentNode {

    private final NodeType type;
    private final String title;
    private final String rawNumeral;
    private final int number;
    private final DivisionTag division;

    private final List<DocumentNode> children = new ArrayList<>();

    protected DocumentNode(NodeType type, String title, String rawNumeral, int number, DivisionTag division) {
        this.type = type;
        this.title = title;
        this.rawNumeral = rawNumeral;
        this.number = number;
        this.division = division;
    }

    public void addChild(DocumentNode child) {
        children.add(child);
    }

    public List<DocumentNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    /**
     * Articles below this node, depth first, in document order.
     */
    public Stream<Article> articles() {
        if (this instanceof Article article) {
            return Stream.of(article);
        }
        return children.stream().flatMap(DocumentNode::articles);
    }
}
