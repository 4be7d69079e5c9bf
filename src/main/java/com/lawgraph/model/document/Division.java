package com.lawgraph.model.document;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Main body or one supplementary-provisions block, numbered independently.
 */
@Getter
public class Division {

    private final DivisionTag tag;
    private final String label;
    private final String amendLawNum;
    private final List<DocumentNode> children = new ArrayList<>();

    public Division(DivisionTag tag, String label, String amendLawNum) {
        this.tag = tag;
        this.label = label;
        this.amendLawNum = amendLawNum;
    }

    public void addChild(DocumentNode child) {
        children.add(child);
    }

    public List<DocumentNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Article> articles() {
        return children.stream()
                .flatMap(DocumentNode::articles)
                .collect(Collectors.toList());
    }
}
