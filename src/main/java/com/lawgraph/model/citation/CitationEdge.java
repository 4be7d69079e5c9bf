package com.lawgraph.model.citation;

import lombok.Builder;
import lombok.Value;

/**
 * Directed edge handed to the graph store.
 */
@Value
@Builder
public class CitationEdge {

    String sourceNodeId;

    String targetNodeId;

    String sourceLawId;

    String sourceArticle;

    Integer sourceParagraph;

    Integer sourceItem;

    String targetLawId;

    String targetArticle;

    Integer targetParagraph;

    Integer targetItem;

    String targetScope;

    String kind;

    double confidence;

    String method;

    String role;

    String rawText;

    Integer compoundFamily;
}
