package com.lawgraph.model.citation;

import com.lawgraph.model.document.ArticleNumber;
import lombok.Builder;
import lombok.Value;

/**
 * Resolved target of a citation. Fields are null where the citation does not
 * name that level; {@code scope} tells how to read them.
 */
@Value
@Builder(toBuilder = true)
public class CitationTarget {

    private static final CitationTarget UNRESOLVED = CitationTarget.builder()
            .scope(TargetScope.UNRESOLVED)
            .build();

    String lawId;

    boolean supplementary;

    ArticleNumber article;

    Integer paragraph;

    Integer item;

    /**
     * Structure path such as "part-2/chapter-3", only for structural targets.
     */
    String structurePath;

    TargetScope scope;

    public static CitationTarget unresolved() {
        return UNRESOLVED;
    }

    public static CitationTarget article(String lawId, ArticleNumber article, Integer paragraph, Integer item) {
        return CitationTarget.builder()
                .lawId(lawId)
                .article(article)
                .paragraph(paragraph)
                .item(item)
                .scope(article == null ? TargetScope.LAW : TargetScope.EXACT)
                .build();
    }

    public static CitationTarget law(String lawId) {
        return CitationTarget.builder()
                .lawId(lawId)
                .scope(TargetScope.LAW)
                .build();
    }

    public boolean isResolved() {
        return scope != TargetScope.UNRESOLVED;
    }
}
