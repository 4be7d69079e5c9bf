package com.lawgraph.model.citation;

import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.DivisionTag;

/**
 * Where a citation was found.
 */
public record SourceLocation(String lawId, DivisionTag division, ArticleNumber article, int paragraph, Integer item) {

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(lawId).append(' ');
        if (division != null && division.isSupplementary()) {
            sb.append(division).append(' ');
        }
        sb.append(article).append('(').append(paragraph);
        if (item != null) {
            sb.append('-').append(item);
        }
        return sb.append(')').toString();
    }
}
