package com.lawgraph.service.context;

import com.lawgraph.model.citation.SourceLocation;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.DivisionTag;
import lombok.Getter;

/**
 * Current reading position inside one law. Only moves forward: divisions and
 * articles must be entered in document order, paragraphs and items only
 * inside an article.
 */
@Getter
public class ParsePosition {

    private final String lawId;
    private DivisionTag division;
    private int divisionIndex = -1;
    private ArticleNumber article;
    private int articleIndex = -1;
    private int paragraph;
    private Integer item;

    public ParsePosition(String lawId) {
        this.lawId = lawId;
    }

    void enterDivision(DivisionTag tag) {
        divisionIndex++;
        division = tag;
        article = null;
        articleIndex = -1;
        paragraph = 0;
        item = null;
    }

    void enterArticle(ArticleNumber number, int index) {
        if (division == null) {
            throw new IllegalStateException("Article " + number + " entered outside a division");
        }
        if (index <= articleIndex) {
            throw new IllegalStateException("Article " + number + " entered out of order (index "
                    + index + " after " + articleIndex + ")");
        }
        article = number;
        articleIndex = index;
        paragraph = 1;
        item = null;
    }

    void enterParagraph(int number) {
        requireArticle();
        paragraph = number;
        item = null;
    }

    void enterItem(Integer number) {
        requireArticle();
        item = number;
    }

    public boolean isInSupplementaryProvisions() {
        return division != null && division.isSupplementary();
    }

    public SourceLocation toSourceLocation() {
        return new SourceLocation(lawId, division, article, paragraph, item);
    }

    private void requireArticle() {
        if (article == null) {
            throw new IllegalStateException("No article entered");
        }
    }

    @Override
    public String toString() {
        return toSourceLocation().toString();
    }
}
