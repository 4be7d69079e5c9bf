package com.lawgraph.model.document;

import lombok.Getter;

import java.util.List;

@Getter
public class Article extends DocumentNode {

    private final ArticleNumber articleNumber;
    private final String caption;
    private final List<Paragraph> paragraphs;
    private final boolean deleted;

    public Article(ArticleNumber articleNumber, String title, String rawNumeral, String caption,
                   List<Paragraph> paragraphs, boolean deleted, DivisionTag division) {
        super(NodeType.ARTICLE, title, rawNumeral, articleNumber.base(), division);
        this.articleNumber = articleNumber;
        this.caption = caption;
        this.paragraphs = List.copyOf(paragraphs);
        this.deleted = deleted;
    }

    public int paragraphCount() {
        return paragraphs.size();
    }

    @Override
    public String toString() {
        return articleNumber.display();
    }
}
