package com.lawgraph.service.matcher;

import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.util.KanjiNumerals;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Article / paragraph / item coordinates as written in a citation.
 * Any level may be absent; at least one is present.
 */
public record Locator(boolean supplementary, ArticleNumber article, Integer paragraph, Integer item) {

    static final String NUM = "[〇一二三四五六七八九十百千万０-９0-9]+";

    /**
     * A locator in text: 附則第三条の二第一項第二号, 第二項第三号, 第五号.
     */
    static final String TEXT = "(?:附則)?(?:第" + NUM + "条(?![例件約])(?:の" + NUM + "+(?!部))*(?:第" + NUM + "項)?(?:第" + NUM + "号)?"
            + "|第" + NUM + "項(?:第" + NUM + "号)?"
            + "|第" + NUM + "号)";

    private static final Pattern PARTS = Pattern.compile(
            "^(附則)?(?:第(" + NUM + ")条((?:の" + NUM + ")*))?(?:第(" + NUM + ")項)?(?:第(" + NUM + ")号)?$");

    public static Locator parse(String text) {
        Matcher m = PARTS.matcher(text);
        if (!m.matches()) {
            throw new IllegalArgumentException("Not a locator: " + text);
        }
        ArticleNumber article = m.group(2) != null ? ArticleNumber.fromText(m.group(2), m.group(3)) : null;
        Integer paragraph = m.group(4) != null ? KanjiNumerals.parse(m.group(4)) : null;
        Integer item = m.group(5) != null ? KanjiNumerals.parse(m.group(5)) : null;
        return new Locator(m.group(1) != null, article, paragraph, item);
    }

    public static Locator article(ArticleNumber article) {
        return new Locator(false, article, null, null);
    }

    public boolean hasArticle() {
        return article != null;
    }

    /**
     * False when a written numeral did not parse to a positive number.
     */
    public boolean isValid() {
        return (article == null || article.isValid())
                && (paragraph == null || paragraph > 0)
                && (item == null || item > 0);
    }
}
