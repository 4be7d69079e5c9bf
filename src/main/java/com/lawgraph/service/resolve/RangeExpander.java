package com.lawgraph.service.resolve;

import com.lawgraph.config.LawGraphConfig;
import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationKind;
import com.lawgraph.model.citation.CitationTarget;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.document.ArticleNumber;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Expands …から…まで citations into one citation per target, in ascending order.
 *
 * <p>Article ranges enumerate base numbers and, at the ends, branch numbers:
 * 第三十二条から第三十二条の五まで gives 32, 32-2, 32-3, 32-4, 32-5. A range that
 * goes backwards, or would exceed the configured size, becomes a single
 * unresolved citation. All siblings keep the range's span and group.
 */
@Slf4j
@Component
public class RangeExpander {

    private final int maxExpansion;

    public RangeExpander(LawGraphConfig config) {
        this.maxExpansion = config.getMaxRangeExpansion();
    }

    public List<Citation> expandAll(List<Citation> citations) {
        List<Citation> result = new ArrayList<>();
        for (Citation citation : citations) {
            result.addAll(expand(citation));
        }
        return result;
    }

    public List<Citation> expand(Citation citation) {
        if (citation.getRangeEnd() == null || !citation.isResolved()) {
            return List.of(citation);
        }
        CitationTarget start = citation.getTarget();
        CitationTarget end = citation.getRangeEnd();

        List<CitationTarget> targets;
        if (start.equals(end)) {
            targets = List.of(start);
        } else if (start.getArticle() != null && end.getArticle() != null
                && (!start.getArticle().equals(end.getArticle()) || start.isSupplementary() != end.isSupplementary())) {
            targets = expandArticles(start, end);
        } else if (!Objects.equals(start.getParagraph(), end.getParagraph())) {
            targets = expandParagraphs(start, end);
        } else {
            targets = expandItems(start, end);
        }

        if (targets == null) {
            log.debug("Range '{}' does not ascend, left unresolved", citation.getText());
            return List.of(unresolved(citation));
        }
        if (targets.size() > maxExpansion) {
            log.warn("Range '{}' expands to {} targets (limit {}), left unresolved",
                    citation.getText(), targets.size(), maxExpansion);
            return List.of(unresolved(citation));
        }

        List<Citation> expanded = new ArrayList<>(targets.size());
        for (CitationTarget target : targets) {
            expanded.add(citation.toBuilder()
                    .target(target)
                    .rangeEnd(null)
                    .method(ResolutionMethod.RANGE_EXPANSION)
                    .certainty(Certainty.EXACT)
                    .build());
        }
        return expanded;
    }

    // ============================================================
    // Levels
    // ============================================================

    /**
     * Null when the range runs backwards.
     */
    private List<CitationTarget> expandArticles(CitationTarget start, CitationTarget end) {
        if (start.isSupplementary() != end.isSupplementary()) {
            return null;
        }
        List<ArticleNumber> articles = articleSequence(start.getArticle(), end.getArticle());
        if (articles == null) {
            return null;
        }
        List<CitationTarget> targets = new ArrayList<>(articles.size());
        for (int i = 0; i < articles.size(); i++) {
            boolean first = i == 0;
            boolean last = i == articles.size() - 1;
            // paragraph and item qualifiers only bound the first and last article
            targets.add(start.toBuilder()
                    .article(articles.get(i))
                    .paragraph(first ? start.getParagraph() : last ? end.getParagraph() : null)
                    .item(first ? start.getItem() : last ? end.getItem() : null)
                    .build());
        }
        return targets;
    }

    private List<CitationTarget> expandParagraphs(CitationTarget start, CitationTarget end) {
        if (start.getParagraph() == null || end.getParagraph() == null || end.getParagraph() < start.getParagraph()) {
            return null;
        }
        List<CitationTarget> targets = new ArrayList<>();
        for (int p = start.getParagraph(); p <= end.getParagraph() && targets.size() <= maxExpansion; p++) {
            boolean first = p == start.getParagraph();
            boolean last = p == end.getParagraph();
            targets.add(start.toBuilder()
                    .paragraph(p)
                    .item(first ? start.getItem() : last ? end.getItem() : null)
                    .build());
        }
        return targets;
    }

    private List<CitationTarget> expandItems(CitationTarget start, CitationTarget end) {
        if (start.getItem() == null || end.getItem() == null || end.getItem() < start.getItem()) {
            return null;
        }
        List<CitationTarget> targets = new ArrayList<>();
        for (int n = start.getItem(); n <= end.getItem() && targets.size() <= maxExpansion; n++) {
            targets.add(start.toBuilder().item(n).build());
        }
        return targets;
    }

    /**
     * Article numbers from {@code start} to {@code end} inclusive, or null when
     * {@code end} comes before {@code start}.
     */
    List<ArticleNumber> articleSequence(ArticleNumber start, ArticleNumber end) {
        if (end.compareTo(start) < 0) {
            return null;
        }
        List<ArticleNumber> sequence = new ArrayList<>();
        if (start.base() == end.base()) {
            int from = start.hasBranch() ? start.firstBranch() : 1;
            int to = end.hasBranch() ? end.firstBranch() : 1;
            for (int b = from; b <= to && sequence.size() <= maxExpansion; b++) {
                sequence.add(b == 1 ? start.baseArticle() : start.withBranch(b));
            }
            return sequence;
        }

        sequence.add(start);
        for (int base = start.base() + 1; base <= end.base() && sequence.size() <= maxExpansion; base++) {
            sequence.add(ArticleNumber.of(base));
        }
        if (end.hasBranch()) {
            for (int b = 2; b <= end.firstBranch() && sequence.size() <= maxExpansion; b++) {
                sequence.add(end.withBranch(b));
            }
        }
        return sequence;
    }

    private static Citation unresolved(Citation citation) {
        return citation.toBuilder()
                .kind(CitationKind.RANGE)
                .target(CitationTarget.unresolved())
                .rangeEnd(null)
                .method(ResolutionMethod.UNRESOLVED)
                .certainty(Certainty.UNSPECIFIABLE)
                .build();
    }
}
