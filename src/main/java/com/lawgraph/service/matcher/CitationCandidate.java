package com.lawgraph.service.matcher;

import com.lawgraph.model.document.NodeType;
import com.lawgraph.service.resolve.LawMatch;

import java.util.List;

/**
 * A raw citation found by the matcher, before the context tracker resolves it.
 * Each variant carries exactly the fields its pattern family produces.
 */
public sealed interface CitationCandidate {

    /**
     * 第N条 and friends, optionally prefixed with この法律 / 本法.
     */
    record ArticleCandidate(Locator locator, boolean explicitSelf) implements CitationCandidate {
    }

    /**
     * Another law by name. {@code match} is null when the dictionary does not know the name.
     */
    record ExternalCandidate(String lawName, LawMatch match, String promulgation, Locator locator)
            implements CitationCandidate {
    }

    record RelativeCandidate(RelativeUnit unit, RelativeDirection direction, int distance,
                             Integer paragraph, Integer item) implements CitationCandidate {
    }

    /**
     * 第二編第三章 style absolute structure reference.
     */
    record StructuralCandidate(List<StructureStep> steps) implements CitationCandidate {

        public StructuralCandidate {
            steps = List.copyOf(steps);
        }
    }

    /**
     * 前章, 次節, この章.
     */
    record RelativeStructuralCandidate(NodeType level, RelativeDirection direction) implements CitationCandidate {
    }

    /**
     * …から…まで. {@code law} is set when the range is prefixed with another law's name,
     * {@code relativeArticle} when it is prefixed with 前条 and the like.
     */
    record RangeCandidate(Locator start, Locator end, ExternalCandidate law, boolean sameLaw,
                          RelativeCandidate relativeArticle) implements CitationCandidate {
    }

    record ContextualCandidate(ContextualForm form, String term, Locator locator) implements CitationCandidate {
    }

    /**
     * Bare locator joined to the previous citation by a conjunction; inherits its anchor's law and article.
     */
    record ContinuationCandidate(Locator locator, int anchorIndex) implements CitationCandidate {
    }

    record StructureStep(NodeType type, int number) {
    }

    enum RelativeUnit {
        ARTICLE,
        PARAGRAPH,
        ITEM
    }

    enum RelativeDirection {
        PRECEDING,
        FOLLOWING,
        SAME,
        ALL_PRECEDING
    }

    enum ContextualForm {
        /** 同法 */
        SAME_LAW,
        /** a term defined by 以下「X」という */
        ALIAS,
        /** 他の法令 */
        OTHER_LAWS,
        /** 別に法律で定める */
        BY_LAW,
        /** 政令で定める */
        CABINET_ORDER,
        /** 省令で定める */
        MINISTERIAL_ORDINANCE;

        public boolean isUnspecifiable() {
            return this != SAME_LAW && this != ALIAS;
        }
    }
}
