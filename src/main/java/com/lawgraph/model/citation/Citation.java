package com.lawgraph.model.citation;

import lombok.Builder;
import lombok.Value;

/**
 * A detected reference from one point in a law to another location.
 * Immutable once emitted; corrections are made with {@code toBuilder()} before emission.
 */
@Value
@Builder(toBuilder = true)
public class Citation {

    SourceLocation source;

    String text;

    Span span;

    CitationKind kind;

    CitationTarget target;

    /**
     * End of an unexpanded range; null for every other citation.
     */
    CitationTarget rangeEnd;

    double confidence;

    ResolutionMethod method;

    Certainty certainty;

    @Builder.Default
    CitationRole role = CitationRole.REFERENCE;

    /**
     * Citations expanded from one range share a group and are deduplicated as one unit.
     */
    int groupId;

    /**
     * Sequence of the anchor citation for compound siblings, null otherwise.
     */
    Integer compoundFamily;

    public boolean isResolved() {
        return target != null && target.isResolved();
    }
}
