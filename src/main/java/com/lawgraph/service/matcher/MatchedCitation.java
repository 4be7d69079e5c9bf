package com.lawgraph.service.matcher;

import com.lawgraph.model.citation.CitationRole;
import com.lawgraph.model.citation.Span;

/**
 * A candidate with its position in the scanned text. {@code index} is the
 * candidate's place in source order, referenced by continuations.
 */
public record MatchedCitation(int index, CitationCandidate candidate, String text, Span span, CitationRole role) {
}
