package com.lawgraph.service.matcher;

import com.lawgraph.model.citation.Span;

/**
 * A defining phrase such as 民法（…以下「新法」という。）: {@code term} stands for {@code referent}
 * from {@code span.end()} onward.
 */
public record AliasDefinitionMatch(String term, String referent, Span span) {
}
