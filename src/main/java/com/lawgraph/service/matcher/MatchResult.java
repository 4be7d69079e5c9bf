package com.lawgraph.service.matcher;

import java.util.List;

public record MatchResult(List<MatchedCitation> citations) {

    public MatchResult {
        citations = List.copyOf(citations);
    }

    public static MatchResult empty() {
        return new MatchResult(List.of());
    }

    public boolean isEmpty() {
        return citations.isEmpty();
    }
}
