package com.lawgraph.model;

import com.lawgraph.dto.internal.ExtractionTiming;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationEdge;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Everything extracted from one law. Produced as a whole or not at all.
 */
@Value
@Builder
public class ExtractionResult {

    String lawId;

    String lawTitle;

    String lawNum;

    int articleCount;

    @Singular
    List<Citation> citations;

    @Singular
    List<CitationEdge> edges;

    @Singular
    List<ParseWarning> warnings;

    ExtractionTiming timing;

    /**
     * Set when the document could not be processed at all; edges are then empty.
     */
    String error;

    public boolean isFailed() {
        return error != null;
    }
}
