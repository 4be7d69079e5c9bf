package com.lawgraph.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.lawgraph.dto.internal.ExtractionTiming;
import com.lawgraph.model.ExtractionResult;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationEdge;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExtractionResponse {

    // ================= LAW =================
    private String lawId;

    private String lawTitle;

    private String lawNum;

    private Integer articleCount;

    // ================= GRAPH =================
    private Integer edgeCount;

    private List<CitationEdge> edges;

    /**
     * Full citations, only when requested.
     */
    private List<Citation> citations;

    private List<ParseWarning> warnings;

    // ================= RUN =================
    private ExtractionTiming timing;

    private String error;

    public static ExtractionResponse from(ExtractionResult result, boolean includeCitations) {
        return ExtractionResponse.builder()
                .lawId(result.getLawId())
                .lawTitle(result.getLawTitle())
                .lawNum(result.getLawNum())
                .articleCount(result.getArticleCount())
                .edgeCount(result.getEdges().size())
                .edges(result.getEdges())
                .citations(includeCitations ? result.getCitations() : null)
                .warnings(result.getWarnings())
                .timing(result.getTiming())
                .error(result.getError())
                .build();
    }
}
