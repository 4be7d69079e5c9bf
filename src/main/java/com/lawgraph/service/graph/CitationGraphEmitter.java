package com.lawgraph.service.graph;

import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationEdge;
import com.lawgraph.model.citation.CitationTarget;
import com.lawgraph.model.citation.SourceLocation;
import com.lawgraph.model.citation.TargetScope;
import com.lawgraph.model.document.ArticleNumber;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Turns final citations into graph edges, one edge per citation.
 *
 * <p>Node ids: {@code lawId} for a whole law, {@code lawId#art:32-2} for an
 * article ({@code #suppl:} in supplementary provisions),
 * {@code lawId#chapter-3} style paths for structure, and
 * {@code unresolved:<text>} for targets that could not be resolved.
 */
@Service
public class CitationGraphEmitter {

    public List<CitationEdge> emit(List<Citation> citations) {
        return citations.stream()
                .map(this::toEdge)
                .collect(Collectors.toList());
    }

    public CitationEdge toEdge(Citation citation) {
        SourceLocation source = citation.getSource();
        CitationTarget target = citation.getTarget();
        boolean resolved = target != null && target.isResolved();

        return CitationEdge.builder()
                .sourceNodeId(sourceNodeId(source))
                .targetNodeId(resolved ? targetNodeId(target) : "unresolved:" + citation.getText())
                .sourceLawId(source.lawId())
                .sourceArticle(source.article() != null ? source.article().key() : null)
                .sourceParagraph(source.paragraph())
                .sourceItem(source.item())
                .targetLawId(resolved ? target.getLawId() : null)
                .targetArticle(resolved && target.getArticle() != null ? target.getArticle().key() : null)
                .targetParagraph(resolved ? target.getParagraph() : null)
                .targetItem(resolved ? target.getItem() : null)
                .targetScope((target != null ? target.getScope() : TargetScope.UNRESOLVED).name())
                .kind(citation.getKind().label())
                .confidence(citation.getConfidence())
                .method(citation.getMethod().label())
                .role(citation.getRole().label())
                .rawText(citation.getText())
                .compoundFamily(citation.getCompoundFamily())
                .build();
    }

    static String sourceNodeId(SourceLocation source) {
        boolean supplementary = source.division() != null && source.division().isSupplementary();
        return articleNodeId(source.lawId(), source.article(), supplementary);
    }

    static String targetNodeId(CitationTarget target) {
        if (target.getScope() == TargetScope.STRUCTURE) {
            return target.getLawId() + "#" + target.getStructurePath();
        }
        if (target.getArticle() == null) {
            return target.getLawId();
        }
        return articleNodeId(target.getLawId(), target.getArticle(), target.isSupplementary());
    }

    private static String articleNodeId(String lawId, ArticleNumber article, boolean supplementary) {
        if (article == null) {
            return lawId;
        }
        return lawId + (supplementary ? "#suppl:" : "#art:") + article.key();
    }
}
