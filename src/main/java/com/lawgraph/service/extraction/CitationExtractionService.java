package com.lawgraph.service.extraction;

import com.lawgraph.config.LawGraphConfig;
import com.lawgraph.model.ExtractionResult;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationEdge;
import com.lawgraph.model.document.Article;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.Division;
import com.lawgraph.model.document.DivisionTag;
import com.lawgraph.model.document.Document;
import com.lawgraph.model.document.DocumentNode;
import com.lawgraph.model.document.Item;
import com.lawgraph.model.document.Paragraph;
import com.lawgraph.model.document.StructureNode;
import com.lawgraph.service.context.ContextTracker;
import com.lawgraph.service.data.DictionaryLoaderService;
import com.lawgraph.service.graph.CitationGraphEmitter;
import com.lawgraph.service.matcher.AliasDefinitionMatch;
import com.lawgraph.service.matcher.CitationPatternMatcher;
import com.lawgraph.service.matcher.MatchResult;
import com.lawgraph.service.monitoring.ExtractionTimer;
import com.lawgraph.service.parser.LawXmlParser;
import com.lawgraph.service.resolve.LawIdentityResolver;
import com.lawgraph.service.resolve.RangeExpander;
import com.lawgraph.service.scoring.CitationDeduplicator;
import com.lawgraph.service.scoring.ConfidenceScorer;
import com.lawgraph.service.verify.VerificationService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the citation pipeline over one law.
 *
 * <p>Text units (paragraph sentences and item sentences) are visited in
 * document order. Each unit goes through definition scanning, matching,
 * resolution, range expansion, deduplication, scoring and optional
 * verification before the next one starts, because resolution depends on
 * everything read before it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CitationExtractionService {

    private final LawXmlParser lawXmlParser;
    private final CitationPatternMatcher patternMatcher;
    private final RangeExpander rangeExpander;
    private final CitationDeduplicator deduplicator;
    private final ConfidenceScorer confidenceScorer;
    private final VerificationService verificationService;
    private final CitationGraphEmitter graphEmitter;
    private final DictionaryLoaderService dictionaryLoaderService;
    private final LawGraphConfig lawGraphConfig;

    /**
     * Parse e-Gov statute XML and extract its citations.
     */
    public ExtractionResult extractXml(String xml, String lawId) {
        ExtractionTimer timer = new ExtractionTimer();
        Document document = lawXmlParser.parse(xml);
        timer.mark("parse");
        return run(document, lawId, timer);
    }

    public ExtractionResult extract(Document document, String lawId) {
        return run(document, lawId, new ExtractionTimer());
    }

    /**
     * Extract from a free text fragment read as article 1, paragraph 1 of {@code lawId}.
     */
    public ExtractionResult extractText(String text, String lawId) {
        Division body = new Division(DivisionTag.main(), null, null);
        body.addChild(new Article(ArticleNumber.of(1), "第一条", "一", null,
                List.of(Paragraph.builder().number(1).implicit(true).text(text).build()),
                false, DivisionTag.main()));
        Document document = Document.builder().division(body).build();
        return extract(document, lawId);
    }

    // ============================================================
    // Document walk
    // ============================================================

    private ExtractionResult run(Document document, String lawId, ExtractionTimer timer) {
        LawIdentityResolver resolver = dictionaryLoaderService.getResolver();
        Run run = new Run(resolver, timer,
                new ContextTracker(lawId, resolver, lawGraphConfig.getRecentLawCapacity()));

        log.debug("Extracting citations from {} ({} articles)", lawId, document.articleCount());
        for (Division division : document.getDivisions()) {
            run.tracker.enterDivision(division.getTag(), division.articles());
            walk(division.getChildren(), new ArrayList<>(), run);
        }

        List<CitationEdge> edges = graphEmitter.emit(run.citations);
        timer.mark("emit");
        timer.end();

        List<ParseWarning> warnings = new ArrayList<>(document.getWarnings());
        warnings.addAll(run.tracker.warnings());
        warnings.addAll(run.verifierWarnings);

        log.debug("{}: {} citations, {} edges, {} warnings ({})",
                lawId, run.citations.size(), edges.size(), warnings.size(), timer.formatDisplay());

        return ExtractionResult.builder()
                .lawId(lawId)
                .lawTitle(document.getLawTitle())
                .lawNum(document.getLawNum())
                .articleCount(document.articleCount())
                .citations(run.citations)
                .edges(edges)
                .warnings(warnings)
                .timing(timer.toTiming())
                .build();
    }

    private void walk(List<DocumentNode> nodes, List<StructureNode> ancestry, Run run) {
        for (DocumentNode node : nodes) {
            if (node instanceof Article article) {
                visitArticle(article, ancestry, run);
            } else if (node instanceof StructureNode structure) {
                ancestry.add(structure);
                walk(structure.getChildren(), ancestry, run);
                ancestry.remove(ancestry.size() - 1);
            }
        }
    }

    private void visitArticle(Article article, List<StructureNode> ancestry, Run run) {
        run.tracker.enterArticle(article, ancestry);
        if (article.isDeleted()) {
            return;
        }
        for (Paragraph paragraph : article.getParagraphs()) {
            run.tracker.enterParagraph(paragraph.getNumber());
            processUnit(paragraph.getText(), run);
            for (Item item : paragraph.getItems()) {
                run.tracker.enterItem(item.getNumber());
                processUnit(item.getText(), run);
                visitSubitems(item.getChildren(), run);
            }
        }
    }

    /**
     * Subitems are read as part of their item: 前号 inside a subitem still
     * refers to the item before the enclosing one.
     */
    private void visitSubitems(List<Item> subitems, Run run) {
        for (Item subitem : subitems) {
            processUnit(subitem.getText(), run);
            visitSubitems(subitem.getChildren(), run);
        }
    }

    // ============================================================
    // Per text unit
    // ============================================================

    private void processUnit(String text, Run run) {
        if (text == null || text.isEmpty()) {
            return;
        }
        ExtractionTimer timer = run.timer;
        int base = run.tracker.offset();

        List<AliasDefinitionMatch> definitions = patternMatcher.findDefinitions(text, run.resolver);
        run.tracker.registerDefinitions(definitions, base);
        MatchResult matched = patternMatcher.match(text, run.resolver, run.tracker.aliasTerms());
        timer.mark("match");

        if (!matched.isEmpty()) {
            List<Citation> citations = run.tracker.resolve(matched, base);
            timer.mark("resolve");

            citations = rangeExpander.expandAll(citations);
            timer.mark("expand");

            citations = deduplicator.deduplicate(citations);
            timer.mark("dedup");

            citations = confidenceScorer.score(citations);
            timer.mark("score");

            citations = verificationService.verify(citations, text, run.verifierWarnings::add);
            timer.mark("verify");

            run.citations.addAll(citations);
        }

        // one separator between units keeps offsets of adjacent units apart
        run.tracker.advance(text.length() + 1);
    }

    /**
     * State of one extraction. Never shared between documents.
     */
    private static final class Run {

        final LawIdentityResolver resolver;
        final ExtractionTimer timer;
        final ContextTracker tracker;
        final List<Citation> citations = new ArrayList<>();
        final List<ParseWarning> verifierWarnings = new ArrayList<>();

        Run(LawIdentityResolver resolver, ExtractionTimer timer, ContextTracker tracker) {
            this.resolver = resolver;
            this.timer = timer;
            this.tracker = tracker;
        }
    }
}
