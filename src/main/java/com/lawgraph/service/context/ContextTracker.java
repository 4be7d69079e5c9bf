package com.lawgraph.service.context;

import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationKind;
import com.lawgraph.model.citation.CitationTarget;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.citation.TargetScope;
import com.lawgraph.model.document.Article;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.DivisionTag;
import com.lawgraph.model.document.NodeType;
import com.lawgraph.model.document.StructureNode;
import com.lawgraph.service.matcher.AliasDefinitionMatch;
import com.lawgraph.service.matcher.CitationCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ArticleCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ContextualCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ContinuationCandidate;
import com.lawgraph.service.matcher.CitationCandidate.ExternalCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RangeCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RelativeCandidate;
import com.lawgraph.service.matcher.CitationCandidate.RelativeStructuralCandidate;
import com.lawgraph.service.matcher.CitationCandidate.StructuralCandidate;
import com.lawgraph.service.matcher.CitationCandidate.StructureStep;
import com.lawgraph.service.matcher.Locator;
import com.lawgraph.service.matcher.MatchResult;
import com.lawgraph.service.matcher.MatchedCitation;
import com.lawgraph.service.resolve.LawIdentityResolver;
import com.lawgraph.service.resolve.LawMatch;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Resolves matched citations against the reading position of one law.
 *
 * <p>One instance per document, advanced exactly once per division, article,
 * paragraph and item in document order, never shared between threads. Owns
 * the {@link ParsePosition}, the {@link RecentLawMemory} for 同法 and the
 * {@link AliasRegistry} of locally defined terms. Offsets passed in are
 * document-global: the base offset of a text unit plus the local span start.
 */
@Slf4j
public class ContextTracker {

    private final ParsePosition position;
    private final LawIdentityResolver resolver;
    private final RecentLawMemory recentLaws;
    private final AliasRegistry aliases = new AliasRegistry();
    private final List<ParseWarning> warnings = new ArrayList<>();

    private List<ArticleNumber> divisionOrder = List.of();
    private Map<ArticleNumber, Integer> orderIndex = Map.of();
    private Map<ArticleNumber, Integer> paragraphCounts = Map.of();
    private List<StructureNode> ancestry = List.of();

    private int offset;
    private int nextGroupId = 1;

    public ContextTracker(String lawId, LawIdentityResolver resolver, int recentLawCapacity) {
        this.position = new ParsePosition(lawId);
        this.resolver = resolver;
        this.recentLaws = new RecentLawMemory(recentLawCapacity);
    }

    // ============================================================
    // Advancing
    // ============================================================

    public void enterDivision(DivisionTag tag, List<Article> articles) {
        position.enterDivision(tag);
        List<ArticleNumber> order = new ArrayList<>();
        Map<ArticleNumber, Integer> index = new HashMap<>();
        Map<ArticleNumber, Integer> counts = new HashMap<>();
        for (Article article : articles) {
            index.putIfAbsent(article.getArticleNumber(), order.size());
            counts.putIfAbsent(article.getArticleNumber(), article.paragraphCount());
            order.add(article.getArticleNumber());
        }
        this.divisionOrder = order;
        this.orderIndex = index;
        this.paragraphCounts = counts;
        this.ancestry = List.of();
    }

    public void enterArticle(Article article, List<StructureNode> structure) {
        Integer index = orderIndex.get(article.getArticleNumber());
        position.enterArticle(article.getArticleNumber(), index != null ? index : position.getArticleIndex() + 1);
        this.ancestry = List.copyOf(structure);
    }

    public void enterParagraph(int number) {
        position.enterParagraph(number);
    }

    public void enterItem(Integer number) {
        position.enterItem(number);
    }

    /**
     * Document-global offset where the next text unit begins.
     */
    public int offset() {
        return offset;
    }

    public void advance(int length) {
        offset += length;
    }

    public ParsePosition position() {
        return position;
    }

    public List<ParseWarning> warnings() {
        return Collections.unmodifiableList(warnings);
    }

    // ============================================================
    // Aliases
    // ============================================================

    public void registerDefinitions(List<AliasDefinitionMatch> definitions, int baseOffset) {
        for (AliasDefinitionMatch definition : definitions) {
            String lawId = resolver.resolve(definition.referent()).orElse(null);
            aliases.define(definition.term(), definition.referent(), lawId, baseOffset + definition.span().end() - 1);
            log.debug("Alias 「{}」 -> {} ({}) at {}", definition.term(), definition.referent(), lawId, position);
        }
    }

    public Set<String> aliasTerms() {
        return aliases.terms();
    }

    // ============================================================
    // Resolution
    // ============================================================

    /**
     * Resolve every candidate of one text unit, in source order. Confidence is
     * left for the scorer; range citations stay unexpanded.
     */
    public List<Citation> resolve(MatchResult result, int baseOffset) {
        List<Citation> resolved = new ArrayList<>();
        for (MatchedCitation matched : result.citations()) {
            Citation.CitationBuilder builder = Citation.builder()
                    .source(position.toSourceLocation())
                    .text(matched.text())
                    .span(matched.span())
                    .role(matched.role())
                    .groupId(nextGroupId++);
            int at = baseOffset + matched.span().start();

            CitationCandidate candidate = matched.candidate();
            if (candidate instanceof ArticleCandidate article) {
                resolveArticle(article, builder);
            } else if (candidate instanceof ExternalCandidate external) {
                resolveExternal(external, at, builder);
            } else if (candidate instanceof RelativeCandidate relative) {
                resolveRelative(relative, builder);
            } else if (candidate instanceof StructuralCandidate structural) {
                resolveStructural(structural, builder);
            } else if (candidate instanceof RelativeStructuralCandidate structural) {
                resolveRelativeStructural(structural, builder);
            } else if (candidate instanceof RangeCandidate range) {
                resolveRange(range, at, builder);
            } else if (candidate instanceof ContextualCandidate contextual) {
                resolveContextual(contextual, at, builder);
            } else if (candidate instanceof ContinuationCandidate continuation) {
                resolveContinuation(continuation, resolved, builder);
            }
            resolved.add(builder.build());
        }
        linkCompoundAnchors(resolved, result);
        return resolved;
    }

    private void resolveArticle(ArticleCandidate candidate, Citation.CitationBuilder builder) {
        Locator locator = candidate.locator();
        builder.kind(CitationKind.INTERNAL);
        if (!locator.isValid()) {
            numeralFallback(builder);
            return;
        }
        builder.target(localTarget(position.getLawId(), locator))
                .method(ResolutionMethod.DIRECT_PATTERN)
                .certainty(Certainty.EXACT);
    }

    private void resolveExternal(ExternalCandidate candidate, int at, Citation.CitationBuilder builder) {
        LawMatch match = candidate.match();
        if (match == null) {
            recentLaws.remember(candidate.lawName(), null, at);
            warn(WarningType.IDENTITY_RESOLUTION_MISS, "Unknown law name: " + candidate.lawName());
            builder.kind(CitationKind.EXTERNAL_UNRESOLVED)
                    .target(CitationTarget.unresolved())
                    .method(ResolutionMethod.UNRESOLVED)
                    .certainty(Certainty.IDENTITY_MISS);
            return;
        }

        recentLaws.remember(candidate.lawName(), match.lawId(), at);
        builder.kind(match.lawId().equals(position.getLawId()) ? CitationKind.INTERNAL : CitationKind.EXTERNAL);
        Locator locator = candidate.locator();
        if (locator != null && !locator.isValid()) {
            numeralFallback(builder);
            return;
        }
        builder.target(lawTarget(match.lawId(), locator))
                .method(match.method())
                .certainty(Certainty.EXACT);
    }

    private void resolveRelative(RelativeCandidate candidate, Citation.CitationBuilder builder) {
        switch (candidate.unit()) {
            case ARTICLE -> resolveRelativeArticle(candidate, builder);
            case PARAGRAPH -> resolveRelativeParagraph(candidate, builder);
            case ITEM -> resolveRelativeItem(candidate, builder);
            default -> throw new IllegalStateException("Unknown unit: " + candidate.unit());
        }
    }

    private void resolveRelativeArticle(RelativeCandidate candidate, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.RELATIVE_ARTICLE);
        ArticleNumber target = relativeArticle(candidate);
        if (target == null) {
            unspecifiable(builder);
            return;
        }
        builder.target(currentDivisionTarget(target, candidate.paragraph(), candidate.item(), TargetScope.EXACT))
                .method(ResolutionMethod.CONTEXT)
                .certainty(Certainty.EXACT);
    }

    private void resolveRelativeParagraph(RelativeCandidate candidate, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.RELATIVE_PARAGRAPH).method(ResolutionMethod.CONTEXT);
        ArticleNumber article = position.getArticle();
        int current = position.getParagraph();

        switch (candidate.direction()) {
            case SAME -> builder.target(currentDivisionTarget(article, current, candidate.item(), TargetScope.EXACT))
                    .certainty(Certainty.EXACT);
            case FOLLOWING -> builder.target(currentDivisionTarget(article, current + candidate.distance(),
                    candidate.item(), TargetScope.EXACT)).certainty(Certainty.EXACT);
            case ALL_PRECEDING -> {
                if (current <= 1) {
                    unspecifiable(builder);
                    return;
                }
                builder.target(currentDivisionTarget(article, current, null, TargetScope.ALL_PRECEDING_PARAGRAPHS))
                        .certainty(Certainty.SYMBOLIC);
            }
            case PRECEDING -> {
                int paragraph = current - candidate.distance();
                if (paragraph >= 1) {
                    builder.target(currentDivisionTarget(article, paragraph, candidate.item(), TargetScope.EXACT))
                            .certainty(Certainty.EXACT);
                    return;
                }
                // best effort: last paragraph of the previous article
                ArticleNumber previous = stepArticle(-1);
                if (previous == null) {
                    unspecifiable(builder);
                    return;
                }
                builder.target(currentDivisionTarget(previous, paragraphCounts.getOrDefault(previous, 1),
                        candidate.item(), TargetScope.EXACT)).certainty(Certainty.DEGRADED);
            }
            default -> throw new IllegalStateException("Unknown direction: " + candidate.direction());
        }
    }

    private void resolveRelativeItem(RelativeCandidate candidate, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.RELATIVE_ITEM).method(ResolutionMethod.CONTEXT);
        Integer current = position.getItem();
        if (current == null) {
            unspecifiable(builder);
            return;
        }
        ArticleNumber article = position.getArticle();
        int paragraph = position.getParagraph();

        switch (candidate.direction()) {
            case SAME -> builder.target(currentDivisionTarget(article, paragraph, current, TargetScope.EXACT))
                    .certainty(Certainty.EXACT);
            case FOLLOWING -> builder.target(currentDivisionTarget(article, paragraph,
                    current + candidate.distance(), TargetScope.EXACT)).certainty(Certainty.EXACT);
            case PRECEDING -> {
                int item = current - candidate.distance();
                if (item < 1) {
                    unspecifiable(builder);
                    return;
                }
                builder.target(currentDivisionTarget(article, paragraph, item, TargetScope.EXACT))
                        .certainty(Certainty.EXACT);
            }
            case ALL_PRECEDING -> {
                if (current <= 1) {
                    unspecifiable(builder);
                    return;
                }
                builder.target(currentDivisionTarget(article, paragraph, current, TargetScope.ALL_PRECEDING_ITEMS))
                        .certainty(Certainty.SYMBOLIC);
            }
            default -> throw new IllegalStateException("Unknown direction: " + candidate.direction());
        }
    }

    private void resolveStructural(StructuralCandidate candidate, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.STRUCTURAL);
        List<StructureStep> steps = candidate.steps();
        if (steps.isEmpty() || steps.stream().anyMatch(s -> s.number() <= 0)) {
            numeralFallback(builder);
            return;
        }
        List<String> path = new ArrayList<>();
        NodeType outermost = steps.get(0).type();
        for (StructureNode node : ancestry) {
            if (node.getType().ordinal() < outermost.ordinal()) {
                path.add(node.pathSegment());
            }
        }
        for (StructureStep step : steps) {
            path.add(step.type().pathName() + "-" + step.number());
        }
        builder.target(structureTarget(path))
                .method(ResolutionMethod.DIRECT_PATTERN)
                .certainty(Certainty.EXACT);
    }

    private void resolveRelativeStructural(RelativeStructuralCandidate candidate, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.STRUCTURAL);
        List<String> path = new ArrayList<>();
        for (StructureNode node : ancestry) {
            if (node.getType() != candidate.level()) {
                if (node.getType().ordinal() < candidate.level().ordinal()) {
                    path.add(node.pathSegment());
                }
                continue;
            }
            int number = switch (candidate.direction()) {
                case PRECEDING -> node.getNumber() - 1;
                case FOLLOWING -> node.getNumber() + 1;
                default -> node.getNumber();
            };
            if (number < 1) {
                break;
            }
            path.add(candidate.level().pathName() + "-" + number);
            builder.target(structureTarget(path))
                    .method(ResolutionMethod.CONTEXT)
                    .certainty(Certainty.EXACT);
            return;
        }
        unspecifiable(builder);
    }

    private void resolveRange(RangeCandidate candidate, int at, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.RANGE);
        String lawId = position.getLawId();

        if (candidate.law() != null) {
            ExternalCandidate law = candidate.law();
            if (law.match() == null) {
                recentLaws.remember(law.lawName(), null, at);
                warn(WarningType.IDENTITY_RESOLUTION_MISS, "Unknown law name: " + law.lawName());
                builder.kind(CitationKind.EXTERNAL_UNRESOLVED)
                        .target(CitationTarget.unresolved())
                        .method(ResolutionMethod.UNRESOLVED)
                        .certainty(Certainty.IDENTITY_MISS);
                return;
            }
            lawId = law.match().lawId();
            recentLaws.remember(law.lawName(), lawId, at);
        } else if (candidate.sameLaw()) {
            Optional<RecentLawMemory.Mention> mention = recentLaws.nearestBefore(at);
            if (mention.isEmpty() || mention.get().lawId() == null) {
                builder.kind(CitationKind.CONTEXTUAL)
                        .target(CitationTarget.unresolved())
                        .method(ResolutionMethod.UNRESOLVED)
                        .certainty(mention.isPresent() ? Certainty.IDENTITY_MISS : Certainty.UNSPECIFIABLE);
                return;
            }
            lawId = mention.get().lawId();
        }

        Locator start = candidate.start();
        Locator end = candidate.end();
        if (!start.isValid() || !end.isValid()) {
            numeralFallback(builder);
            return;
        }

        boolean local = lawId.equals(position.getLawId());
        ArticleNumber contextArticle = null;
        if (candidate.relativeArticle() != null) {
            contextArticle = relativeArticle(candidate.relativeArticle());
            if (contextArticle == null) {
                unspecifiable(builder);
                return;
            }
        } else if (local) {
            contextArticle = position.getArticle();
        }

        ArticleNumber startArticle = start.hasArticle() ? start.article() : contextArticle;
        Integer startParagraph = start.paragraph();
        if (startParagraph == null && !start.hasArticle() && start.item() != null && local
                && candidate.relativeArticle() == null) {
            startParagraph = position.getParagraph();
        }
        boolean startSupplementary = start.hasArticle()
                ? start.supplementary()
                : local && position.isInSupplementaryProvisions();

        ArticleNumber endArticle = end.hasArticle() ? end.article() : startArticle;
        Integer endParagraph = end.paragraph();
        if (endParagraph == null && !end.hasArticle()) {
            endParagraph = startParagraph;
        }
        boolean endSupplementary = end.supplementary() || startSupplementary;

        builder.target(CitationTarget.builder()
                        .lawId(lawId)
                        .supplementary(startSupplementary)
                        .article(startArticle)
                        .paragraph(startParagraph)
                        .item(start.item())
                        .scope(TargetScope.EXACT)
                        .build())
                .rangeEnd(CitationTarget.builder()
                        .lawId(lawId)
                        .supplementary(endSupplementary)
                        .article(endArticle)
                        .paragraph(endParagraph)
                        .item(end.item())
                        .scope(TargetScope.EXACT)
                        .build())
                .method(ResolutionMethod.RANGE_EXPANSION)
                .certainty(Certainty.EXACT);
    }

    private void resolveContextual(ContextualCandidate candidate, int at, Citation.CitationBuilder builder) {
        builder.kind(CitationKind.CONTEXTUAL);
        switch (candidate.form()) {
            case SAME_LAW -> {
                Optional<RecentLawMemory.Mention> mention = recentLaws.nearestBefore(at);
                if (mention.isEmpty()) {
                    unspecifiable(builder);
                    return;
                }
                recalledLaw(mention.get().name(), mention.get().lawId(), candidate.locator(), at, builder);
            }
            case ALIAS -> {
                Optional<AliasRegistry.AliasDefinition> definition = aliases.lookup(candidate.term(), at);
                if (definition.isEmpty()) {
                    unspecifiable(builder);
                    return;
                }
                recalledLaw(definition.get().referent(), definition.get().lawId(), candidate.locator(), at, builder);
            }
            default -> unspecifiable(builder);
        }
    }

    private void recalledLaw(String name, String lawId, Locator locator, int at, Citation.CitationBuilder builder) {
        recentLaws.remember(name, lawId, at);
        if (lawId == null) {
            builder.target(CitationTarget.unresolved())
                    .method(ResolutionMethod.UNRESOLVED)
                    .certainty(Certainty.IDENTITY_MISS);
            return;
        }
        if (locator != null && !locator.isValid()) {
            numeralFallback(builder);
            return;
        }
        builder.target(lawTarget(lawId, locator))
                .method(ResolutionMethod.CONTEXT)
                .certainty(Certainty.RECALLED);
    }

    private void resolveContinuation(ContinuationCandidate candidate, List<Citation> resolved,
                                     Citation.CitationBuilder builder) {
        builder.kind(CitationKind.COMPOUND);
        Citation anchor = candidate.anchorIndex() < resolved.size() ? resolved.get(candidate.anchorIndex()) : null;
        if (anchor == null || !anchor.isResolved() || anchor.getTarget().getLawId() == null) {
            builder.target(CitationTarget.unresolved())
                    .method(ResolutionMethod.UNRESOLVED)
                    .certainty(anchor != null && anchor.getCertainty() == Certainty.IDENTITY_MISS
                            ? Certainty.IDENTITY_MISS : Certainty.UNSPECIFIABLE);
            return;
        }
        Locator locator = candidate.locator();
        if (!locator.isValid()) {
            numeralFallback(builder);
            return;
        }

        CitationTarget base = anchor.getRangeEnd() != null ? anchor.getRangeEnd() : anchor.getTarget();
        CitationTarget.CitationTargetBuilder target = CitationTarget.builder()
                .lawId(base.getLawId())
                .scope(TargetScope.EXACT);
        if (locator.hasArticle()) {
            target.supplementary(locator.supplementary() || base.isSupplementary())
                    .article(locator.article())
                    .paragraph(locator.paragraph())
                    .item(locator.item());
        } else if (base.getArticle() == null) {
            unspecifiable(builder);
            return;
        } else if (locator.paragraph() != null) {
            target.supplementary(base.isSupplementary())
                    .article(base.getArticle())
                    .paragraph(locator.paragraph())
                    .item(locator.item());
        } else {
            target.supplementary(base.isSupplementary())
                    .article(base.getArticle())
                    .paragraph(base.getParagraph())
                    .item(locator.item());
        }

        ResolutionMethod method = anchor.getMethod() == ResolutionMethod.RANGE_EXPANSION
                ? ResolutionMethod.DIRECT_PATTERN : anchor.getMethod();
        builder.target(target.build())
                .method(method)
                .certainty(anchor.getCertainty() == Certainty.RECALLED ? Certainty.RECALLED : Certainty.EXACT)
                .compoundFamily(anchor.getCompoundFamily() != null ? anchor.getCompoundFamily() : anchor.getGroupId());
    }

    /**
     * Anchors learn their compound family only once a continuation refers to them.
     */
    private void linkCompoundAnchors(List<Citation> resolved, MatchResult result) {
        for (MatchedCitation matched : result.citations()) {
            if (matched.candidate() instanceof ContinuationCandidate continuation) {
                int anchorIndex = continuation.anchorIndex();
                Citation anchor = resolved.get(anchorIndex);
                if (anchor.getCompoundFamily() == null) {
                    resolved.set(anchorIndex, anchor.toBuilder().compoundFamily(anchor.getGroupId()).build());
                }
            }
        }
    }

    // ============================================================
    // Helpers
    // ============================================================

    private ArticleNumber relativeArticle(RelativeCandidate candidate) {
        return switch (candidate.direction()) {
            case PRECEDING -> stepArticle(-candidate.distance());
            case FOLLOWING -> stepArticle(candidate.distance());
            case SAME -> position.getArticle();
            default -> null;
        };
    }

    /**
     * Article {@code delta} places away in division order, falling back to
     * numeric stepping when the current article is not in a known order.
     * Null when stepping back past the first article.
     */
    ArticleNumber stepArticle(int delta) {
        ArticleNumber current = position.getArticle();
        if (current == null) {
            return null;
        }
        Integer index = orderIndex.get(current);
        if (index != null) {
            int target = index + delta;
            if (target < 0) {
                return null;
            }
            if (target < divisionOrder.size()) {
                return divisionOrder.get(target);
            }
        }
        ArticleNumber result = current;
        for (int i = 0; i < Math.abs(delta) && result != null; i++) {
            result = delta < 0 ? numericPrevious(result) : ArticleNumber.of(result.base() + 1);
        }
        return result;
    }

    private static ArticleNumber numericPrevious(ArticleNumber article) {
        if (article.hasBranch()) {
            int branch = article.firstBranch();
            return branch > 2 ? article.withBranch(branch - 1) : article.baseArticle();
        }
        return article.base() > 1 ? ArticleNumber.of(article.base() - 1) : null;
    }

    /**
     * A locator in this law. Missing levels come from the current position:
     * a bare 第二項 is in the current article, a bare 第三号 in the current paragraph.
     */
    private CitationTarget localTarget(String lawId, Locator locator) {
        if (locator.hasArticle()) {
            return CitationTarget.builder()
                    .lawId(lawId)
                    .supplementary(locator.supplementary())
                    .article(locator.article())
                    .paragraph(locator.paragraph())
                    .item(locator.item())
                    .scope(TargetScope.EXACT)
                    .build();
        }
        Integer paragraph = locator.paragraph() != null ? locator.paragraph() : Integer.valueOf(position.getParagraph());
        return currentDivisionTarget(position.getArticle(), paragraph, locator.item(), TargetScope.EXACT);
    }

    private static CitationTarget lawTarget(String lawId, Locator locator) {
        if (locator == null || !locator.hasArticle()) {
            return CitationTarget.law(lawId);
        }
        return CitationTarget.builder()
                .lawId(lawId)
                .supplementary(locator.supplementary())
                .article(locator.article())
                .paragraph(locator.paragraph())
                .item(locator.item())
                .scope(TargetScope.EXACT)
                .build();
    }

    private CitationTarget currentDivisionTarget(ArticleNumber article, Integer paragraph, Integer item, TargetScope scope) {
        return CitationTarget.builder()
                .lawId(position.getLawId())
                .supplementary(position.isInSupplementaryProvisions())
                .article(article)
                .paragraph(paragraph)
                .item(item)
                .scope(scope)
                .build();
    }

    private CitationTarget structureTarget(List<String> path) {
        return CitationTarget.builder()
                .lawId(position.getLawId())
                .supplementary(position.isInSupplementaryProvisions())
                .structurePath(String.join("/", path))
                .scope(TargetScope.STRUCTURE)
                .build();
    }

    private static void unspecifiable(Citation.CitationBuilder builder) {
        builder.target(CitationTarget.unresolved())
                .method(ResolutionMethod.UNRESOLVED)
                .certainty(Certainty.UNSPECIFIABLE);
    }

    private void numeralFallback(Citation.CitationBuilder builder) {
        warn(WarningType.NUMERAL_FALLBACK, "Unparseable numeral in citation");
        builder.target(CitationTarget.unresolved())
                .method(ResolutionMethod.UNRESOLVED)
                .certainty(Certainty.NUMERAL_FALLBACK);
    }

    private void warn(WarningType type, String message) {
        warnings.add(ParseWarning.of(type, message, position.toString()));
    }
}
