package com.lawgraph.service.context;

import com.lawgraph.TestLaws;
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
import com.lawgraph.model.document.Paragraph;
import com.lawgraph.model.document.StructureNode;
import com.lawgraph.service.matcher.CitationPatternMatcher;
import com.lawgraph.service.matcher.MatchResult;
import com.lawgraph.service.resolve.LawIdentityResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContextTrackerTest {

    private static final String LAW = TestLaws.TEST_LAW;

    private final LawIdentityResolver resolver = TestLaws.resolver();
    private final CitationPatternMatcher matcher = new CitationPatternMatcher();

    private ContextTracker tracker;
    private List<Article> mainArticles;

    @BeforeEach
    void setUp() {
        tracker = new ContextTracker(LAW, resolver, 10);
        mainArticles = List.of(
                article(DivisionTag.main(), ArticleNumber.of(1), 1),
                article(DivisionTag.main(), ArticleNumber.of(2), 3),
                article(DivisionTag.main(), ArticleNumber.of(2, 2), 1),
                article(DivisionTag.main(), ArticleNumber.of(3), 2));
        tracker.enterDivision(DivisionTag.main(), mainArticles);
    }

    // ============================================================
    // Relative references
    // ============================================================

    @Test
    void shouldResolvePrecedingArticleInDivisionOrder() {
        // Given
        tracker.enterArticle(mainArticles.get(3), List.of());

        // When
        Citation citation = single("前条の規定");

        // Then
        assertThat(citation.getKind()).isEqualTo(CitationKind.RELATIVE_ARTICLE);
        assertThat(citation.getTarget()).isEqualTo(CitationTarget.builder()
                .lawId(LAW).article(ArticleNumber.of(2, 2)).scope(TargetScope.EXACT).build());
        assertThat(citation.getMethod()).isEqualTo(ResolutionMethod.CONTEXT);
        assertThat(citation.getCertainty()).isEqualTo(Certainty.EXACT);
    }

    @Test
    void shouldResolvePrecedingParagraphWithinArticle() {
        tracker.enterArticle(mainArticles.get(1), List.of());
        tracker.enterParagraph(3);

        Citation citation = single("前項の場合");

        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(2));
        assertThat(citation.getTarget().getParagraph()).isEqualTo(2);
        assertThat(citation.getCertainty()).isEqualTo(Certainty.EXACT);
    }

    @Test
    void shouldFallBackToLastParagraphOfPreviousArticle_whenAtFirstParagraph() {
        // Given
        tracker.enterArticle(mainArticles.get(1), List.of());
        tracker.enterArticle(mainArticles.get(2), List.of());

        // When
        Citation citation = single("前項の場合");

        // Then
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(2));
        assertThat(citation.getTarget().getParagraph()).isEqualTo(3);
        assertThat(citation.getCertainty()).isEqualTo(Certainty.DEGRADED);
    }

    @Test
    void shouldLeavePrecedingReferenceUnresolved_whenAtFirstArticle() {
        tracker.enterArticle(mainArticles.get(0), List.of());

        Citation previousArticle = single("前条の規定");
        Citation previousParagraph = single("前項の規定");

        assertThat(previousArticle.isResolved()).isFalse();
        assertThat(previousArticle.getCertainty()).isEqualTo(Certainty.UNSPECIFIABLE);
        assertThat(previousParagraph.isResolved()).isFalse();
    }

    @Test
    void shouldResolveRelativeItemsOnlyInsideItems() {
        tracker.enterArticle(mainArticles.get(1), List.of());

        assertThat(single("前号に掲げる").isResolved()).isFalse();

        tracker.enterItem(1);
        assertThat(single("前号に掲げる").isResolved()).isFalse();

        tracker.enterItem(2);
        Citation citation = single("前号に掲げる");
        assertThat(citation.getKind()).isEqualTo(CitationKind.RELATIVE_ITEM);
        assertThat(citation.getTarget().getParagraph()).isEqualTo(1);
        assertThat(citation.getTarget().getItem()).isEqualTo(1);
    }

    @Test
    void shouldMarkAllPrecedingParagraphsAsSymbolic() {
        tracker.enterArticle(mainArticles.get(1), List.of());
        tracker.enterParagraph(3);

        Citation citation = single("前各項の規定");

        assertThat(citation.getTarget().getScope()).isEqualTo(TargetScope.ALL_PRECEDING_PARAGRAPHS);
        assertThat(citation.getTarget().getParagraph()).isEqualTo(3);
        assertThat(citation.getCertainty()).isEqualTo(Certainty.SYMBOLIC);
    }

    @Test
    void shouldTargetSupplementaryDivision_whenInsideSupplementaryProvisions() {
        // Given
        tracker.enterArticle(mainArticles.get(0), List.of());
        DivisionTag supplementary = DivisionTag.supplementary(null);
        List<Article> supplementaryArticles = List.of(
                article(supplementary, ArticleNumber.of(1), 1),
                article(supplementary, ArticleNumber.of(2), 1));
        tracker.enterDivision(supplementary, supplementaryArticles);
        tracker.enterArticle(supplementaryArticles.get(1), List.of());

        // When
        List<Citation> citations = resolve("前条及び第三条の規定");

        // Then
        assertThat(citations.get(0).getTarget().isSupplementary()).isTrue();
        assertThat(citations.get(0).getTarget().getArticle()).isEqualTo(ArticleNumber.of(1));
        assertThat(tracker.position().toSourceLocation().division()).isEqualTo(supplementary);
    }

    // ============================================================
    // Internal, compound and structural references
    // ============================================================

    @Test
    void shouldFillBareParagraphFromCurrentArticle() {
        tracker.enterArticle(mainArticles.get(3), List.of());

        Citation citation = single("第二項の規定");

        assertThat(citation.getKind()).isEqualTo(CitationKind.INTERNAL);
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(3));
        assertThat(citation.getTarget().getParagraph()).isEqualTo(2);
        assertThat(citation.getMethod()).isEqualTo(ResolutionMethod.DIRECT_PATTERN);
    }

    @Test
    void shouldLinkContinuationToItsAnchor() {
        // Given
        tracker.enterArticle(mainArticles.get(0), List.of());

        // When
        List<Citation> citations = resolve("第三条第二項及び第四項の規定");

        // Then
        assertThat(citations).hasSize(2);
        Citation anchor = citations.get(0);
        Citation sibling = citations.get(1);
        assertThat(sibling.getKind()).isEqualTo(CitationKind.COMPOUND);
        assertThat(sibling.getTarget().getArticle()).isEqualTo(ArticleNumber.of(3));
        assertThat(sibling.getTarget().getParagraph()).isEqualTo(4);
        assertThat(sibling.getCompoundFamily()).isEqualTo(anchor.getGroupId());
        assertThat(anchor.getCompoundFamily()).isEqualTo(anchor.getGroupId());
        assertThat(sibling.getGroupId()).isNotEqualTo(anchor.getGroupId());
    }

    @Test
    void shouldBuildStructurePathFromAncestry() {
        // Given
        List<StructureNode> ancestry = List.of(
                new StructureNode(NodeType.PART, "第二編", "二", 2, DivisionTag.main()),
                new StructureNode(NodeType.CHAPTER, "第二章", "二", 2, DivisionTag.main()));
        tracker.enterArticle(mainArticles.get(0), ancestry);

        // When
        List<Citation> citations = resolve("第三章及び前章の規定");

        // Then
        assertThat(citations).extracting(c -> c.getTarget().getStructurePath())
                .containsExactly("part-2/chapter-3", "part-2/chapter-1");
        assertThat(citations).allSatisfy(c -> assertThat(c.getKind()).isEqualTo(CitationKind.STRUCTURAL));
    }

    @Test
    void shouldRejectArticlesEnteredOutOfOrder() {
        tracker.enterArticle(mainArticles.get(3), List.of());

        assertThatThrownBy(() -> tracker.enterArticle(mainArticles.get(0), List.of()))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("out of order");
    }

    // ============================================================
    // Law memory and aliases
    // ============================================================

    @Test
    void shouldRecallMostRecentLawForSameLaw() {
        // Given
        tracker.enterArticle(mainArticles.get(0), List.of());
        resolve("民法第九十条の規定");
        resolve("会社法第二条に規定する会社");

        // When
        Citation citation = single("同法第五条の規定");

        // Then
        assertThat(citation.getKind()).isEqualTo(CitationKind.CONTEXTUAL);
        assertThat(citation.getTarget().getLawId()).isEqualTo(TestLaws.COMPANIES_ACT);
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(5));
        assertThat(citation.getCertainty()).isEqualTo(Certainty.RECALLED);
    }

    @Test
    void shouldLeaveSameLawUnresolved_whenNoLawMentioned() {
        tracker.enterArticle(mainArticles.get(0), List.of());

        Citation citation = single("同法第五条の規定");

        assertThat(citation.isResolved()).isFalse();
        assertThat(citation.getCertainty()).isEqualTo(Certainty.UNSPECIFIABLE);
    }

    @Test
    void shouldNotFallBackToOlderLaw_whenLatestMentionIsUnknown() {
        // Given
        tracker.enterArticle(mainArticles.get(0), List.of());
        resolve("民法第九十条の規定");
        Citation unknown = single("架空振興法第三条の規定");

        // When
        Citation sameLaw = single("同法第四条の規定");

        // Then
        assertThat(unknown.getKind()).isEqualTo(CitationKind.EXTERNAL_UNRESOLVED);
        assertThat(sameLaw.isResolved()).isFalse();
        assertThat(sameLaw.getCertainty()).isEqualTo(Certainty.IDENTITY_MISS);
        assertThat(tracker.warnings()).extracting(w -> w.type())
                .containsExactly(WarningType.IDENTITY_RESOLUTION_MISS);
    }

    @Test
    void shouldResolveDefinedAliasInLaterText() {
        // Given
        tracker.enterArticle(mainArticles.get(0), List.of());
        String definition = "労働基準法（昭和二十二年法律第四十九号。以下「旧法」という。）第三十二条の規定";
        tracker.registerDefinitions(matcher.findDefinitions(definition, resolver), tracker.offset());
        resolve(definition);

        // When
        Citation citation = single("旧法第三十五条の規定");

        // Then
        assertThat(tracker.aliasTerms()).containsExactly("旧法");
        assertThat(citation.getKind()).isEqualTo(CitationKind.CONTEXTUAL);
        assertThat(citation.getTarget().getLawId()).isEqualTo(TestLaws.LABOR_STANDARDS);
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(35));
    }

    @Test
    void shouldRecordNumeralFallbackForUnparseableNumber() {
        tracker.enterArticle(mainArticles.get(0), List.of());

        Citation citation = single("第〇条の規定");

        assertThat(citation.getCertainty()).isEqualTo(Certainty.NUMERAL_FALLBACK);
        assertThat(tracker.warnings()).extracting(w -> w.type()).containsExactly(WarningType.NUMERAL_FALLBACK);
    }

    // ============================================================
    // Helpers
    // ============================================================

    private List<Citation> resolve(String text) {
        MatchResult result = matcher.match(text, resolver, tracker.aliasTerms());
        List<Citation> citations = tracker.resolve(result, tracker.offset());
        tracker.advance(text.length() + 1);
        return citations;
    }

    private Citation single(String text) {
        List<Citation> citations = resolve(text);
        assertThat(citations).hasSize(1);
        return citations.get(0);
    }

    private static Article article(DivisionTag division, ArticleNumber number, int paragraphs) {
        List<Paragraph> list = new ArrayList<>();
        for (int i = 1; i <= paragraphs; i++) {
            list.add(Paragraph.builder().number(i).text("本文").build());
        }
        return new Article(number, number.display(), String.valueOf(number.base()), null,
                list, false, division);
    }
}
