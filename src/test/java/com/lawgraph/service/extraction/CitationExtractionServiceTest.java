package com.lawgraph.service.extraction;

import com.lawgraph.TestLaws;
import com.lawgraph.config.LawGraphConfig;
import com.lawgraph.model.ExtractionResult;
import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import com.lawgraph.model.citation.Certainty;
import com.lawgraph.model.citation.Citation;
import com.lawgraph.model.citation.CitationKind;
import com.lawgraph.model.citation.CitationRole;
import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.citation.TargetScope;
import com.lawgraph.model.document.Article;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.Division;
import com.lawgraph.model.document.DivisionTag;
import com.lawgraph.model.document.Document;
import com.lawgraph.model.document.Paragraph;
import com.lawgraph.service.data.DictionaryLoaderService;
import com.lawgraph.service.graph.CitationGraphEmitter;
import com.lawgraph.service.matcher.CitationPatternMatcher;
import com.lawgraph.service.parser.LawXmlParser;
import com.lawgraph.service.parser.MarkupScanner;
import com.lawgraph.service.resolve.RangeExpander;
import com.lawgraph.service.scoring.CitationDeduplicator;
import com.lawgraph.service.scoring.ConfidenceScorer;
import com.lawgraph.service.verify.CitationVerifier;
import com.lawgraph.service.verify.VerificationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CitationExtractionServiceTest {

    private static final String LAW = TestLaws.TEST_LAW;

    @Mock
    private DictionaryLoaderService dictionaryLoaderService;

    @Mock
    private ObjectProvider<CitationVerifier> verifierProvider;

    private CitationExtractionService service;

    @BeforeEach
    void setUp() {
        LawGraphConfig config = new LawGraphConfig();
        ConfidenceScorer scorer = new ConfidenceScorer();
        service = new CitationExtractionService(
                new LawXmlParser(new MarkupScanner()),
                new CitationPatternMatcher(),
                new RangeExpander(config),
                new CitationDeduplicator(),
                scorer,
                new VerificationService(config, verifierProvider, scorer, Runnable::run),
                new CitationGraphEmitter(),
                dictionaryLoaderService,
                config);
        when(dictionaryLoaderService.getResolver()).thenReturn(TestLaws.resolver());
    }

    // ============================================================
    // Free text
    // ============================================================

    @Test
    void shouldResolveBareArticleToCitingLaw() {
        // When
        ExtractionResult result = service.extractText("第九十条の規定に違反した者", LAW);

        // Then
        assertThat(result.getCitations()).hasSize(1);
        Citation citation = result.getCitations().get(0);
        assertThat(citation.getKind()).isEqualTo(CitationKind.INTERNAL);
        assertThat(citation.getTarget().getLawId()).isEqualTo(LAW);
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(90));
        assertThat(citation.getMethod()).isEqualTo(ResolutionMethod.DIRECT_PATTERN);
        assertThat(citation.getConfidence()).isEqualTo(0.95);
        assertThat(result.getEdges()).hasSize(1);
        assertThat(result.getEdges().get(0).getTargetNodeId()).isEqualTo(LAW + "#art:90");
    }

    @Test
    void shouldExpandArticleRangeIntoSiblings() {
        // When
        ExtractionResult result = service.extractText("第三十二条から第三十五条までの規定", LAW);

        // Then
        assertThat(result.getCitations()).hasSize(4);
        assertThat(result.getCitations()).extracting(c -> c.getTarget().getArticle())
                .containsExactly(ArticleNumber.of(32), ArticleNumber.of(33), ArticleNumber.of(34), ArticleNumber.of(35));
        assertThat(result.getCitations()).allSatisfy(c -> {
            assertThat(c.getKind()).isEqualTo(CitationKind.RANGE);
            assertThat(c.getMethod()).isEqualTo(ResolutionMethod.RANGE_EXPANSION);
            assertThat(c.getText()).isEqualTo("第三十二条から第三十五条まで");
        });
        assertThat(result.getCitations()).extracting(Citation::getGroupId).containsOnly(
                result.getCitations().get(0).getGroupId());
    }

    @Test
    void shouldScoreUnknownLawLow() {
        ExtractionResult result = service.extractText("架空振興法第三条に規定する", LAW);

        assertThat(result.getCitations()).hasSize(1);
        Citation citation = result.getCitations().get(0);
        assertThat(citation.getKind()).isEqualTo(CitationKind.EXTERNAL_UNRESOLVED);
        assertThat(citation.getConfidence()).isLessThanOrEqualTo(0.3);
        assertThat(result.getWarnings()).extracting(ParseWarning::type)
                .contains(WarningType.IDENTITY_RESOLUTION_MISS);
        assertThat(result.getEdges().get(0).getTargetNodeId()).isEqualTo("unresolved:架空振興法第三条");
    }

    @Test
    void shouldResolvePrecedingParagraphInBuiltDocument() {
        // Given
        Division body = new Division(DivisionTag.main(), null, null);
        body.addChild(new Article(ArticleNumber.of(5), "第五条", "五", null, List.of(
                Paragraph.builder().number(1).text("使用者は、届け出なければならない。").build(),
                Paragraph.builder().number(2).text("前項の規定にかかわらず、届出を要しない。").build()),
                false, DivisionTag.main()));
        Document document = Document.builder().division(body).build();

        // When
        ExtractionResult result = service.extract(document, LAW);

        // Then
        assertThat(result.getCitations()).hasSize(1);
        Citation citation = result.getCitations().get(0);
        assertThat(citation.getKind()).isEqualTo(CitationKind.RELATIVE_PARAGRAPH);
        assertThat(citation.getTarget().getArticle()).isEqualTo(ArticleNumber.of(5));
        assertThat(citation.getTarget().getParagraph()).isEqualTo(1);
        assertThat(citation.getSource().paragraph()).isEqualTo(2);
    }

    @Test
    void shouldReturnEmptyResultForTextWithoutCitations() {
        ExtractionResult result = service.extractText("使用者は、労働者に対して賃金を支払わなければならない。", LAW);

        assertThat(result.getCitations()).isEmpty();
        assertThat(result.getEdges()).isEmpty();
        assertThat(result.isFailed()).isFalse();
    }

    // ============================================================
    // Statute XML
    // ============================================================

    @Nested
    class WholeLaw {

        private ExtractionResult result;

        @BeforeEach
        void extract() {
            result = service.extractXml(TestLaws.resource("xml/test-law.xml"), LAW);
        }

        @Test
        void shouldReportDocumentMetadata() {
            assertThat(result.getLawId()).isEqualTo(LAW);
            assertThat(result.getLawTitle()).isEqualTo("試験手続法");
            assertThat(result.getLawNum()).isEqualTo("平成五年法律第九十九号");
            assertThat(result.getArticleCount()).isEqualTo(9);
            assertThat(result.getCitations()).hasSize(21);
            assertThat(result.getEdges()).hasSize(21);
            assertThat(result.getTiming()).isNotNull();
        }

        @Test
        void shouldResolveExternalLawAndRecallItForSameLaw() {
            Citation civil = find("民法第九十条");
            assertThat(civil.getKind()).isEqualTo(CitationKind.EXTERNAL);
            assertThat(civil.getTarget().getLawId()).isEqualTo(TestLaws.CIVIL_CODE);
            assertThat(civil.getMethod()).isEqualTo(ResolutionMethod.DIRECT_PATTERN);

            Citation sameLaw = find("同法第五条");
            assertThat(sameLaw.getTarget().getLawId()).isEqualTo(TestLaws.CIVIL_CODE);
            assertThat(sameLaw.getTarget().getArticle()).isEqualTo(ArticleNumber.of(5));
            assertThat(sameLaw.getCertainty()).isEqualTo(Certainty.RECALLED);
            assertThat(sameLaw.getConfidence()).isEqualTo(0.80);
        }

        @Test
        void shouldResolveRelativeReferencesAcrossItemsAndSubitems() {
            List<Citation> previousItem = findAll("前号");
            assertThat(previousItem).hasSize(2);
            assertThat(previousItem).allSatisfy(c -> {
                assertThat(c.getTarget().getArticle()).isEqualTo(ArticleNumber.of(2));
                assertThat(c.getTarget().getItem()).isEqualTo(1);
            });

            Citation previousParagraph = find("前項");
            assertThat(previousParagraph.getTarget().getParagraph()).isEqualTo(1);
            assertThat(previousParagraph.getRole()).isEqualTo(CitationRole.APPLICATION);
        }

        @Test
        void shouldStepOverBranchArticlesInOrder() {
            Citation fromBranch = find("前条第一項");
            assertThat(fromBranch.getSource().article()).isEqualTo(ArticleNumber.of(3, 2));
            assertThat(fromBranch.getTarget().getArticle()).isEqualTo(ArticleNumber.of(3));
            assertThat(fromBranch.getTarget().getParagraph()).isEqualTo(1);

            Citation next = find("次条");
            assertThat(next.getTarget().getArticle()).isEqualTo(ArticleNumber.of(6));
        }

        @Test
        void shouldExpandRangeWithApplicationRole() {
            List<Citation> range = findAll("第四条から第六条まで");
            assertThat(range).extracting(c -> c.getTarget().getArticle())
                    .containsExactly(ArticleNumber.of(4), ArticleNumber.of(5), ArticleNumber.of(6));
            assertThat(range).allSatisfy(c -> assertThat(c.getRole()).isEqualTo(CitationRole.APPLICATION));
        }

        @Test
        void shouldLinkCompoundExternalCitation() {
            Citation anchor = find("労働基準法（昭和二十二年法律第四十九号）第三十二条");
            Citation sibling = find("第三十五条");

            assertThat(anchor.getTarget().getLawId()).isEqualTo(TestLaws.LABOR_STANDARDS);
            assertThat(sibling.getKind()).isEqualTo(CitationKind.COMPOUND);
            assertThat(sibling.getTarget().getLawId()).isEqualTo(TestLaws.LABOR_STANDARDS);
            assertThat(sibling.getTarget().getArticle()).isEqualTo(ArticleNumber.of(35));
            assertThat(sibling.getCompoundFamily()).isEqualTo(anchor.getGroupId());
        }

        @Test
        void shouldResolveStructuralReferences() {
            assertThat(find("前章").getTarget().getStructurePath()).isEqualTo("chapter-1");
            assertThat(find("第一章").getTarget().getScope()).isEqualTo(TargetScope.STRUCTURE);
            assertThat(result.getEdges()).extracting(e -> e.getTargetNodeId())
                    .contains(LAW + "#chapter-1");
        }

        @Test
        void shouldSkipDeletedArticle() {
            assertThat(result.getCitations())
                    .noneMatch(c -> ArticleNumber.of(4).equals(c.getSource().article()));
        }

        @Test
        void shouldDistinguishMainAndSupplementaryTargetsInSupplementaryProvisions() {
            List<Citation> supplementary = result.getCitations().stream()
                    .filter(c -> c.getSource().division().isSupplementary())
                    .collect(Collectors.toList());

            assertThat(supplementary).extracting(Citation::getText)
                    .containsExactly("第二条", "附則第二条", "前条", "政令で定める");
            assertThat(supplementary.get(0).getTarget().isSupplementary()).isFalse();
            assertThat(supplementary.get(1).getTarget().isSupplementary()).isTrue();
            assertThat(supplementary.get(2).getTarget().isSupplementary()).isTrue();
            assertThat(supplementary.get(2).getTarget().getArticle()).isEqualTo(ArticleNumber.of(1));
            assertThat(supplementary.get(3).isResolved()).isFalse();
            assertThat(supplementary.get(3).getConfidence()).isZero();
        }

        @Test
        void shouldKeepUnknownLawUnresolved() {
            Citation unknown = find("架空振興法第三条");
            assertThat(unknown.getKind()).isEqualTo(CitationKind.EXTERNAL_UNRESOLVED);
            assertThat(unknown.getConfidence()).isEqualTo(0.2);
        }

        private Citation find(String text) {
            List<Citation> found = findAll(text);
            assertThat(found).as("citations with text %s", text).hasSize(1);
            return found.get(0);
        }

        private List<Citation> findAll(String text) {
            return result.getCitations().stream()
                    .filter(c -> c.getText().equals(text))
                    .collect(Collectors.toList());
        }
    }
}
