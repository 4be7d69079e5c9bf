package com.lawgraph.service.parser;

import com.lawgraph.model.WarningType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MarkupScannerTest {

    private final MarkupScanner scanner = new MarkupScanner();

    @Test
    void shouldBuildNestedTree() {
        // Given
        String markup = "<?xml version=\"1.0\"?><!-- c --><Article Num=\"3\"><ArticleTitle>第三条</ArticleTitle>"
                + "<Paragraph Num='1'><ParagraphSentence><Sentence>本文</Sentence></ParagraphSentence></Paragraph></Article>";

        // When
        MarkupScanner.ScanResult result = scanner.scan(markup);

        // Then
        assertThat(result.warnings()).isEmpty();
        assertThat(result.elements()).hasSize(1);
        MarkupElement article = result.elements().get(0);
        assertThat(article.name()).isEqualTo("Article");
        assertThat(article.attribute("Num")).isEqualTo("3");
        assertThat(article.child("ArticleTitle").text()).isEqualTo("第三条");
        assertThat(article.find("Sentence").text()).isEqualTo("本文");
        assertThat(article.children("Paragraph")).hasSize(1);
    }

    @Test
    void shouldNotConfuseElementsSharingAPrefix() {
        String markup = "<Article><ArticleCaption>（定義）</ArticleCaption><ArticleTitle>第一条</ArticleTitle></Article>"
                + "<Article><ArticleTitle>第二条</ArticleTitle></Article>";

        MarkupScanner.ScanResult result = scanner.scan(markup);

        assertThat(result.elements()).hasSize(2);
        assertThat(result.elements().get(0).child("ArticleCaption").text()).isEqualTo("（定義）");
        assertThat(result.elements().get(1).child("ArticleTitle").text()).isEqualTo("第二条");
    }

    @Test
    void shouldUnescapeEntitiesAndKeepCdata() {
        MarkupScanner.ScanResult result = scanner.scan(
                "<Sentence>A &amp; B &lt;C&gt;</Sentence><Sentence><![CDATA[x < y]]></Sentence>");

        assertThat(result.elements().get(0).text()).isEqualTo("A & B <C>");
        assertThat(result.elements().get(1).text()).isEqualTo("x < y");
    }

    @Test
    void shouldSkipRubyReadings() {
        MarkupScanner.ScanResult result = scanner.scan(
                "<Sentence><Ruby>瑕<Rt>か</Rt></Ruby><Ruby>疵<Rt>し</Rt></Ruby>がある</Sentence>");

        assertThat(result.elements().get(0).text()).isEqualTo("瑕疵がある");
    }

    @Test
    void shouldStopUnterminatedElementAtNextSibling() {
        // Given the first article never closes
        String markup = "<Body><Article Num=\"1\"><ArticleTitle>第一条</ArticleTitle>"
                + "<Article Num=\"2\"><ArticleTitle>第二条</ArticleTitle></Article></Body>";

        // When
        MarkupScanner.ScanResult result = scanner.scan(markup);

        // Then
        MarkupElement body = result.elements().get(0);
        assertThat(body.children("Article")).hasSize(2);
        assertThat(body.children("Article").get(0).isTerminated()).isFalse();
        assertThat(body.children("Article").get(1).isTerminated()).isTrue();
        assertThat(result.warnings()).extracting(w -> w.type()).containsOnly(WarningType.STRUCTURAL_PARSE);
    }

    @Test
    void shouldTrackDepth_whenSameNameElementIsNested() {
        // Given an article quoted inside a sentence of article 1
        String markup = "<MainProvision><Article Num=\"1\"><ArticleTitle>第一条</ArticleTitle>"
                + "<Paragraph Num=\"1\"><ParagraphSentence><Sentence>次のとおり改める。"
                + "<Article Num=\"9\"><ArticleTitle>第九条</ArticleTitle></Article>"
                + "</Sentence></ParagraphSentence></Paragraph></Article>"
                + "<Article Num=\"2\"><ArticleTitle>第二条</ArticleTitle></Article></MainProvision>";

        // When
        MarkupScanner.ScanResult result = scanner.scan(markup);

        // Then
        assertThat(result.warnings()).isEmpty();
        List<MarkupElement> articles = result.elements().get(0).children("Article");
        assertThat(articles).extracting(article -> article.attribute("Num")).containsExactly("1", "2");
        assertThat(articles).allSatisfy(article -> assertThat(article.isTerminated()).isTrue());
        assertThat(articles.get(0).find("Sentence").child("Article").attribute("Num")).isEqualTo("9");
        assertThat(articles.get(1).child("ArticleTitle").text()).isEqualTo("第二条");
    }

    @Test
    void shouldWarnAboutStrayCloseMarker() {
        MarkupScanner.ScanResult result = scanner.scan("<A>x</B></A>");

        assertThat(result.elements()).hasSize(1);
        assertThat(result.elements().get(0).text()).isEqualTo("x");
        assertThat(result.warnings()).hasSize(1);
    }

    @Test
    void shouldHandleSelfClosingAndEmptyInput() {
        assertThat(scanner.scan("<ParagraphNum/>").elements().get(0).content()).isEmpty();
        assertThat(scanner.scan(null).nodes()).isEmpty();
    }
}
