package com.lawgraph.service.parser;

import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import com.lawgraph.model.document.Article;
import com.lawgraph.model.document.ArticleNumber;
import com.lawgraph.model.document.Division;
import com.lawgraph.model.document.DivisionTag;
import com.lawgraph.model.document.Document;
import com.lawgraph.model.document.DocumentNode;
import com.lawgraph.model.document.Item;
import com.lawgraph.model.document.NodeType;
import com.lawgraph.model.document.Paragraph;
import com.lawgraph.model.document.StructureNode;
import com.lawgraph.util.KanjiNumerals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the {@link Document} model from e-Gov statute XML.
 *
 * <p>Main body and each supplementary-provisions block are parsed as
 * separate divisions with their own article numbering. Broken markup never
 * aborts the document: an unterminated article is dropped, an unterminated
 * container is closed at its parent's end, and both are reported as
 * structural-parse warnings.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LawXmlParser {

    private static final Pattern ARTICLE_TITLE = Pattern.compile(
            "第([〇一二三四五六七八九十百千万０-９0-9]+)条((?:の[〇一二三四五六七八九十百千万０-９0-9]+)*)");

    private static final Pattern STRUCTURE_TITLE = Pattern.compile(
            "第([〇一二三四五六七八九十百千万０-９0-9]+)[編章節款目]");

    private static final String DELETED_TEXT = "削除";

    private final MarkupScanner scanner;

    public Document parse(String xml) {
        MarkupScanner.ScanResult scan = scanner.scan(xml);
        Document.DocumentBuilder builder = Document.builder();
        scan.warnings().forEach(builder::warning);

        MarkupElement law = findFirst(scan.elements(), "Law");
        MarkupElement body = law != null ? law.find("LawBody") : findFirst(scan.elements(), "LawBody");

        if (law != null) {
            MarkupElement lawNum = law.child("LawNum");
            builder.lawNum(lawNum != null ? lawNum.text() : null);
        }
        MarkupElement lawTitle = body != null ? body.child("LawTitle") : findFirst(scan.elements(), "LawTitle");
        builder.lawTitle(lawTitle != null ? lawTitle.text() : null);

        List<MarkupElement> provisionScope = body != null ? body.elements() : scan.elements();
        MarkupElement mainProvision = findFirst(provisionScope, "MainProvision");
        List<MarkupElement> supplProvisions = findAll(provisionScope, "SupplProvision");

        if (mainProvision != null) {
            builder.division(parseDivision(mainProvision.elements(), DivisionTag.main(), null, null, builder::warning));
        } else if (supplProvisions.isEmpty()) {
            // bare fragment: everything is main body
            builder.division(parseDivision(provisionScope, DivisionTag.main(), null, null, builder::warning));
        }

        boolean indexed = supplProvisions.size() > 1;
        for (int i = 0; i < supplProvisions.size(); i++) {
            MarkupElement suppl = supplProvisions.get(i);
            MarkupElement label = suppl.child("SupplProvisionLabel");
            DivisionTag tag = DivisionTag.supplementary(indexed ? i + 1 : null);
            builder.division(parseDivision(suppl.elements(), tag,
                    label != null ? label.text() : null, suppl.attribute("AmendLawNum"), builder::warning));
        }

        Document document = builder.build();
        log.debug("Parsed law '{}' ({} divisions, {} articles, {} warnings)",
                document.getLawTitle(), document.getDivisions().size(),
                document.articleCount(), document.getWarnings().size());
        return document;
    }

    // ============================================================
    // Divisions and structure
    // ============================================================

    private Division parseDivision(List<MarkupElement> elements, DivisionTag tag, String label,
                                   String amendLawNum, Consumer<ParseWarning> warnings) {
        Division division = new Division(tag, label, amendLawNum);
        DivisionState state = new DivisionState(tag, warnings);
        parseChildren(elements, state, division::addChild);

        // paragraphs written straight under the provision form an implicit article 1
        if (!state.loose.isEmpty()) {
            Article implicit = new Article(ArticleNumber.of(1), null, null, null,
                    state.loose, false, tag);
            if (state.seen.add(implicit.getArticleNumber().key())) {
                division.addChild(implicit);
            }
        }
        return division;
    }

    private void parseChildren(List<MarkupElement> elements, DivisionState state, Consumer<DocumentNode> sink) {
        for (MarkupElement element : elements) {
            NodeType type = NodeType.fromElementName(element.name());
            if (type == NodeType.ARTICLE) {
                Article article = parseArticle(element, state);
                if (article != null) {
                    sink.accept(article);
                }
            } else if (type != null) {
                if (!element.isTerminated()) {
                    state.warn("Unterminated <" + element.name() + "> closed at end of parent", element.name());
                }
                StructureNode node = parseStructure(element, type, state.tag);
                parseChildren(element.elements(), state, node::addChild);
                sink.accept(node);
            } else if ("Paragraph".equals(element.name())) {
                state.loose.add(parseParagraph(element, state.loose.size() + 1));
            }
        }
    }

    private StructureNode parseStructure(MarkupElement element, NodeType type, DivisionTag tag) {
        MarkupElement titleElement = element.child(type.elementName() + "Title");
        String title = titleElement != null ? titleElement.text() : null;

        String rawNumeral = null;
        if (title != null) {
            Matcher m = STRUCTURE_TITLE.matcher(title);
            if (m.find()) {
                rawNumeral = m.group(1);
            }
        }
        int number = KanjiNumerals.parse(firstNumComponent(element.attribute("Num")));
        if (number == 0 && rawNumeral != null) {
            number = KanjiNumerals.parse(rawNumeral);
        }
        return new StructureNode(type, title, rawNumeral, number, tag);
    }

    // ============================================================
    // Articles
    // ============================================================

    private Article parseArticle(MarkupElement element, DivisionState state) {
        MarkupElement titleElement = element.child("ArticleTitle");
        String title = titleElement != null ? titleElement.text() : null;

        if (!element.isTerminated()) {
            state.warn("Unterminated article dropped", title != null ? title : "Article");
            return null;
        }

        ArticleNumber number = articleNumber(element.attribute("Num"), title);
        if (!number.isValid()) {
            state.warnings.accept(ParseWarning.of(WarningType.NUMERAL_FALLBACK,
                    "Unparseable article numeral, treated as 0", state.tag + " " + title));
            number = ArticleNumber.of(0);
        }
        if (!state.seen.add(number.key())) {
            state.warn("Duplicate article numeral " + number.key() + ", later occurrence dropped", title);
            return null;
        }

        MarkupElement captionElement = element.child("ArticleCaption");
        String caption = captionElement != null ? captionElement.text() : null;

        List<Paragraph> paragraphs = new ArrayList<>();
        for (MarkupElement p : element.children("Paragraph")) {
            paragraphs.add(parseParagraph(p, paragraphs.size() + 1));
        }
        if (paragraphs.isEmpty()) {
            paragraphs.add(Paragraph.builder()
                    .number(1)
                    .implicit(true)
                    .text(bodyText(element, caption))
                    .build());
        }

        boolean deleted = "true".equalsIgnoreCase(element.attribute("Delete"))
                || paragraphs.stream().allMatch(p -> DELETED_TEXT.equals(p.getText()));

        String rawNumeral = null;
        if (title != null) {
            Matcher m = ARTICLE_TITLE.matcher(title);
            if (m.find()) {
                rawNumeral = m.group(1) + m.group(2);
            }
        }
        return new Article(number, title, rawNumeral, caption, paragraphs, deleted, state.tag);
    }

    private ArticleNumber articleNumber(String numAttribute, String title) {
        if (numAttribute != null && !numAttribute.isBlank()) {
            ArticleNumber fromAttribute = ArticleNumber.fromNumAttribute(numAttribute);
            if (fromAttribute.isValid()) {
                return fromAttribute;
            }
        }
        if (title != null) {
            Matcher m = ARTICLE_TITLE.matcher(title);
            if (m.find()) {
                return ArticleNumber.fromText(m.group(1), m.group(2));
            }
        }
        return ArticleNumber.of(0);
    }

    /**
     * Caption plus any loose sentence text of an article without Paragraph elements.
     */
    private String bodyText(MarkupElement article, String caption) {
        List<String> parts = new ArrayList<>();
        for (MarkupElement child : article.elements()) {
            String name = child.name();
            if (name.equals("ArticleTitle") || name.equals("ArticleCaption")) {
                continue;
            }
            String text = child.text();
            if (!text.isEmpty()) {
                parts.add(text);
            }
        }
        if (parts.isEmpty()) {
            return caption != null ? caption : "";
        }
        return String.join("", parts);
    }

    // ============================================================
    // Paragraphs and items
    // ============================================================

    private Paragraph parseParagraph(MarkupElement element, int position) {
        int number = KanjiNumerals.parse(element.attribute("Num"));
        if (number == 0) {
            MarkupElement num = element.child("ParagraphNum");
            number = num != null ? KanjiNumerals.parse(num.text()) : 0;
        }
        if (number == 0) {
            number = position;
        }

        Paragraph.ParagraphBuilder builder = Paragraph.builder()
                .number(number)
                .implicit(false)
                .text(sentenceText(element.child("ParagraphSentence")));

        int itemPosition = 0;
        for (MarkupElement item : element.children("Item")) {
            builder.item(parseItem(item, 1, ++itemPosition));
        }
        return builder.build();
    }

    private Item parseItem(MarkupElement element, int level, int position) {
        String prefix = level == 1 ? "Item" : "Subitem" + (level - 1);
        MarkupElement titleElement = element.child(prefix + "Title");
        String label = titleElement != null ? titleElement.text() : null;

        int number = KanjiNumerals.parse(firstNumComponent(element.attribute("Num")));
        if (number == 0) {
            number = KanjiNumerals.parseItemLabel(label);
        }
        if (number == 0) {
            number = position;
        }

        Item.ItemBuilder builder = Item.builder()
                .level(level)
                .label(label)
                .number(number)
                .text(sentenceText(element.child(prefix + "Sentence")));

        int childPosition = 0;
        for (MarkupElement child : element.children("Subitem" + level)) {
            builder.child(parseItem(child, level + 1, ++childPosition));
        }
        return builder.build();
    }

    /**
     * Sentence text; columns of a tabular sentence are joined with an ideographic space.
     */
    private String sentenceText(MarkupElement sentence) {
        if (sentence == null) {
            return "";
        }
        List<MarkupElement> columns = sentence.children("Column");
        if (!columns.isEmpty()) {
            return columns.stream()
                    .map(MarkupElement::text)
                    .collect(Collectors.joining("　"));
        }
        return sentence.text();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static String firstNumComponent(String num) {
        if (num == null) {
            return null;
        }
        return num.split("[_:]")[0];
    }

    private static MarkupElement findFirst(List<MarkupElement> elements, String name) {
        for (MarkupElement element : elements) {
            if (element.name().equals(name)) {
                return element;
            }
            MarkupElement nested = element.find(name);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    private static List<MarkupElement> findAll(List<MarkupElement> elements, String name) {
        return elements.stream()
                .filter(e -> e.name().equals(name))
                .collect(Collectors.toList());
    }

    private static final class DivisionState {

        private final DivisionTag tag;
        private final Consumer<ParseWarning> warnings;
        private final Set<String> seen = new HashSet<>();
        private final List<Paragraph> loose = new ArrayList<>();

        private DivisionState(DivisionTag tag, Consumer<ParseWarning> warnings) {
            this.tag = tag;
            this.warnings = warnings;
        }

        private void warn(String message, String where) {
            warnings.accept(ParseWarning.of(WarningType.STRUCTURAL_PARSE, message, tag + " " + where));
        }
    }
}
