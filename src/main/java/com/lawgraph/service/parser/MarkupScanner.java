package com.lawgraph.service.parser;

import com.lawgraph.model.ParseWarning;
import com.lawgraph.model.WarningType;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.parser.Parser;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Depth-tracked scanner turning statute markup into a {@link MarkupElement} tree.
 *
 * <p>An element ends at the first close marker of the same name found at depth
 * zero: every further open marker of that exact name seen on the way raises the
 * depth, every close marker lowers it. Markers of other names never affect the
 * count, so {@code <ArticleCaption>} does not open an {@code <Article>}.
 * An element without a matching close marker is extended to the end of its
 * parent and flagged as unterminated; callers decide what to keep.
 */
@Slf4j
@Component
public class MarkupScanner {

    private static final Pattern MARKER = Pattern.compile(
            "<\\?.*?\\?>|<!--.*?-->|<!\\[CDATA\\[(.*?)]]>|<![^>]*>"
                    + "|<(/?)([A-Za-z_][\\w.:-]*)((?:\\s+[^<>]*?)?)\\s*(/?)>",
            Pattern.DOTALL);

    private static final Pattern ATTRIBUTE = Pattern.compile(
            "([A-Za-z_][\\w.:-]*)\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')");

    enum TokenType { OPEN, CLOSE, SELF_CLOSING, TEXT }

    record Token(TokenType type, String name, Map<String, String> attributes, String text) {
    }

    public record ScanResult(List<MarkupNode> nodes, List<ParseWarning> warnings) {

        /**
         * Top-level elements in document order.
         */
        public List<MarkupElement> elements() {
            List<MarkupElement> result = new ArrayList<>();
            for (MarkupNode node : nodes) {
                if (node instanceof MarkupElement element) {
                    result.add(element);
                }
            }
            return result;
        }
    }

    public ScanResult scan(String markup) {
        List<Token> tokens = tokenize(markup == null ? "" : markup);
        List<ParseWarning> warnings = new ArrayList<>();
        List<MarkupNode> nodes = build(tokens, 0, tokens.size(), warnings);
        log.debug("Scanned {} tokens into {} top-level nodes ({} warnings)",
                tokens.size(), nodes.size(), warnings.size());
        return new ScanResult(nodes, warnings);
    }

    // ============================================================
    // Tokenizing
    // ============================================================

    List<Token> tokenize(String markup) {
        List<Token> tokens = new ArrayList<>();
        Matcher m = MARKER.matcher(markup);
        int last = 0;
        while (m.find()) {
            if (m.start() > last) {
                addText(tokens, markup.substring(last, m.start()));
            }
            last = m.end();

            if (m.group(1) != null) {
                tokens.add(new Token(TokenType.TEXT, null, Map.of(), m.group(1)));
                continue;
            }
            String name = m.group(3);
            if (name == null) {
                // processing instruction, comment or doctype
                continue;
            }
            if (!m.group(2).isEmpty()) {
                tokens.add(new Token(TokenType.CLOSE, name, Map.of(), null));
            } else if (!m.group(5).isEmpty()) {
                tokens.add(new Token(TokenType.SELF_CLOSING, name, attributes(m.group(4)), null));
            } else {
                tokens.add(new Token(TokenType.OPEN, name, attributes(m.group(4)), null));
            }
        }
        if (last < markup.length()) {
            addText(tokens, markup.substring(last));
        }
        return tokens;
    }

    private void addText(List<Token> tokens, String raw) {
        if (raw.isBlank()) {
            return;
        }
        tokens.add(new Token(TokenType.TEXT, null, Map.of(), Parser.unescapeEntities(raw.strip(), false)));
    }

    private Map<String, String> attributes(String raw) {
        Map<String, String> result = new LinkedHashMap<>();
        if (raw == null || raw.isBlank()) {
            return result;
        }
        Matcher m = ATTRIBUTE.matcher(raw);
        while (m.find()) {
            String value = m.group(2) != null ? m.group(2) : m.group(3);
            result.put(m.group(1), Parser.unescapeEntities(value, true));
        }
        return result;
    }

    // ============================================================
    // Tree building
    // ============================================================

    private List<MarkupNode> build(List<Token> tokens, int from, int to, List<ParseWarning> warnings) {
        List<MarkupNode> nodes = new ArrayList<>();
        int i = from;
        while (i < to) {
            Token token = tokens.get(i);
            switch (token.type()) {
                case TEXT -> {
                    nodes.add(new MarkupText(token.text()));
                    i++;
                }
                case SELF_CLOSING -> {
                    nodes.add(new MarkupElement(token.name(), token.attributes(), List.of(), true));
                    i++;
                }
                case CLOSE -> {
                    warnings.add(ParseWarning.of(WarningType.STRUCTURAL_PARSE,
                            "Unmatched close marker </" + token.name() + "> ignored", "token " + i));
                    i++;
                }
                case OPEN -> {
                    int close = findClosing(tokens, i, to);
                    if (close < 0) {
                        warnings.add(ParseWarning.of(WarningType.STRUCTURAL_PARSE,
                                "Unterminated element <" + token.name() + ">", "token " + i));
                        int end = nextOpening(tokens, i, to);
                        nodes.add(new MarkupElement(token.name(), token.attributes(),
                                build(tokens, i + 1, end, warnings), false));
                        i = end;
                    } else {
                        nodes.add(new MarkupElement(token.name(), token.attributes(),
                                build(tokens, i + 1, close, warnings), true));
                        i = close + 1;
                    }
                }
                default -> throw new IllegalStateException("Unknown token type: " + token.type());
            }
        }
        return nodes;
    }

    /**
     * Index of the close marker matching the open marker at {@code open}, or -1.
     */
    int findClosing(List<Token> tokens, int open, int limit) {
        String name = tokens.get(open).name();
        int depth = 0;
        for (int i = open + 1; i < limit; i++) {
            Token token = tokens.get(i);
            if (!name.equals(token.name())) {
                continue;
            }
            if (token.type() == TokenType.OPEN) {
                depth++;
            } else if (token.type() == TokenType.CLOSE) {
                if (depth == 0) {
                    return i;
                }
                depth--;
            }
        }
        return -1;
    }

    /**
     * An unterminated element stops where the next sibling of the same name
     * opens, so one broken article does not swallow the ones after it.
     */
    private int nextOpening(List<Token> tokens, int open, int limit) {
        String name = tokens.get(open).name();
        for (int i = open + 1; i < limit; i++) {
            Token token = tokens.get(i);
            if (token.type() == TokenType.OPEN && name.equals(token.name())) {
                return i;
            }
        }
        return limit;
    }
}
