package com.lawgraph.service.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Element of the scanned markup tree. An element whose close marker was
 * never found is kept with {@code terminated == false}.
 */
public final class MarkupElement implements MarkupNode {

    /** Phonetic annotations that must not leak into statute text. */
    private static final Set<String> SKIPPED_IN_TEXT = Set.of("Rt");

    private final String name;
    private final Map<String, String> attributes;
    private final List<MarkupNode> content;
    private final boolean terminated;

    public MarkupElement(String name, Map<String, String> attributes, List<MarkupNode> content, boolean terminated) {
        this.name = name;
        this.attributes = Map.copyOf(attributes);
        this.content = List.copyOf(content);
        this.terminated = terminated;
    }

    public String name() {
        return name;
    }

    public String attribute(String key) {
        return attributes.get(key);
    }

    public Map<String, String> attributes() {
        return attributes;
    }

    public List<MarkupNode> content() {
        return content;
    }

    public boolean isTerminated() {
        return terminated;
    }

    public List<MarkupElement> elements() {
        List<MarkupElement> result = new ArrayList<>();
        for (MarkupNode node : content) {
            if (node instanceof MarkupElement element) {
                result.add(element);
            }
        }
        return Collections.unmodifiableList(result);
    }

    public List<MarkupElement> children(String childName) {
        return elements().stream()
                .filter(e -> e.name.equals(childName))
                .collect(Collectors.toList());
    }

    /**
     * First direct child with the given name, or null.
     */
    public MarkupElement child(String childName) {
        for (MarkupNode node : content) {
            if (node instanceof MarkupElement element && element.name.equals(childName)) {
                return element;
            }
        }
        return null;
    }

    /**
     * First descendant with the given name in document order, or null.
     */
    public MarkupElement find(String descendantName) {
        for (MarkupNode node : content) {
            if (node instanceof MarkupElement element) {
                if (element.name.equals(descendantName)) {
                    return element;
                }
                MarkupElement nested = element.find(descendantName);
                if (nested != null) {
                    return nested;
                }
            }
        }
        return null;
    }

    /**
     * Concatenated text of all descendants, ruby readings excluded, trimmed.
     */
    public String text() {
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString().trim();
    }

    private void appendText(StringBuilder sb) {
        for (MarkupNode node : content) {
            if (node instanceof MarkupText text) {
                sb.append(text.value());
            } else if (node instanceof MarkupElement element && !SKIPPED_IN_TEXT.contains(element.name)) {
                element.appendText(sb);
            }
        }
    }

    @Override
    public String toString() {
        return "<" + name + (terminated ? "" : " (unterminated)") + ">";
    }
}
