package com.lawgraph.service.parser;

public record MarkupText(String value) implements MarkupNode {
}
