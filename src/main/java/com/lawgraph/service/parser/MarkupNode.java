package com.lawgraph.service.parser;

/**
 * Node of the scanned markup tree: an element or a run of text.
 */
public sealed interface MarkupNode permits MarkupElement, MarkupText {
}
