package com.lawgraph.model.document;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Item (号) and its nested subitems. Level 1 is the item itself,
 * level 2 a Subitem1, and so on.
 */
@Value
@Builder
public class Item {

    int level;

    String label;

    int number;

    String text;

    @Singular
    List<Item> children;
}
