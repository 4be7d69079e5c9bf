package com.lawgraph.model.document;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class Paragraph {

    int number;

    /**
     * True when the article had no explicit paragraph element.
     */
    boolean implicit;

    String text;

    @Singular
    List<Item> items;
}
