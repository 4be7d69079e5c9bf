package com.lawgraph.model.document;

import com.lawgraph.model.ParseWarning;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * One parsed law: its main body and supplementary provisions.
 */
@Value
@Builder
public class Document {

    String lawTitle;

    String lawNum;

    @Singular
    List<Division> divisions;

    @Singular
    List<ParseWarning> warnings;

    public Division mainBody() {
        return divisions.stream()
                .filter(d -> !d.getTag().isSupplementary())
                .findFirst()
                .orElse(null);
    }

    public List<Division> supplementaryProvisions() {
        return divisions.stream()
                .filter(d -> d.getTag().isSupplementary())
                .collect(Collectors.toList());
    }

    public List<Article> allArticles() {
        return divisions.stream()
                .flatMap(d -> d.articles().stream())
                .collect(Collectors.toList());
    }

    public int articleCount() {
        return divisions.stream().mapToInt(d -> d.articles().size()).sum();
    }
}
