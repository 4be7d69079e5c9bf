package com.lawgraph.service.context;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Terms defined with 以下「X」という, valid for the rest of the law.
 * A later definition of the same term does not replace an earlier one; each
 * reference sees the nearest definition made before it.
 */
public class AliasRegistry {

    public record AliasDefinition(String term, String referent, String lawId, int offset) {
    }

    private final Map<String, List<AliasDefinition>> definitions = new LinkedHashMap<>();

    public void define(String term, String referent, String lawId, int offset) {
        definitions.computeIfAbsent(term, t -> new ArrayList<>())
                .add(new AliasDefinition(term, referent, lawId, offset));
    }

    public Optional<AliasDefinition> lookup(String term, int offset) {
        AliasDefinition best = null;
        for (AliasDefinition definition : definitions.getOrDefault(term, List.of())) {
            if (definition.offset() < offset && (best == null || definition.offset() > best.offset())) {
                best = definition;
            }
        }
        return Optional.ofNullable(best);
    }

    public Set<String> terms() {
        return Collections.unmodifiableSet(definitions.keySet());
    }
}
