package com.lawgraph.model.law;

import lombok.Builder;
import lombok.Singular;

import java.util.Set;

/**
 * Canonical identity of a law as listed in the law dictionary.
 */
@Builder
public record LawIdentity(String id, String name, @Singular Set<String> aliases, String promulgationNumber) {

    public LawIdentity {
        aliases = aliases == null ? Set.of() : Set.copyOf(aliases);
    }
}
