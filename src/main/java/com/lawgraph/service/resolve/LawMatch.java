package com.lawgraph.service.resolve;

import com.lawgraph.model.citation.ResolutionMethod;
import com.lawgraph.model.law.LawIdentity;

/**
 * Outcome of resolving a law name: the identity, the dictionary string that
 * matched, and which lookup step produced it.
 */
public record LawMatch(LawIdentity identity, String matchedName, MatchType type) {

    public enum MatchType {
        PROMULGATION_NUMBER,
        PRIMARY_NAME,
        ALIAS,
        SUBSTRING
    }

    public String lawId() {
        return identity.id();
    }

    /**
     * Exact name and promulgation-number hits are direct; alias and substring hits go through the table.
     */
    public ResolutionMethod method() {
        return switch (type) {
            case PROMULGATION_NUMBER, PRIMARY_NAME -> ResolutionMethod.DIRECT_PATTERN;
            case ALIAS, SUBSTRING -> ResolutionMethod.DICTIONARY;
        };
    }
}
