package com.lawgraph.service.resolve;

import com.lawgraph.model.law.LawDictionary;
import com.lawgraph.model.law.LawIdentity;
import lombok.Getter;

import java.util.Optional;

/**
 * Maps a law name, abbreviation or promulgation number to a canonical law id.
 *
 * <p>Lookup order: promulgation number, primary name, alias, then substring
 * containment in either direction as a last resort, first dictionary entry
 * wins. No fuzzy matching. Immutable and safe to share between threads.
 */
public class LawIdentityResolver {

    /** Shorter strings match too much by containment. */
    static final int MIN_SUBSTRING_LENGTH = 2;

    @Getter
    private final LawDictionary dictionary;

    public LawIdentityResolver(LawDictionary dictionary) {
        this.dictionary = dictionary;
    }

    public Optional<String> resolve(String name) {
        return resolveMatch(name).map(LawMatch::lawId);
    }

    public Optional<LawMatch> resolveMatch(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String query = name.strip();
        if (query.isEmpty()) {
            return Optional.empty();
        }

        Optional<LawIdentity> byNumber = dictionary.findByPromulgationNumber(query);
        if (byNumber.isPresent()) {
            return Optional.of(new LawMatch(byNumber.get(), query, LawMatch.MatchType.PROMULGATION_NUMBER));
        }
        Optional<LawIdentity> byName = dictionary.findByName(query);
        if (byName.isPresent()) {
            return Optional.of(new LawMatch(byName.get(), query, LawMatch.MatchType.PRIMARY_NAME));
        }
        Optional<LawIdentity> byAlias = dictionary.findByAlias(query);
        if (byAlias.isPresent()) {
            return Optional.of(new LawMatch(byAlias.get(), query, LawMatch.MatchType.ALIAS));
        }
        return resolveBySubstring(query);
    }

    public Optional<LawIdentity> findById(String id) {
        return dictionary.findById(id);
    }

    private Optional<LawMatch> resolveBySubstring(String query) {
        if (query.length() < MIN_SUBSTRING_LENGTH) {
            return Optional.empty();
        }
        for (LawIdentity identity : dictionary.entries()) {
            if (containsEitherWay(identity.name(), query)) {
                return Optional.of(new LawMatch(identity, identity.name(), LawMatch.MatchType.SUBSTRING));
            }
            for (String alias : identity.aliases()) {
                if (containsEitherWay(alias, query)) {
                    return Optional.of(new LawMatch(identity, alias, LawMatch.MatchType.SUBSTRING));
                }
            }
        }
        return Optional.empty();
    }

    private static boolean containsEitherWay(String known, String query) {
        if (known == null || known.length() < MIN_SUBSTRING_LENGTH) {
            return false;
        }
        return known.contains(query) || query.contains(known);
    }
}
