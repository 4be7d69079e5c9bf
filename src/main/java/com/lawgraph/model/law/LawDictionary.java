package com.lawgraph.model.law;

import com.lawgraph.util.KanjiNumerals;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable, insertion-ordered table of law identities. Built once and
 * shared by reference between all extraction workers.
 */
public final class LawDictionary {

    private static final Pattern NUMERAL_RUN = Pattern.compile("[〇一二三四五六七八九十百千万０-９0-9]+");

    private static final LawDictionary EMPTY = new LawDictionary(List.of());

    private final List<LawIdentity> entries;
    private final Map<String, LawIdentity> byId = new LinkedHashMap<>();
    private final Map<String, LawIdentity> byName = new LinkedHashMap<>();
    private final Map<String, LawIdentity> byAlias = new LinkedHashMap<>();
    private final Map<String, LawIdentity> byPromulgation = new LinkedHashMap<>();

    private LawDictionary(List<LawIdentity> entries) {
        this.entries = List.copyOf(entries);
        for (LawIdentity identity : this.entries) {
            byId.putIfAbsent(identity.id(), identity);
            byName.putIfAbsent(identity.name(), identity);
            for (String alias : identity.aliases()) {
                byAlias.putIfAbsent(alias, identity);
            }
            if (identity.promulgationNumber() != null && !identity.promulgationNumber().isBlank()) {
                byPromulgation.putIfAbsent(normalizePromulgation(identity.promulgationNumber()), identity);
            }
        }
    }

    public static LawDictionary of(List<LawIdentity> entries) {
        return new LawDictionary(entries);
    }

    public static LawDictionary empty() {
        return EMPTY;
    }

    public List<LawIdentity> entries() {
        return entries;
    }

    public int size() {
        return entries.size();
    }

    public Optional<LawIdentity> findById(String id) {
        return Optional.ofNullable(byId.get(id));
    }

    public Optional<LawIdentity> findByName(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public Optional<LawIdentity> findByAlias(String alias) {
        return Optional.ofNullable(byAlias.get(alias));
    }

    public Optional<LawIdentity> findByPromulgationNumber(String promulgationNumber) {
        if (promulgationNumber == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPromulgation.get(normalizePromulgation(promulgationNumber)));
    }

    public Map<String, LawIdentity> aliasTable() {
        return Collections.unmodifiableMap(byAlias);
    }

    /**
     * Promulgation numbers compare with numerals in Arabic form and without
     * whitespace, so 平成十五年法律第五十七号 equals 平成15年法律第57号.
     */
    static String normalizePromulgation(String text) {
        String s = text.replaceAll("[\\s　]", "").replace("元年", "1年");
        Matcher m = NUMERAL_RUN.matcher(s);
        StringBuilder sb = new StringBuilder();
        while (m.find()) {
            m.appendReplacement(sb, String.valueOf(KanjiNumerals.parse(m.group())));
        }
        m.appendTail(sb);
        return sb.toString();
    }
}
