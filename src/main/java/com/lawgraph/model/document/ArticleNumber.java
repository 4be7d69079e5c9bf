package com.lawgraph.model.document;

import com.lawgraph.util.KanjiNumerals;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Article numeral with optional branch numbers (第三十二条の二 is base 32, branches [2]).
 */
public record ArticleNumber(int base, List<Integer> branches) implements Comparable<ArticleNumber> {

    private static final Pattern BRANCH = Pattern.compile("の([〇一二三四五六七八九十百千万０-９0-9]+)");

    public ArticleNumber {
        branches = branches == null ? List.of() : List.copyOf(branches);
    }

    public static ArticleNumber of(int base, Integer... branches) {
        return new ArticleNumber(base, List.of(branches));
    }

    /**
     * Parse the e-Gov {@code Num} attribute form: "32", "32_2", "32_2_3".
     * A deleted-range form such as "5:7" yields its first article.
     */
    public static ArticleNumber fromNumAttribute(String num) {
        if (num == null || num.isBlank()) {
            return of(0);
        }
        String head = num.split(":")[0].trim();
        String[] parts = head.split("_");
        List<Integer> branches = new ArrayList<>();
        for (int i = 1; i < parts.length; i++) {
            branches.add(KanjiNumerals.parse(parts[i]));
        }
        return new ArticleNumber(KanjiNumerals.parse(parts[0]), branches);
    }

    /**
     * Parse a base numeral plus branch suffix as written in text, e.g. "三十二" and "の二の三".
     */
    public static ArticleNumber fromText(String baseNumeral, String branchSuffix) {
        List<Integer> branches = new ArrayList<>();
        if (branchSuffix != null && !branchSuffix.isEmpty()) {
            Matcher m = BRANCH.matcher(branchSuffix);
            while (m.find()) {
                branches.add(KanjiNumerals.parse(m.group(1)));
            }
        }
        return new ArticleNumber(KanjiNumerals.parse(baseNumeral), branches);
    }

    public boolean hasBranch() {
        return !branches.isEmpty();
    }

    public int firstBranch() {
        return hasBranch() ? branches.get(0) : 1;
    }

    public ArticleNumber baseArticle() {
        return of(base);
    }

    public ArticleNumber withBranch(int branch) {
        return new ArticleNumber(base, List.of(branch));
    }

    /**
     * True when every component parsed to a positive number.
     */
    public boolean isValid() {
        return base > 0 && branches.stream().allMatch(b -> b > 0);
    }

    /**
     * Stable key used for graph node ids: "32", "32-2".
     */
    public String key() {
        if (!hasBranch()) {
            return String.valueOf(base);
        }
        return base + "-" + branches.stream().map(String::valueOf).collect(Collectors.joining("-"));
    }

    /**
     * Statute display form: 第三十二条の二.
     */
    public String display() {
        StringBuilder sb = new StringBuilder("第").append(KanjiNumerals.format(base)).append('条');
        for (Integer b : branches) {
            sb.append('の').append(KanjiNumerals.format(b));
        }
        return sb.toString();
    }

    @Override
    public int compareTo(ArticleNumber other) {
        int c = Integer.compare(base, other.base);
        if (c != 0) {
            return c;
        }
        int n = Math.min(branches.size(), other.branches.size());
        for (int i = 0; i < n; i++) {
            c = Integer.compare(branches.get(i), other.branches.get(i));
            if (c != 0) {
                return c;
            }
        }
        return Integer.compare(branches.size(), other.branches.size());
    }

    @Override
    public String toString() {
        return key();
    }
}
