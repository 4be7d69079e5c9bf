package com.lawgraph.util;

/**
 * Conversion between Japanese numeral text and integers.
 *
 * Accepts kanji digits, kanji place-value characters (十 百 千 万),
 * full-width digits and ASCII digits, in any mix. Stateless, safe to
 * share between threads.
 */
public final class KanjiNumerals {

    private static final String KANJI_DIGITS = "〇一二三四五六七八九";

    private static final String IROHA =
            "イロハニホヘトチリヌルヲワカヨタレソツネナラムウヰノオクヤマケフコエテアサキユメミシヱヒモセス";

    private static final int MAX_FORMATTABLE = 99_999_999;

    private KanjiNumerals() {
    }

    /**
     * Parse numeral text.
     * Returns 0 for empty or unparseable input instead of failing.
     */
    public static int parse(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }

        long result = 0;
        long segment = 0;
        long pending = -1;

        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);

            int digit = digitValue(c);
            if (digit >= 0) {
                pending = pending < 0 ? digit : pending * 10 + digit;
                if (pending > Integer.MAX_VALUE) {
                    return 0;
                }
                continue;
            }

            if (c == '万') {
                long value = segment + Math.max(pending, 0);
                result += (value == 0 ? 1 : value) * 10_000L;
                segment = 0;
                pending = -1;
                continue;
            }

            int unit = unitValue(c);
            if (unit > 0) {
                segment += (pending < 0 ? 1 : pending) * unit;
                pending = -1;
                continue;
            }

            if (Character.isWhitespace(c) || c == '　') {
                continue;
            }
            return 0;
        }

        long total = result + segment + Math.max(pending, 0);
        return total > Integer.MAX_VALUE ? 0 : (int) total;
    }

    /**
     * Format a positive integer as kanji numeral text (十 for 10, 百 for 100,
     * 一万 for 10000), the way statute text writes article numbers.
     */
    public static String format(int n) {
        if (n < 0 || n > MAX_FORMATTABLE) {
            throw new IllegalArgumentException("Numeral out of range: " + n);
        }
        if (n == 0) {
            return "〇";
        }

        StringBuilder sb = new StringBuilder();
        int high = n / 10_000;
        int low = n % 10_000;
        if (high > 0) {
            sb.append(formatBelowTenThousand(high, true)).append('万');
        }
        if (low > 0) {
            sb.append(formatBelowTenThousand(low, false));
        }
        return sb.toString();
    }

    /**
     * Ordinal of an item label such as 一, （１）, イ or ロ.
     * Returns 0 when the label carries no recognisable ordinal.
     */
    public static int parseItemLabel(String label) {
        if (label == null) {
            return 0;
        }
        String s = label.replaceAll("[\\s　（）()〔〕]", "");
        if (s.isEmpty()) {
            return 0;
        }
        if (s.length() == 1) {
            int iroha = IROHA.indexOf(s.charAt(0));
            if (iroha >= 0) {
                return iroha + 1;
            }
        }
        return parse(s);
    }

    public static boolean isNumeralChar(char c) {
        return digitValue(c) >= 0 || unitValue(c) > 0 || c == '万';
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static String formatBelowTenThousand(int n, boolean explicitOne) {
        StringBuilder sb = new StringBuilder();
        int[] units = {1000, 100, 10};
        char[] names = {'千', '百', '十'};

        int rest = n;
        for (int i = 0; i < units.length; i++) {
            int d = rest / units[i];
            rest %= units[i];
            if (d == 0) {
                continue;
            }
            if (d > 1 || (explicitOne && sb.length() == 0 && units[i] == 1000)) {
                sb.append(KANJI_DIGITS.charAt(d));
            }
            sb.append(names[i]);
        }
        if (rest > 0) {
            sb.append(KANJI_DIGITS.charAt(rest));
        }
        return sb.toString();
    }

    private static int digitValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= '０' && c <= '９') {
            return c - '０';
        }
        if (c == '零') {
            return 0;
        }
        return KANJI_DIGITS.indexOf(c);
    }

    private static int unitValue(char c) {
        switch (c) {
            case '十':
                return 10;
            case '百':
                return 100;
            case '千':
                return 1000;
            default:
                return 0;
        }
    }
}
