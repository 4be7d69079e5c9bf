package com.lawgraph.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KanjiNumeralsTest {

    @Test
    void shouldParseKanjiWithPlaceValues() {
        assertThat(KanjiNumerals.parse("一")).isEqualTo(1);
        assertThat(KanjiNumerals.parse("十")).isEqualTo(10);
        assertThat(KanjiNumerals.parse("三十二")).isEqualTo(32);
        assertThat(KanjiNumerals.parse("百")).isEqualTo(100);
        assertThat(KanjiNumerals.parse("七百九")).isEqualTo(709);
        assertThat(KanjiNumerals.parse("千二百三十四")).isEqualTo(1234);
        assertThat(KanjiNumerals.parse("一万二千")).isEqualTo(12000);
    }

    @Test
    void shouldParseDigitForms() {
        assertThat(KanjiNumerals.parse("２５")).isEqualTo(25);
        assertThat(KanjiNumerals.parse("42")).isEqualTo(42);
        assertThat(KanjiNumerals.parse("二〇")).isEqualTo(20);
    }

    @Test
    void shouldReturnZero_whenUnparseable() {
        assertThat(KanjiNumerals.parse(null)).isZero();
        assertThat(KanjiNumerals.parse("")).isZero();
        assertThat(KanjiNumerals.parse("条")).isZero();
        assertThat(KanjiNumerals.parse("99999999999")).isZero();
    }

    @Test
    void shouldFormatAsStatuteNumerals() {
        assertThat(KanjiNumerals.format(1)).isEqualTo("一");
        assertThat(KanjiNumerals.format(10)).isEqualTo("十");
        assertThat(KanjiNumerals.format(32)).isEqualTo("三十二");
        assertThat(KanjiNumerals.format(110)).isEqualTo("百十");
        assertThat(KanjiNumerals.format(1234)).isEqualTo("千二百三十四");
    }

    @Test
    void shouldRoundTripArticleRange() {
        List<Integer> failures = new ArrayList<>();
        for (int n = 1; n <= 99_999; n++) {
            if (KanjiNumerals.parse(KanjiNumerals.format(n)) != n) {
                failures.add(n);
            }
        }
        assertThat(failures).isEmpty();
    }

    @Test
    void shouldRejectNegativeFormat() {
        assertThatThrownBy(() -> KanjiNumerals.format(-1)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldParseItemLabels() {
        assertThat(KanjiNumerals.parseItemLabel("三")).isEqualTo(3);
        assertThat(KanjiNumerals.parseItemLabel("イ")).isEqualTo(1);
        assertThat(KanjiNumerals.parseItemLabel("ハ")).isEqualTo(3);
        assertThat(KanjiNumerals.parseItemLabel("（２）")).isEqualTo(2);
        assertThat(KanjiNumerals.parseItemLabel(null)).isZero();
    }
}
