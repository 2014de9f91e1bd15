package com.visprog.generator.codegen.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class NamingUtilTest {

    @ParameterizedTest
    @CsvSource({
            "моя функция, moya_funktsiya",
            "функция!, funktsiya",
            "Привет, Privet",
            "Щука-2!, Schuka2",
            "съешь, sesh",
            "getMinMax, getMinMax"
    })
    void testTransliterate(String input, String expected) {
        assertThat(NamingUtil.transliterate(input)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"abc", "snake_case_1", "Mixed_Case", "_x9"})
    void testTransliterateIsIdentityOnSafeText(String text) {
        assertThat(NamingUtil.transliterate(text)).isEqualTo(text);
        assertThat(NamingUtil.transliterate(NamingUtil.transliterate(text))).isEqualTo(text);
    }

    @Test
    void testTransliterateNeverThrows() {
        assertThat(NamingUtil.transliterate(null)).isEmpty();
        assertThat(NamingUtil.transliterate("")).isEmpty();
        assertThat(NamingUtil.transliterate("日本")).isEmpty();
    }

    @Test
    void testToValidIdentifier() {
        assertThat(NamingUtil.toValidIdentifier("Player  Score")).isEqualTo("player_score");
        assertThat(NamingUtil.toValidIdentifier("2nd try")).isEqualTo("var_2nd_try");
        assertThat(NamingUtil.toValidIdentifier("!!!")).isEqualTo("unnamed");
        assertThat(NamingUtil.toValidIdentifier(null)).isEqualTo("unnamed");
        assertThat(NamingUtil.toValidIdentifier("Счётчик")).isEqualTo("schyotchik");
    }

    @Test
    void testNodeSuffix() {
        assertThat(NamingUtil.nodeSuffix("node-1a2b3c4d")).isEqualTo("2b3c4d");
        assertThat(NamingUtil.nodeSuffix("n-1")).isEqualTo("n1");
        assertThat(NamingUtil.nodeSuffix(null)).isEmpty();
    }

    @Test
    void testCleanId() {
        assertThat(NamingUtil.cleanId("node-sqrt-01", 8)).isEqualTo("_sqrt_01");
        assertThat(NamingUtil.cleanId("a.b", 8)).isEqualTo("a_b");
    }
}
