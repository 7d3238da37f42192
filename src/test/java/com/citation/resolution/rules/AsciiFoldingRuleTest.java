package com.citation.resolution.rules;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AsciiFoldingRule Tests")
class AsciiFoldingRuleTest {

    private final AsciiFoldingRule rule = new AsciiFoldingRule();

    @ParameterizedTest
    @CsvSource(delimiter = '|', quoteCharacter = '~', value = {
            "Schrödinger | Schr{\\\"o}dinger",
            "Poincaré | Poincar{\\'e}",
            "Gauß | Gau{\\ss}",
            "Łukasz | {\\L}ukasz",
            "Čech | {\\v{C}}ech",
            "Çelik | {\\c{C}}elik",
            "Ørsted | {\\O}rsted"
    })
    @DisplayName("Maps accented letters to BibTeX macros")
    void foldsLetters(String input, String expected) {
        assertEquals(expected, rule.apply(input));
    }

    @Test
    @DisplayName("Dotless i is used under accents")
    void dotlessI() {
        assertEquals("Na{\\\"\\i}ve", rule.apply("Naïve"));
    }

    @Test
    @DisplayName("Typographic punctuation becomes TeX ligatures")
    void punctuation() {
        assertEquals("pp. 1--10 ``quoted''", rule.apply("pp. 1–10 “quoted”"));
    }

    @Test
    @DisplayName("ASCII text is returned unchanged")
    void asciiUnchanged() {
        String entry = "@article{X,\n  title = {Plain}\n}";
        assertSame(entry, rule.apply(entry));
    }

    @Test
    @DisplayName("Characters without a mapping are kept")
    void unmapped() {
        assertEquals("α decay", rule.apply("α decay"));
    }

    @Test
    @DisplayName("Leaves the citation key in the header alone")
    void keepsKey() {
        assertEquals("@article{Gödel:1931ab,\n  author = {G{\\\"o}del, K.}\n}",
                rule.apply("@article{Gödel:1931ab,\n  author = {Gödel, K.}\n}"));
    }
}
