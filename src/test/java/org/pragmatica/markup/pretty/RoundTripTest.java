package org.pragmatica.markup.pretty;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pragmatica.markup.Markup;
import org.pragmatica.markup.testsupport.MarkupTestParser;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Parse, print and compare against expected source text.
 */
class RoundTripTest {

    private static String reprint(String source) {
        return Markup.print(MarkupTestParser.parse(source));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "{none}", "{hi}", "{true}", "{10}", "{3.14}", "{10.0pt}", "{14.1deg}", "{20.0%}", "{#abcdef}", "{\"hi\"}", "{1e23}", "{5e-324}", "{2.82879384806159e17}"
    })
    void literals_printInCanonicalForm(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{()}", "{(1,)}", "{(1, 2, 3)}", "{(:)}", "{(key: value)}", "{(a: 1, b: 2)}"})
    void collections_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"[]", "[*Ok*]", "{[f]}", "{(1)}", "{}", "{1}", "{ #let x = 1; x += 2; x + 1 }", "[{}]"})
    void templatesGroupsAndBlocks_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{-x}", "{not true}", "{1 + 3}", "{a = b += 1}", "{(1 + 2) * 3}", "{not a and b or c}"})
    void operators_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"{v()}", "{v(1)}", "{v(a: 1, b)}", "{f(1)(2)}"})
    void parenthesizedCalls_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"#[v]", "#[v 1]", "#[v 1, 2][*Ok*]", "#[v 1 | f 2]", "#[v | f | g 3]", "#[v a: 1 | f][body]"})
    void bracketedCalls_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"#let x = 1 + 2", "#let y", "#if x [y] #else [z]", "#if x {y}", "#for x #in y {z}", "#for k, x #in y {z}"})
    void keywords_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @ParameterizedTest
    @ValueSource(strings = {"*", "_", " ", "\\ ", "\n\n", "hi", "hi *there* _you_"})
    void markup_roundTrip(String source) {
        assertThat(reprint(source)).isEqualTo(source);
    }

    @Test
    void bracketCallInsideBlock_collapsesToParenthesizedForm() {
        assertThat(reprint("{#[v]}")).isEqualTo("{v()}");
    }

    @Test
    void nestedBracketCall_foldsIntoChain() {
        assertThat(reprint("#[v 1, #[f 2]]")).isEqualTo("#[v 1 | f 2]");
    }

    @Test
    void doublyNestedBracketCall_foldsThroughTwoSegments() {
        assertThat(reprint("#[v 1, #[f 2, #[g 3]]]")).isEqualTo("#[v 1 | f 2 | g 3]");
    }

    @Test
    void templateArgument_becomesAttachedBody() {
        assertThat(reprint("#[v 1, [Hi]]")).isEqualTo("#[v 1][Hi]");
    }

    @Test
    void quoteEscapes_areKeptWithoutOverEscaping() {
        assertThat(reprint("{\"let's \\\" go\"}")).isEqualTo("{\"let's \\\" go\"}");
    }

    @Test
    void whitespaceRuns_normalize() {
        assertThat(reprint("a   b")).isEqualTo("a b");
        assertThat(reprint("a\n\n\nb")).isEqualTo("a\n\nb");
        assertThat(reprint("{  1  ;2 }")).isEqualTo("{ 1; 2 }");
    }

    @Test
    void floats_normalizeToShortestForm() {
        assertThat(reprint("{1.50}")).isEqualTo("{1.5}");
        assertThat(reprint("{3pt}")).isEqualTo("{3.0pt}");
        assertThat(reprint("{1e21}")).isEqualTo("{1e21}");
        assertThat(reprint("{0.0000001}")).isEqualTo("{1e-7}");
    }

    @Test
    void shortColor_expandsToSixDigits() {
        assertThat(reprint("{#abc}")).isEqualTo("{#aabbcc}");
    }
}
