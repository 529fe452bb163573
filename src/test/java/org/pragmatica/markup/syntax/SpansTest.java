package org.pragmatica.markup.syntax;

import org.junit.jupiter.api.Test;
import org.pragmatica.markup.Markup;
import org.pragmatica.markup.pretty.PrinterConfig;
import org.pragmatica.markup.testsupport.MarkupTestParser;
import org.pragmatica.markup.tree.SourceSpan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SpansTest {

    @Test
    void parsedTrees_carrySourceSpans() {
        var tree = MarkupTestParser.parse("ab {x + 1}");
        var embedded = (Node.Embedded) tree.nodes().get(2);

        assertThat(embedded.span().start().offset()).isEqualTo(3);
        assertThat(embedded.span().end().offset()).isEqualTo(10);
        assertThat(embedded.span().extract("ab {x + 1}")).isEqualTo("{x + 1}");
    }

    @Test
    void erase_makesDifferentlySpacedSourcesEqual() {
        var compact = MarkupTestParser.parse("{(1,2)}");
        var spaced = MarkupTestParser.parse("{ ( 1 , 2 ) }");

        assertThat(compact).isNotEqualTo(spaced);
        assertThat(Spans.erase(compact)).isEqualTo(Spans.erase(spaced));
        assertThat(Markup.structurallyEqual(compact, spaced)).isTrue();
    }

    @Test
    void erase_keepsStructure() {
        var tree = MarkupTestParser.parse("#for k, v #in d { #let y = not v; #[f a: k][x] }");
        var erased = Spans.erase(tree);

        assertThat(Markup.print(erased)).isEqualTo(Markup.print(tree));
        assertThat(erased.nodes().get(0).span()).isEqualTo(SourceSpan.DETACHED);
    }

    @Test
    void structuralEquality_detectsDifferences() {
        assertThat(Markup.structurallyEqual(MarkupTestParser.parse("{(1)}"), MarkupTestParser.parse("{(1,)}"))).isFalse();
        assertThat(Markup.structurallyEqual(MarkupTestParser.parse("{()}"), MarkupTestParser.parse("{(:)}"))).isFalse();
    }

    @Test
    void structuralEquality_isBoundedByNestingLimit() {
        var source = "{" + "(".repeat(20) + "1" + ")".repeat(20) + "}";
        var left = MarkupTestParser.parse(source);
        var right = MarkupTestParser.parse(source);

        assertThat(Markup.structurallyEqual(left, right)).isTrue();
        assertThatThrownBy(() -> Markup.structurallyEqual(left, right, new PrinterConfig(10)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("exceeds comparison limit of 10");
    }
}
