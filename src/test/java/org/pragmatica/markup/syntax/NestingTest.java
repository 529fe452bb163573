package org.pragmatica.markup.syntax;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.pragmatica.markup.testsupport.Trees.*;
import static org.pragmatica.markup.tree.SourceSpan.DETACHED;

class NestingTest {

    @Test
    void depth_ofLeafIsOne() {
        assertEquals(1, Nesting.depth(integer(1)));
        assertEquals(0, Nesting.depth(Tree.EMPTY));
    }

    @Test
    void depth_followsDeepestBranch() {
        var expr = binary(integer(1), BinOp.ADD, group(unary(UnOp.NEG, ident("x"))));

        assertEquals(4, Nesting.depth(expr));
    }

    @Test
    void depth_descendsIntoTemplatesAndArguments() {
        var inner = template(text("a"), embed(call("f", pos(array(integer(1))))));
        var let = new Expr.Let(DETACHED, ident("x"), Optional.of(inner));

        assertEquals(5, Nesting.depth(tree(embed(let))));
    }

    @Test
    void depth_ofVeryDeepTree_doesNotOverflowStack() {
        Expr expr = integer(1);
        for (int i = 0; i < 100_000; i++) {
            expr = group(expr);
        }

        assertEquals(100_001, Nesting.depth(expr));
    }

    @Test
    void children_areInSourceOrder() {
        var anIf = new Expr.If(DETACHED, ident("c"), ident("t"), Optional.of(ident("e")));

        assertEquals(java.util.List.of(ident("c"), ident("t"), ident("e")), Nesting.children(anIf));
        assertTrue(Nesting.children(new Expr.Let(DETACHED, ident("x"), Optional.empty())).isEmpty());
    }

    @Test
    void foldedDepth_countsBracketedChainAsOneLevel() {
        Expr chain = call("z");
        for (int i = 0; i < 600; i++) {
            chain = call("c" + i, pos(integer(i)), pos(chain));
        }
        var markup = tree(embed(chain));

        assertEquals(2, Nesting.foldedDepth(markup));
        assertEquals(602, Nesting.depth(markup));
        assertEquals(602, Nesting.foldedDepth(chain));
    }

    @Test
    void foldedDepth_stillCountsTemplateBodies() {
        var inner = call("g", pos(template(embed(call("h", pos(integer(1)))))));
        var markup = tree(embed(call("f", pos(inner))));

        assertEquals(4, Nesting.foldedDepth(markup));
    }
}
