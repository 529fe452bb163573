package org.pragmatica.markup.syntax;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class OperatorTableTest {

    @ParameterizedTest
    @EnumSource(BinOp.class)
    void binaryOperator_spellingMapsBackToSameOperator(BinOp op) {
        var token = Token.fromText(op.text());

        assertTrue(token.isPresent(), () -> "No token spelled " + op.text());
        assertEquals(Optional.of(op), BinOp.fromToken(token.get()));
    }

    @ParameterizedTest
    @EnumSource(UnOp.class)
    void unaryOperator_spellingMapsBackToSameOperator(UnOp op) {
        var token = Token.fromText(op.text());

        assertTrue(token.isPresent());
        assertEquals(Optional.of(op), UnOp.fromToken(token.get()));
    }

    @ParameterizedTest
    @EnumSource(Token.class)
    void everyOperatorToken_spellsItsOperator(Token token) {
        BinOp.fromToken(token)
             .ifPresent(op -> assertEquals(token.text(), op.text()));
        UnOp.fromToken(token)
            .ifPresent(op -> assertEquals(token.text(), op.text()));
    }

    @Test
    void nonOperatorTokens_areNoMatch() {
        assertThat(BinOp.fromToken(Token.LEFT_PAREN)).isEmpty();
        assertThat(BinOp.fromToken(Token.NOT)).isEmpty();
        assertThat(BinOp.fromToken(Token.PIPE)).isEmpty();
        assertThat(UnOp.fromToken(Token.STAR)).isEmpty();
        assertThat(UnOp.fromToken(Token.LET)).isEmpty();
    }

    @Test
    void operatorsSharingRank_shareAssociativity() {
        for (var left : BinOp.values()) {
            for (var right : BinOp.values()) {
                if (left.precedence() == right.precedence()) {
                    assertEquals(left.associativity(), right.associativity(), left + " vs " + right);
                }
            }
        }
    }

    @Test
    void rankTable_groupsOperators() {
        var ranks = OperatorTable.binaryRanks();

        assertThat(ranks.firstKey()).isEqualTo(OperatorTable.ASSIGNMENT_PRECEDENCE);
        assertThat(ranks.get(1)).containsExactlyInAnyOrder(
            BinOp.ASSIGN, BinOp.ADD_ASSIGN, BinOp.SUB_ASSIGN, BinOp.MUL_ASSIGN, BinOp.DIV_ASSIGN);
        assertThat(ranks.get(5)).containsExactlyInAnyOrder(
            BinOp.EQ, BinOp.NEQ, BinOp.LT, BinOp.LEQ, BinOp.GT, BinOp.GEQ);
        assertThat(OperatorTable.associativityOf(1)).contains(Associativity.RIGHT);
        assertThat(OperatorTable.associativityOf(5)).contains(Associativity.LEFT);
        assertThat(OperatorTable.associativityOf(42)).isEmpty();
    }

    @Test
    void precedence_ordersMultiplicativeAboveAdditiveAboveComparison() {
        assertThat(BinOp.MUL.precedence()).isGreaterThan(BinOp.ADD.precedence());
        assertThat(BinOp.ADD.precedence()).isGreaterThan(BinOp.LT.precedence());
        assertThat(BinOp.AND.precedence()).isGreaterThan(BinOp.OR.precedence());
        assertThat(UnOp.NEG.precedence()).isGreaterThan(BinOp.MUL.precedence());
        assertThat(UnOp.NOT.precedence()).isGreaterThan(BinOp.AND.precedence());
    }

    @Test
    void rightOperandPrecedence_followsAssociativity() {
        assertEquals(BinOp.SUB.precedence() + 1, OperatorTable.rightOperandPrecedence(BinOp.SUB));
        assertEquals(BinOp.ASSIGN.precedence(), OperatorTable.rightOperandPrecedence(BinOp.ASSIGN));
        assertTrue(BinOp.DIV_ASSIGN.isAssignment());
        assertFalse(BinOp.DIV.isAssignment());
    }

    @Test
    void tokenMaps_coverEveryOperator() {
        assertThat(OperatorTable.binaryByToken().values()).containsExactlyInAnyOrder(BinOp.values());
        assertThat(OperatorTable.unaryByToken().values()).containsExactlyInAnyOrder(UnOp.values());
    }
}
