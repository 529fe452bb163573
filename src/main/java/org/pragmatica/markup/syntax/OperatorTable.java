package org.pragmatica.markup.syntax;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Precedence table for precedence-climbing parsers.
 *
 * <p>The printer never consults it; grouping in a tree is explicit. Loading the table
 * verifies that operators of equal rank agree on associativity, so a parser may decide
 * associativity per rank instead of per operator.
 */
public final class OperatorTable {
    public static final int ASSIGNMENT_PRECEDENCE = 1;

    private static final NavigableMap<Integer, Associativity> ASSOCIATIVITY_BY_RANK;
    private static final NavigableMap<Integer, Set<BinOp>> BINARY_BY_RANK;

    static {
        var associativity = new TreeMap<Integer, Associativity>();
        var operators = new TreeMap<Integer, Set<BinOp>>();
        for (var op : BinOp.values()) {
            var previous = associativity.putIfAbsent(op.precedence(), op.associativity());
            if (previous != null && previous != op.associativity()) {
                throw new IllegalStateException("Operator '" + op.text() + "' is " + op.associativity()
                                                + "-associative but rank " + op.precedence() + " is " + previous);
            }
            operators.computeIfAbsent(op.precedence(), rank -> EnumSet.noneOf(BinOp.class))
                     .add(op);
        }
        operators.replaceAll((rank, ops) -> Collections.unmodifiableSet(ops));
        ASSOCIATIVITY_BY_RANK = Collections.unmodifiableNavigableMap(associativity);
        BINARY_BY_RANK = Collections.unmodifiableNavigableMap(operators);
    }

    private OperatorTable() {}

    /**
     * Associativity shared by every binary operator of {@code rank}; empty if no operator has it.
     */
    public static Optional<Associativity> associativityOf(int rank) {
        return Optional.ofNullable(ASSOCIATIVITY_BY_RANK.get(rank));
    }

    /**
     * Binary operators grouped by rank, loosest first.
     */
    public static NavigableMap<Integer, Set<BinOp>> binaryRanks() {
        return BINARY_BY_RANK;
    }

    /**
     * Minimum rank for the right operand of {@code op} in precedence climbing.
     */
    public static int rightOperandPrecedence(BinOp op) {
        return op.associativity() == Associativity.LEFT ? op.precedence() + 1 : op.precedence();
    }

    /**
     * Unary operators keyed by their spelling token.
     */
    public static Map<Token, UnOp> unaryByToken() {
        var result = new EnumMap<Token, UnOp>(Token.class);
        for (var token : Token.values()) {
            UnOp.fromToken(token)
                .ifPresent(op -> result.put(token, op));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Binary operators keyed by their spelling token.
     */
    public static Map<Token, BinOp> binaryByToken() {
        var result = new EnumMap<Token, BinOp>(Token.class);
        for (var token : Token.values()) {
            BinOp.fromToken(token)
                 .ifPresent(op -> result.put(token, op));
        }
        return Collections.unmodifiableMap(result);
    }
}
