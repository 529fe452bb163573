package org.pragmatica.markup.syntax;

import java.util.Optional;

/**
 * A binary operator with its precedence and associativity.
 *
 * <p>All operators of one precedence rank share one associativity; {@link OperatorTable}
 * checks this when it loads.
 */
public enum BinOp {
    /** {@code +} */
    ADD("+", 6, Associativity.LEFT),
    /** {@code -} */
    SUB("-", 6, Associativity.LEFT),
    /** {@code *} */
    MUL("*", 7, Associativity.LEFT),
    /** {@code /} */
    DIV("/", 7, Associativity.LEFT),
    /** Short-circuiting {@code and}. */
    AND("and", 3, Associativity.LEFT),
    /** Short-circuiting {@code or}. */
    OR("or", 2, Associativity.LEFT),
    /** {@code ==} */
    EQ("==", 5, Associativity.LEFT),
    /** {@code !=} */
    NEQ("!=", 5, Associativity.LEFT),
    /** {@code <} */
    LT("<", 5, Associativity.LEFT),
    /** {@code <=} */
    LEQ("<=", 5, Associativity.LEFT),
    /** {@code >} */
    GT(">", 5, Associativity.LEFT),
    /** {@code >=} */
    GEQ(">=", 5, Associativity.LEFT),
    /** {@code =} */
    ASSIGN("=", 1, Associativity.RIGHT),
    /** {@code +=} */
    ADD_ASSIGN("+=", 1, Associativity.RIGHT),
    /** {@code -=} */
    SUB_ASSIGN("-=", 1, Associativity.RIGHT),
    /** {@code *=} */
    MUL_ASSIGN("*=", 1, Associativity.RIGHT),
    /** {@code /=} */
    DIV_ASSIGN("/=", 1, Associativity.RIGHT);

    private final String text;
    private final int precedence;
    private final Associativity associativity;

    BinOp(String text, int precedence, Associativity associativity) {
        this.text = text;
        this.precedence = precedence;
        this.associativity = associativity;
    }

    /**
     * Classify a token as a binary operator; empty if it is none.
     */
    public static Optional<BinOp> fromToken(Token token) {
        return switch (token) {
            case PLUS -> Optional.of(ADD);
            case HYPH -> Optional.of(SUB);
            case STAR -> Optional.of(MUL);
            case SLASH -> Optional.of(DIV);
            case AND -> Optional.of(AND);
            case OR -> Optional.of(OR);
            case EQ_EQ -> Optional.of(EQ);
            case BANG_EQ -> Optional.of(NEQ);
            case LT -> Optional.of(LT);
            case LT_EQ -> Optional.of(LEQ);
            case GT -> Optional.of(GT);
            case GT_EQ -> Optional.of(GEQ);
            case EQ -> Optional.of(ASSIGN);
            case PLUS_EQ -> Optional.of(ADD_ASSIGN);
            case HYPH_EQ -> Optional.of(SUB_ASSIGN);
            case STAR_EQ -> Optional.of(MUL_ASSIGN);
            case SLASH_EQ -> Optional.of(DIV_ASSIGN);
            default -> Optional.empty();
        };
    }

    /**
     * Binding strength; higher binds tighter.
     */
    public int precedence() {
        return precedence;
    }

    public Associativity associativity() {
        return associativity;
    }

    /**
     * Canonical spelling.
     */
    public String text() {
        return text;
    }

    public boolean isAssignment() {
        return precedence == OperatorTable.ASSIGNMENT_PRECEDENCE;
    }

    @Override
    public String toString() {
        return text;
    }
}
