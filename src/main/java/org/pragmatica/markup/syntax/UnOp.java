package org.pragmatica.markup.syntax;

import java.util.Optional;

/**
 * A unary operator.
 */
public enum UnOp {
    /** {@code +x} */
    POS("+", 8),
    /** {@code -x} */
    NEG("-", 8),
    /** {@code not x} */
    NOT("not", 4);

    private final String text;
    private final int precedence;

    UnOp(String text, int precedence) {
        this.text = text;
        this.precedence = precedence;
    }

    /**
     * Classify a token as a unary operator; empty if it is none.
     */
    public static Optional<UnOp> fromToken(Token token) {
        return switch (token) {
            case PLUS -> Optional.of(POS);
            case HYPH -> Optional.of(NEG);
            case NOT -> Optional.of(NOT);
            default -> Optional.empty();
        };
    }

    /**
     * Binding strength; higher binds tighter.
     */
    public int precedence() {
        return precedence;
    }

    /**
     * Canonical spelling.
     */
    public String text() {
        return text;
    }

    /**
     * Word operators need a space before their operand, symbols do not.
     */
    public boolean isWord() {
        return this == NOT;
    }

    @Override
    public String toString() {
        return text;
    }
}
