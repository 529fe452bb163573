package org.pragmatica.markup.syntax;

/**
 * The associativity of a binary operator.
 */
public enum Associativity {
    /**
     * {@code a + b + c} is {@code (a + b) + c}.
     */
    LEFT,
    /**
     * {@code a = b = c} is {@code a = (b = c)}.
     */
    RIGHT
}
