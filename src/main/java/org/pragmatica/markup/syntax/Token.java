package org.pragmatica.markup.syntax;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Punctuation and keyword tokens of the code sublanguage, with their source spelling.
 *
 * <p>Identifiers, numbers, strings and markup text carry payloads and are modelled by
 * the lexer that produces them; only the fixed-spelling tokens live here.
 */
public enum Token {
    // Delimiters
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),
    HASH_BRACKET("#["),
    COMMA(","),
    SEMICOLON(";"),
    COLON(":"),
    PIPE("|"),

    // Operators
    PLUS("+"),
    HYPH("-"),
    STAR("*"),
    SLASH("/"),
    EQ("="),
    EQ_EQ("=="),
    BANG_EQ("!="),
    LT("<"),
    LT_EQ("<="),
    GT(">"),
    GT_EQ(">="),
    PLUS_EQ("+="),
    HYPH_EQ("-="),
    STAR_EQ("*="),
    SLASH_EQ("/="),

    // Word operators
    NOT("not"),
    AND("and"),
    OR("or"),

    // Literal keywords
    NONE("none"),
    TRUE("true"),
    FALSE("false"),

    // Hash keywords
    LET("#let"),
    IF("#if"),
    ELSE("#else"),
    FOR("#for"),
    IN("#in");

    private static final Map<String, Token> BY_TEXT = new HashMap<>();

    static {
        for (var token : values()) {
            BY_TEXT.put(token.text, token);
        }
    }

    private final String text;

    Token(String text) {
        this.text = text;
    }

    /**
     * The exact source spelling.
     */
    public String text() {
        return text;
    }

    public boolean isKeyword() {
        return Character.isLetter(text.charAt(0)) || (text.length() > 1 && text.charAt(0) == '#' && Character.isLetter(text.charAt(1)));
    }

    /**
     * Look up the token spelled exactly {@code text}.
     */
    public static Optional<Token> fromText(String text) {
        return Optional.ofNullable(BY_TEXT.get(text));
    }
}
