package org.pragmatica.markup;

import org.pragmatica.markup.pretty.PrettyPrinter;
import org.pragmatica.markup.pretty.PrinterConfig;
import org.pragmatica.markup.syntax.Expr;
import org.pragmatica.markup.syntax.Nesting;
import org.pragmatica.markup.syntax.Spans;
import org.pragmatica.markup.syntax.Tree;

/**
 * Entry point for printing syntax trees.
 *
 * <p>Example usage:
 * <pre>{@code
 * var call = new Expr.Call(SourceSpan.DETACHED, Expr.Ident.of("v"),
 *                          Args.of(Argument.positional(new Expr.Lit(SourceSpan.DETACHED, LitKind.integer(1)))));
 * var text = Markup.print(Tree.of(new Node.Embedded(call)));   // "#[v 1]"
 * }</pre>
 *
 * <p>Trees are immutable, so printing the same tree from several threads needs no coordination.
 */
public final class Markup {
    private Markup() {}

    /**
     * Print a tree in canonical form.
     */
    public static String print(Tree tree) {
        return print(tree, PrinterConfig.DEFAULT);
    }

    /**
     * Print a tree in canonical form with custom configuration.
     */
    public static String print(Tree tree, PrinterConfig config) {
        return PrettyPrinter.print(tree, config);
    }

    /**
     * Print a single expression in canonical form. A call prints in parenthesized form here;
     * only calls embedded in markup use the bracketed form.
     */
    public static String print(Expr expr) {
        return print(expr, PrinterConfig.DEFAULT);
    }

    public static String print(Expr expr, PrinterConfig config) {
        return PrettyPrinter.print(expr, config);
    }

    /**
     * Whether two trees are equal when source spans are ignored.
     */
    public static boolean structurallyEqual(Tree left, Tree right) {
        return structurallyEqual(left, right, PrinterConfig.DEFAULT);
    }

    /**
     * Span-insensitive comparison bounded by {@code config}'s nesting limit.
     *
     * @throws IllegalArgumentException if either tree nests deeper than the limit
     */
    public static boolean structurallyEqual(Tree left, Tree right, PrinterConfig config) {
        requireComparable(left, config);
        requireComparable(right, config);
        return Spans.erase(left)
                    .equals(Spans.erase(right));
    }

    private static void requireComparable(Tree tree, PrinterConfig config) {
        int depth = Nesting.depth(tree);
        if (depth > config.maxDepth()) {
            throw new IllegalArgumentException("Expression nesting depth " + depth
                                               + " exceeds comparison limit of " + config.maxDepth());
        }
    }
}
