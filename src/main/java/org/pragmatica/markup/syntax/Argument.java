package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.Objects;

/**
 * An argument to a call: {@code 12} or {@code draw: false}.
 */
public sealed interface Argument permits Argument.Positional, Named {
    SourceSpan span();

    static Positional positional(Expr expr) {
        return new Positional(expr);
    }

    static Named named(Expr.Ident name, Expr expr) {
        return new Named(name, expr);
    }

    /**
     * A positional argument.
     */
    record Positional(Expr expr) implements Argument {
        public Positional {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public SourceSpan span() {
            return expr.span();
        }
    }
}
