package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.Objects;

/**
 * A name paired with an expression: {@code pattern: dashed}.
 * Used for dictionary entries and named call arguments.
 */
public record Named(Expr.Ident name, Expr expr) implements Argument {
    public Named {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(expr, "expr");
    }

    @Override
    public SourceSpan span() {
        return name.span()
                   .join(expr.span());
    }
}
