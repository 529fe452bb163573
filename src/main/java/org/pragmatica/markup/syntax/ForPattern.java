package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.Objects;

/**
 * The binding pattern of a for loop.
 */
public sealed interface ForPattern {
    SourceSpan span();

    /**
     * Value iteration: {@code #for v #in array}.
     */
    record Value(Expr.Ident value) implements ForPattern {
        public Value {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public SourceSpan span() {
            return value.span();
        }
    }

    /**
     * Key-value iteration: {@code #for k, v #in dict}.
     */
    record KeyValue(Expr.Ident key, Expr.Ident value) implements ForPattern {
        public KeyValue {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public SourceSpan span() {
            return key.span()
                      .join(value.span());
        }
    }
}
