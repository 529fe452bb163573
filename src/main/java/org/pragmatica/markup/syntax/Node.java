package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.Objects;

/**
 * A top-level markup node. Only the kinds needed to host expressions are modelled;
 * headings and raw blocks belong to the surrounding markup layer.
 */
public sealed interface Node {

    SourceSpan span();

    <R> R accept(NodeVisitor<R> visitor);

    /**
     * Plain text, printed verbatim.
     */
    record Text(SourceSpan span, String text) implements Node {
        public Text {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(text, "text");
            if (text.isEmpty()) {
                throw new IllegalArgumentException("Text node must not be empty");
            }
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitText(this);
        }
    }

    /**
     * Whitespace without a paragraph break.
     */
    record Space(SourceSpan span) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSpace(this);
        }
    }

    /**
     * A forced line break: {@code \ }.
     */
    record Linebreak(SourceSpan span) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLinebreak(this);
        }
    }

    /**
     * A paragraph break: a blank line.
     */
    record Parbreak(SourceSpan span) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitParbreak(this);
        }
    }

    /**
     * Strong toggle: {@code *}.
     */
    record Strong(SourceSpan span) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStrong(this);
        }
    }

    /**
     * Emphasis toggle: {@code _}.
     */
    record Emph(SourceSpan span) implements Node {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitEmph(this);
        }
    }

    /**
     * An expression embedded in markup: {@code #[f]}, {@code {x}}, {@code #let y = 1}.
     */
    record Embedded(Expr expr) implements Node {
        public Embedded {
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public SourceSpan span() {
            return expr.span();
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitEmbedded(this);
        }
    }
}
