package org.pragmatica.markup.syntax;

import org.pragmatica.markup.syntax.literal.LitKind;
import org.pragmatica.markup.tree.SourceSpan;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Expression of the code sublanguage.
 *
 * <p>The variant set is closed. Consumers dispatch through {@link ExprVisitor}, so adding
 * a variant breaks every consumer at compile time until it handles the new case.
 *
 * <p>Nodes are immutable. Sub-expressions belong to exactly one parent; the only shared
 * part of a tree is the markup {@link Tree} inside a {@link Template}, which is itself
 * immutable and may be referenced from any number of places.
 */
public sealed interface Expr {

    /**
     * Source location, for diagnostics only.
     */
    SourceSpan span();

    <R> R accept(ExprVisitor<R> visitor);

    /**
     * A literal: {@code 12pt}, {@code "hi"}, {@code none}.
     */
    record Lit(SourceSpan span, LitKind kind) implements Expr {
        public Lit {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLit(this);
        }
    }

    /**
     * An identifier: {@code left}.
     */
    record Ident(SourceSpan span, String name) implements Expr {
        public Ident {
            Objects.requireNonNull(span, "span");
            if (!isValid(name)) {
                throw new IllegalArgumentException("Not a valid identifier: '" + name + "'");
            }
        }

        public static Ident of(String name) {
            return new Ident(SourceSpan.DETACHED, name);
        }

        /**
         * Identifier text: a Unicode identifier start or {@code _}, then identifier parts,
         * {@code _} or {@code -}. Word tokens such as {@code not} or {@code none} are excluded.
         */
        public static boolean isValid(String name) {
            if (name == null || name.isEmpty()) {
                return false;
            }
            if (!isStart(name.codePointAt(0))) {
                return false;
            }
            for (int i = Character.charCount(name.codePointAt(0)); i < name.length(); ) {
                int cp = name.codePointAt(i);
                if (!isPart(cp)) {
                    return false;
                }
                i += Character.charCount(cp);
            }
            return Token.fromText(name)
                        .isEmpty();
        }

        public static boolean isStart(int cp) {
            return cp == '_' || Character.isUnicodeIdentifierStart(cp);
        }

        public static boolean isPart(int cp) {
            return cp == '_' || cp == '-' || (Character.isUnicodeIdentifierPart(cp) && !Character.isIdentifierIgnorable(cp));
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIdent(this);
        }
    }

    /**
     * An array: {@code (1, "hi", 12cm)}.
     */
    record Array(SourceSpan span, List<Expr> items) implements Expr {
        public Array {
            Objects.requireNonNull(span, "span");
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitArray(this);
        }
    }

    /**
     * A dictionary: {@code (color: #f79143, pattern: dashed)}.
     */
    record Dict(SourceSpan span, List<Named> items) implements Expr {
        public Dict {
            Objects.requireNonNull(span, "span");
            items = List.copyOf(items);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitDict(this);
        }
    }

    /**
     * A template: {@code [*Hi* there!]}. The markup tree is shared, never copied.
     */
    record Template(SourceSpan span, Tree tree) implements Expr {
        public Template {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(tree, "tree");
        }

        /**
         * The call this template consists of, if its content is exactly one embedded call.
         */
        public Optional<Call> soleCall() {
            if (tree.nodes().size() == 1 && tree.nodes().get(0) instanceof Node.Embedded embedded
                && embedded.expr() instanceof Call call) {
                return Optional.of(call);
            }
            return Optional.empty();
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitTemplate(this);
        }
    }

    /**
     * A parenthesized expression: {@code (1 + 2)}.
     */
    record Group(SourceSpan span, Expr expr) implements Expr {
        public Group {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitGroup(this);
        }
    }

    /**
     * A block: {@code { #let x = 1; x + 2 }}.
     *
     * @param scoping whether evaluating the block opens a new scope
     */
    record Block(SourceSpan span, List<Expr> exprs, boolean scoping) implements Expr {
        public Block {
            Objects.requireNonNull(span, "span");
            exprs = List.copyOf(exprs);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * A unary operation: {@code -x}.
     */
    record Unary(SourceSpan span, UnOp op, Expr expr) implements Expr {
        public Unary {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitUnary(this);
        }
    }

    /**
     * A binary operation: {@code a + b}.
     */
    record Binary(SourceSpan span, Expr lhs, BinOp op, Expr rhs) implements Expr {
        public Binary {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(lhs, "lhs");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(rhs, "rhs");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinary(this);
        }
    }

    /**
     * A function call: {@code foo(...)} or {@code #[foo ...]}.
     */
    record Call(SourceSpan span, Expr callee, Args args) implements Expr {
        public Call {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(callee, "callee");
            Objects.requireNonNull(args, "args");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * A let binding: {@code #let x = 1}.
     */
    record Let(SourceSpan span, Ident binding, Optional<Expr> init) implements Expr {
        public Let {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(binding, "binding");
            Objects.requireNonNull(init, "init");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitLet(this);
        }
    }

    /**
     * A conditional: {@code #if x { y } #else { z }}.
     */
    record If(SourceSpan span, Expr condition, Expr ifBody, Optional<Expr> elseBody) implements Expr {
        public If {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(condition, "condition");
            Objects.requireNonNull(ifBody, "ifBody");
            Objects.requireNonNull(elseBody, "elseBody");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * A loop: {@code #for x #in y { z }}.
     */
    record For(SourceSpan span, ForPattern pattern, Expr iter, Expr body) implements Expr {
        public For {
            Objects.requireNonNull(span, "span");
            Objects.requireNonNull(pattern, "pattern");
            Objects.requireNonNull(iter, "iter");
            Objects.requireNonNull(body, "body");
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitFor(this);
        }
    }
}
