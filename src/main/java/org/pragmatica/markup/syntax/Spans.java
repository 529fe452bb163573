package org.pragmatica.markup.syntax;

import org.pragmatica.markup.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Span utilities.
 *
 * <p>{@link #erase(Tree)} rebuilds a tree with {@link SourceSpan#DETACHED} spans, so that two
 * trees parsed from different text compare equal exactly when they are structurally equal.
 *
 * <p>Erasure recurses once per nesting level. Callers bound the input with {@link Nesting#depth(Tree)}
 * first, as {@code Markup.structurallyEqual} does.
 */
public final class Spans {
    private static final Eraser ERASER = new Eraser();

    private Spans() {}

    public static Tree erase(Tree tree) {
        return ERASER.tree(tree);
    }

    public static Expr erase(Expr expr) {
        return expr.accept(ERASER);
    }

    private static final class Eraser implements ExprVisitor<Expr>, NodeVisitor<Node> {
        private static final SourceSpan NO_SPAN = SourceSpan.DETACHED;

        Tree tree(Tree tree) {
            var nodes = new ArrayList<Node>(tree.nodes().size());
            for (var node : tree.nodes()) {
                nodes.add(node.accept(this));
            }
            return new Tree(nodes);
        }

        private List<Expr> exprs(List<Expr> exprs) {
            var result = new ArrayList<Expr>(exprs.size());
            for (var expr : exprs) {
                result.add(expr.accept(this));
            }
            return result;
        }

        private Expr.Ident ident(Expr.Ident ident) {
            return new Expr.Ident(NO_SPAN, ident.name());
        }

        private Named named(Named named) {
            return new Named(ident(named.name()), named.expr().accept(this));
        }

        private Argument argument(Argument argument) {
            if (argument instanceof Named named) {
                return named(named);
            }
            return new Argument.Positional(((Argument.Positional) argument).expr().accept(this));
        }

        private ForPattern pattern(ForPattern pattern) {
            if (pattern instanceof ForPattern.KeyValue keyValue) {
                return new ForPattern.KeyValue(ident(keyValue.key()), ident(keyValue.value()));
            }
            return new ForPattern.Value(ident(((ForPattern.Value) pattern).value()));
        }

        @Override
        public Expr visitLit(Expr.Lit lit) {
            return new Expr.Lit(NO_SPAN, lit.kind());
        }

        @Override
        public Expr visitIdent(Expr.Ident ident) {
            return ident(ident);
        }

        @Override
        public Expr visitArray(Expr.Array array) {
            return new Expr.Array(NO_SPAN, exprs(array.items()));
        }

        @Override
        public Expr visitDict(Expr.Dict dict) {
            var items = new ArrayList<Named>(dict.items().size());
            for (var item : dict.items()) {
                items.add(named(item));
            }
            return new Expr.Dict(NO_SPAN, items);
        }

        @Override
        public Expr visitTemplate(Expr.Template template) {
            return new Expr.Template(NO_SPAN, tree(template.tree()));
        }

        @Override
        public Expr visitGroup(Expr.Group group) {
            return new Expr.Group(NO_SPAN, group.expr().accept(this));
        }

        @Override
        public Expr visitBlock(Expr.Block block) {
            return new Expr.Block(NO_SPAN, exprs(block.exprs()), block.scoping());
        }

        @Override
        public Expr visitUnary(Expr.Unary unary) {
            return new Expr.Unary(NO_SPAN, unary.op(), unary.expr().accept(this));
        }

        @Override
        public Expr visitBinary(Expr.Binary binary) {
            return new Expr.Binary(NO_SPAN, binary.lhs().accept(this), binary.op(), binary.rhs().accept(this));
        }

        @Override
        public Expr visitCall(Expr.Call call) {
            var items = new ArrayList<Argument>(call.args().items().size());
            for (var item : call.args().items()) {
                items.add(argument(item));
            }
            return new Expr.Call(NO_SPAN, call.callee().accept(this), new Args(NO_SPAN, items));
        }

        @Override
        public Expr visitLet(Expr.Let let) {
            return new Expr.Let(NO_SPAN, ident(let.binding()), let.init().map(init -> init.accept(this)));
        }

        @Override
        public Expr visitIf(Expr.If anIf) {
            return new Expr.If(NO_SPAN,
                               anIf.condition().accept(this),
                               anIf.ifBody().accept(this),
                               anIf.elseBody().map(body -> body.accept(this)));
        }

        @Override
        public Expr visitFor(Expr.For aFor) {
            return new Expr.For(NO_SPAN, pattern(aFor.pattern()), aFor.iter().accept(this), aFor.body().accept(this));
        }

        @Override
        public Node visitText(Node.Text text) {
            return new Node.Text(NO_SPAN, text.text());
        }

        @Override
        public Node visitSpace(Node.Space space) {
            return new Node.Space(NO_SPAN);
        }

        @Override
        public Node visitLinebreak(Node.Linebreak linebreak) {
            return new Node.Linebreak(NO_SPAN);
        }

        @Override
        public Node visitParbreak(Node.Parbreak parbreak) {
            return new Node.Parbreak(NO_SPAN);
        }

        @Override
        public Node visitStrong(Node.Strong strong) {
            return new Node.Strong(NO_SPAN);
        }

        @Override
        public Node visitEmph(Node.Emph emph) {
            return new Node.Emph(NO_SPAN);
        }

        @Override
        public Node visitEmbedded(Node.Embedded embedded) {
            return new Node.Embedded(embedded.expr().accept(this));
        }
    }
}
