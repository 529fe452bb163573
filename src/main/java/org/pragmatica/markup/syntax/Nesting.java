package org.pragmatica.markup.syntax;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

/**
 * Expression nesting depth, measured with an explicit work-list so that measuring a
 * pathologically deep tree cannot itself exhaust the call stack.
 *
 * <p>A lone literal has depth 1; every enclosing expression adds one. Expressions embedded
 * in a template's markup count as children of the template.
 *
 * <p>{@link #foldedDepth(Tree)} measures what the canonical printer recurses through: calls
 * embedded in markup print in bracketed form, where a trailing positional call continues the
 * same {@code | } chain instead of nesting, so every segment of a chain shares one level.
 */
public final class Nesting {
    private static final ChildCollector CHILDREN = new ChildCollector();

    private Nesting() {}

    public static int depth(Tree tree) {
        return measure(embedded(tree), false, true);
    }

    public static int depth(Expr expr) {
        return measure(List.of(expr), false, false);
    }

    public static int foldedDepth(Tree tree) {
        return measure(embedded(tree), true, true);
    }

    public static int foldedDepth(Expr expr) {
        return measure(List.of(expr), true, false);
    }

    /**
     * Direct sub-expressions of {@code expr}, in source order.
     */
    public static List<Expr> children(Expr expr) {
        return expr.accept(CHILDREN);
    }

    private record Pending(Expr expr, int depth, boolean inMarkup) {}

    private static int measure(List<Expr> roots, boolean foldChains, boolean inMarkup) {
        var work = new ArrayDeque<Pending>();
        for (var root : roots) {
            work.push(new Pending(root, 1, inMarkup));
        }
        int max = 0;
        while (!work.isEmpty()) {
            var pending = work.pop();
            max = Math.max(max, pending.depth());
            var children = children(pending.expr());
            // The chained call, when present, is the last child.
            int chained = foldChains && pending.inMarkup() && continuesChain(pending.expr()) ? children.size() - 1 : -1;
            boolean childInMarkup = pending.expr() instanceof Expr.Template;
            for (int i = 0; i < children.size(); i++) {
                if (i == chained) {
                    work.push(new Pending(children.get(i), pending.depth(), true));
                } else {
                    work.push(new Pending(children.get(i), pending.depth() + 1, childInMarkup));
                }
            }
        }
        return max;
    }

    private static boolean continuesChain(Expr expr) {
        if (expr instanceof Expr.Call call) {
            var last = call.args().last();
            return last.isPresent() && last.get() instanceof Argument.Positional positional
                   && positional.expr() instanceof Expr.Call;
        }
        return false;
    }

    private static List<Expr> embedded(Tree tree) {
        var result = new ArrayList<Expr>();
        for (var node : tree.nodes()) {
            if (node instanceof Node.Embedded embedded) {
                result.add(embedded.expr());
            }
        }
        return result;
    }

    private static final class ChildCollector implements ExprVisitor<List<Expr>> {
        @Override
        public List<Expr> visitLit(Expr.Lit lit) {
            return List.of();
        }

        @Override
        public List<Expr> visitIdent(Expr.Ident ident) {
            return List.of();
        }

        @Override
        public List<Expr> visitArray(Expr.Array array) {
            return array.items();
        }

        @Override
        public List<Expr> visitDict(Expr.Dict dict) {
            var result = new ArrayList<Expr>(dict.items().size());
            for (var item : dict.items()) {
                result.add(item.expr());
            }
            return result;
        }

        @Override
        public List<Expr> visitTemplate(Expr.Template template) {
            return embedded(template.tree());
        }

        @Override
        public List<Expr> visitGroup(Expr.Group group) {
            return List.of(group.expr());
        }

        @Override
        public List<Expr> visitBlock(Expr.Block block) {
            return block.exprs();
        }

        @Override
        public List<Expr> visitUnary(Expr.Unary unary) {
            return List.of(unary.expr());
        }

        @Override
        public List<Expr> visitBinary(Expr.Binary binary) {
            return List.of(binary.lhs(), binary.rhs());
        }

        @Override
        public List<Expr> visitCall(Expr.Call call) {
            var result = new ArrayList<Expr>(call.args().items().size() + 1);
            result.add(call.callee());
            for (var item : call.args().items()) {
                if (item instanceof Named named) {
                    result.add(named.expr());
                } else {
                    result.add(((Argument.Positional) item).expr());
                }
            }
            return result;
        }

        @Override
        public List<Expr> visitLet(Expr.Let let) {
            return let.init()
                      .map(List::of)
                      .orElse(List.of());
        }

        @Override
        public List<Expr> visitIf(Expr.If anIf) {
            var result = new ArrayList<Expr>(3);
            result.add(anIf.condition());
            result.add(anIf.ifBody());
            anIf.elseBody()
                .ifPresent(result::add);
            return result;
        }

        @Override
        public List<Expr> visitFor(Expr.For aFor) {
            return List.of(aFor.iter(), aFor.body());
        }
    }
}
