package org.pragmatica.markup.pretty;

import org.pragmatica.markup.syntax.Args;
import org.pragmatica.markup.syntax.Argument;
import org.pragmatica.markup.syntax.Expr;
import org.pragmatica.markup.syntax.ExprVisitor;
import org.pragmatica.markup.syntax.ForPattern;
import org.pragmatica.markup.syntax.Named;
import org.pragmatica.markup.syntax.Nesting;
import org.pragmatica.markup.syntax.Node;
import org.pragmatica.markup.syntax.NodeVisitor;
import org.pragmatica.markup.syntax.Tree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * Canonical printer: renders a tree as minimal source text that parses back to the same tree.
 *
 * <p>Grouping is never re-derived from operator precedence; only explicit {@link Expr.Group}
 * nodes produce parentheses. Two constructs that would otherwise print identically get a marker:
 * a one-element array prints with a trailing comma ({@code (1,)}) and an empty dictionary
 * prints as {@code (:)}.
 *
 * <p>Calls embedded directly in markup print in bracketed form. A trailing positional call
 * argument folds into a pipe chain ({@code #[v 1, #[f 2]]} becomes {@code #[v 1 | f 2]}),
 * and a trailing positional template becomes an attached body ({@code #[v 1][body]}).
 * A trailing call wins over a trailing template.
 */
public final class PrettyPrinter implements ExprVisitor<Void>, NodeVisitor<Void> {
    private static final Logger log = LoggerFactory.getLogger(PrettyPrinter.class);

    private final Printer p = new Printer();

    private PrettyPrinter() {}

    public static String print(Tree tree, PrinterConfig config) {
        checkDepth(Nesting.foldedDepth(tree), config);
        var printer = new PrettyPrinter();
        printer.tree(tree);
        return printer.p.finish();
    }

    public static String print(Expr expr, PrinterConfig config) {
        checkDepth(Nesting.foldedDepth(expr), config);
        var printer = new PrettyPrinter();
        expr.accept(printer);
        return printer.p.finish();
    }

    private static void checkDepth(int depth, PrinterConfig config) {
        if (depth > config.maxDepth()) {
            log.debug("Rejecting tree with nesting depth {} (limit {})", depth, config.maxDepth());
            throw new IllegalArgumentException("Expression nesting depth " + depth
                                               + " exceeds printer limit of " + config.maxDepth());
        }
    }

    private void tree(Tree tree) {
        for (var node : tree.nodes()) {
            node.accept(this);
        }
    }

    // === Markup ===

    @Override
    public Void visitText(Node.Text text) {
        p.push(text.text());
        return null;
    }

    @Override
    public Void visitSpace(Node.Space space) {
        p.push(' ');
        return null;
    }

    @Override
    public Void visitLinebreak(Node.Linebreak linebreak) {
        p.push('\\');
        return null;
    }

    @Override
    public Void visitParbreak(Node.Parbreak parbreak) {
        p.push("\n\n");
        return null;
    }

    @Override
    public Void visitStrong(Node.Strong strong) {
        p.push('*');
        return null;
    }

    @Override
    public Void visitEmph(Node.Emph emph) {
        p.push('_');
        return null;
    }

    @Override
    public Void visitEmbedded(Node.Embedded embedded) {
        if (embedded.expr() instanceof Expr.Call call) {
            bracketed(call, false);
        } else {
            embedded.expr().accept(this);
        }
        return null;
    }

    // === Expressions ===

    @Override
    public Void visitLit(Expr.Lit lit) {
        p.push(lit.kind().canonical());
        return null;
    }

    @Override
    public Void visitIdent(Expr.Ident ident) {
        p.push(ident.name());
        return null;
    }

    @Override
    public Void visitArray(Expr.Array array) {
        p.push('(');
        p.join(array.items(), ", ", this::expr);
        if (array.items().size() == 1) {
            p.push(',');
        }
        p.push(')');
        return null;
    }

    @Override
    public Void visitDict(Expr.Dict dict) {
        p.push('(');
        if (dict.items().isEmpty()) {
            p.push(':');
        } else {
            p.join(dict.items(), ", ", this::named);
        }
        p.push(')');
        return null;
    }

    @Override
    public Void visitTemplate(Expr.Template template) {
        var call = template.soleCall();
        if (call.isPresent()) {
            bracketed(call.get(), false);
        } else {
            p.push('[');
            tree(template.tree());
            p.push(']');
        }
        return null;
    }

    @Override
    public Void visitGroup(Expr.Group group) {
        p.push('(');
        group.expr().accept(this);
        p.push(')');
        return null;
    }

    @Override
    public Void visitBlock(Expr.Block block) {
        boolean padded = block.exprs().size() > 1;
        p.push('{');
        if (padded) {
            p.push(' ');
        }
        p.join(block.exprs(), "; ", this::expr);
        if (padded) {
            p.push(' ');
        }
        p.push('}');
        return null;
    }

    @Override
    public Void visitUnary(Expr.Unary unary) {
        p.push(unary.op().text());
        if (unary.op().isWord()) {
            p.push(' ');
        }
        unary.expr().accept(this);
        return null;
    }

    @Override
    public Void visitBinary(Expr.Binary binary) {
        binary.lhs().accept(this);
        p.push(' ').push(binary.op().text()).push(' ');
        binary.rhs().accept(this);
        return null;
    }

    @Override
    public Void visitCall(Expr.Call call) {
        call.callee().accept(this);
        p.push('(');
        p.join(call.args().items(), ", ", this::argument);
        p.push(')');
        return null;
    }

    @Override
    public Void visitLet(Expr.Let let) {
        p.push("#let ");
        let.binding().accept(this);
        let.init()
           .ifPresent(init -> {
               p.push(" = ");
               init.accept(this);
           });
        return null;
    }

    @Override
    public Void visitIf(Expr.If anIf) {
        p.push("#if ");
        anIf.condition().accept(this);
        p.push(' ');
        anIf.ifBody().accept(this);
        anIf.elseBody()
            .ifPresent(body -> {
                p.push(" #else ");
                body.accept(this);
            });
        return null;
    }

    @Override
    public Void visitFor(Expr.For aFor) {
        p.push("#for ");
        pattern(aFor.pattern());
        p.push(" #in ");
        aFor.iter().accept(this);
        p.push(' ');
        aFor.body().accept(this);
        return null;
    }

    // === Bracketed calls ===

    /**
     * Render a call as {@code #[callee args]}, folding trailing calls into {@code | } segments
     * and a trailing template into an attached body. Chains are walked iteratively.
     */
    private void bracketed(Expr.Call call, boolean chained) {
        var current = call;
        var inChain = chained;
        while (true) {
            p.push(inChain ? " | " : "#[");
            current.callee().accept(this);

            var trailing = trailingPositional(current.args());
            if (trailing.isPresent() && trailing.get() instanceof Expr.Call next) {
                log.trace("Folding trailing call at {} into chain", next.span());
                bracketArgs(current.args().head());
                current = next;
                inChain = true;
                continue;
            }
            if (trailing.isPresent() && trailing.get() instanceof Expr.Template body) {
                log.trace("Attaching trailing template at {} as body", body.span());
                bracketArgs(current.args().head());
                p.push(']');
                body.accept(this);
                return;
            }
            bracketArgs(current.args().items());
            p.push(']');
            return;
        }
    }

    private void bracketArgs(List<Argument> items) {
        if (!items.isEmpty()) {
            p.push(' ')
             .join(items, ", ", this::argument);
        }
    }

    private static Optional<Expr> trailingPositional(Args args) {
        return args.last()
                   .filter(Argument.Positional.class::isInstance)
                   .map(argument -> ((Argument.Positional) argument).expr());
    }

    // === Helpers ===

    private void expr(Expr expr) {
        expr.accept(this);
    }

    private void named(Named named) {
        named.name().accept(this);
        p.push(": ");
        named.expr().accept(this);
    }

    private void argument(Argument argument) {
        if (argument instanceof Named named) {
            named(named);
        } else {
            ((Argument.Positional) argument).expr().accept(this);
        }
    }

    private void pattern(ForPattern pattern) {
        if (pattern instanceof ForPattern.KeyValue keyValue) {
            keyValue.key().accept(this);
            p.push(", ");
            keyValue.value().accept(this);
        } else {
            ((ForPattern.Value) pattern).value().accept(this);
        }
    }
}
