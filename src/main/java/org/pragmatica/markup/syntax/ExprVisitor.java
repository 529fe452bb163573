package org.pragmatica.markup.syntax;

/**
 * Exhaustive dispatch over {@link Expr} variants.
 */
public interface ExprVisitor<R> {
    R visitLit(Expr.Lit lit);

    R visitIdent(Expr.Ident ident);

    R visitArray(Expr.Array array);

    R visitDict(Expr.Dict dict);

    R visitTemplate(Expr.Template template);

    R visitGroup(Expr.Group group);

    R visitBlock(Expr.Block block);

    R visitUnary(Expr.Unary unary);

    R visitBinary(Expr.Binary binary);

    R visitCall(Expr.Call call);

    R visitLet(Expr.Let let);

    R visitIf(Expr.If anIf);

    R visitFor(Expr.For aFor);
}
