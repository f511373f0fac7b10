package com.plotlab.expr.parser;

import java.util.StringJoiner;

/**
 * Renders a tree as a fully parenthesised prefix form, e.g.
 * {@code (+ (call sin x) 2.0)}. Two trees print the same iff they have the
 * same shape, operators and leaves.
 */
public final class ExprPrinter implements Expr.ExprVisitor<String> {

    public static String print(Expr.ExprInterface expr) {
        return expr.accept(new ExprPrinter());
    }

    @Override
    public String visitConstantExpr(Expr.Constant expr) {
        return expr.name != null ? expr.name : Double.toString(expr.value);
    }

    @Override
    public String visitVariableExpr(Expr.Variable expr) {
        return expr.name.lexeme;
    }

    @Override
    public String visitCallExpr(Expr.Call expr) {
        StringJoiner sj = new StringJoiner(" ", "(call " + expr.function.name + (expr.arguments.isEmpty() ? "" : " "), ")");
        for (Expr.ExprInterface arg : expr.arguments) {
            sj.add(arg.accept(this));
        }
        return sj.toString();
    }

    @Override
    public String visitBinaryExpr(Expr.Binary expr) {
        return "(" + expr.operator.lexeme + " " + expr.left.accept(this) + " " + expr.right.accept(this) + ")";
    }

    @Override
    public String visitNegateExpr(Expr.Negate expr) {
        return "(neg " + expr.operand.accept(this) + ")";
    }

    private ExprPrinter() {}
}
