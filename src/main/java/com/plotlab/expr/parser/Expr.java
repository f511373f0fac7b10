package com.plotlab.expr.parser;

import java.util.List;

import com.plotlab.expr.functions.FunctionRegistry;

/**
 * Expression tree nodes. Every node is immutable; children are fixed at
 * construction so a tree can never contain a cycle.
 */
public class Expr {

    public interface ExprInterface {
        <R> R accept(ExprVisitor<R> visitor);
    }

    public interface ExprVisitor<R> {
        R visitConstantExpr(Constant expr);
        R visitVariableExpr(Variable expr);
        R visitCallExpr(Call expr);
        R visitBinaryExpr(Binary expr);
        R visitNegateExpr(Negate expr);
    }

    /** Numeric literal, or a registered named constant such as {@code pi}. */
    public static final class Constant implements ExprInterface {
        public final double value;
        /** Constant name, or null for a plain literal. */
        public final String name;

        public Constant(double value, String name) {
            this.value = value;
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitConstantExpr(this);
        }
    }

    /** Reference to the free variable {@code x}. */
    public static final class Variable implements ExprInterface {
        public final Token name;

        public Variable(Token name) {
            this.name = name;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitVariableExpr(this);
        }
    }

    /** Call of a registry function; the function is resolved at parse time. */
    public static final class Call implements ExprInterface {
        public final Token name;
        public final FunctionRegistry.Function function;
        public final List<ExprInterface> arguments;

        public Call(Token name, FunctionRegistry.Function function, List<ExprInterface> arguments) {
            this.name = name;
            this.function = function;
            this.arguments = List.copyOf(arguments);
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitCallExpr(this);
        }
    }

    public static final class Binary implements ExprInterface {
        public final ExprInterface left;
        public final Token operator;
        public final ExprInterface right;

        public Binary(ExprInterface left, Token operator, ExprInterface right) {
            this.left = left;
            this.operator = operator;
            this.right = right;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitBinaryExpr(this);
        }
    }

    public static final class Negate implements ExprInterface {
        public final Token operator;
        public final ExprInterface operand;

        public Negate(Token operator, ExprInterface operand) {
            this.operator = operator;
            this.operand = operand;
        }

        @Override
        public <R> R accept(ExprVisitor<R> visitor) {
            return visitor.visitNegateExpr(this);
        }
    }

    private Expr() {}
}
