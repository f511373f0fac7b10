package com.plotlab.expr.parser;

import com.plotlab.expr.functions.DomainException;
import com.plotlab.expr.functions.MathFunctions;
import com.plotlab.expr.parser.EvaluationOutcome.Failure;

/**
 * Walks an expression tree for one value of {@code x}.
 *
 * An Evaluator holds nothing but that value, so evaluating the same tree at
 * the same {@code x} always yields the same outcome. Domain violations and
 * non-finite intermediate results end the walk and come back as a failed
 * {@link EvaluationOutcome}; nothing escapes as an exception.
 */
public final class Evaluator implements Expr.ExprVisitor<Double> {

    private final double x;

    private Evaluator(double x) {
        this.x = x;
    }

    public static EvaluationOutcome evaluate(Expr.ExprInterface expr, double x) {
        try {
            return EvaluationOutcome.success(expr.accept(new Evaluator(x)));
        } catch (DomainException e) {
            return EvaluationOutcome.failed(Failure.DOMAIN_ERROR, e.getMessage());
        } catch (NonFiniteResult e) {
            return EvaluationOutcome.failed(Failure.NON_FINITE, e.getMessage());
        }
    }

    @Override
    public Double visitConstantExpr(Expr.Constant expr) {
        return expr.value;
    }

    @Override
    public Double visitVariableExpr(Expr.Variable expr) {
        return x;
    }

    @Override
    public Double visitCallExpr(Expr.Call expr) {
        double[] args = new double[expr.arguments.size()];
        for (int i = 0; i < args.length; i++) {
            args[i] = eval(expr.arguments.get(i));
        }
        return finite(expr.function.apply(args), expr.function.name + "()");
    }

    @Override
    public Double visitBinaryExpr(Expr.Binary expr) {
        double left = eval(expr.left);
        double right = eval(expr.right);
        TokenType op = expr.operator.type;

        switch (op) {
            case PLUS:
                return finite(left + right, "+");
            case MINUS:
                return finite(left - right, "-");
            case STAR:
                return finite(left * right, "*");
            case SLASH:
                if (right == 0.0) throw new DomainException("division by zero");
                return finite(left / right, "/");
            case PERCENT:
                if (right == 0.0) throw new DomainException("modulo by zero");
                return finite(floorMod(left, right), "%");
            case DOUBLE_STAR:
                return finite(MathFunctions.power(left, right), "**");
            default:
                throw new IllegalStateException("Unsupported binary operator: " + op);
        }
    }

    @Override
    public Double visitNegateExpr(Expr.Negate expr) {
        return -eval(expr.operand);
    }

    private double eval(Expr.ExprInterface expr) {
        return expr.accept(this);
    }

    /** Remainder carrying the sign of the divisor: {@code -7 % 3 == 2}. */
    static double floorMod(double a, double b) {
        double r = a % b;
        if (r != 0.0 && ((r < 0) != (b < 0))) r += b;
        return r;
    }

    private static double finite(double v, String where) {
        if (Double.isNaN(v)) throw new NonFiniteResult(where + " produced NaN");
        if (Double.isInfinite(v)) throw new NonFiniteResult(where + " overflowed");
        return v;
    }

    private static final class NonFiniteResult extends RuntimeException {
        NonFiniteResult(String message) {
            super(message, null, false, false);
        }
    }
}
