package com.plotlab.expr;

import com.plotlab.expr.parser.EvaluationOutcome;
import com.plotlab.expr.parser.Evaluator;
import com.plotlab.expr.parser.Expr;
import com.plotlab.expr.parser.ExprPrinter;

/** Parsed, name-checked expression ready for repeated evaluation. */
public final class CompiledExpression {

    private final String source;
    private final Expr.ExprInterface root;

    CompiledExpression(String source, Expr.ExprInterface root) {
        this.source = source;
        this.root = root;
    }

    public String getSource() {
        return source;
    }

    public Expr.ExprInterface getRoot() {
        return root;
    }

    public EvaluationOutcome evaluate(double x) {
        return Evaluator.evaluate(root, x);
    }

    /** Canonical prefix rendering of the tree; equal for structurally identical trees. */
    public String canonicalForm() {
        return ExprPrinter.print(root);
    }

    @Override
    public String toString() {
        return source;
    }
}
