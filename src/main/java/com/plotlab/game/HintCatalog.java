package com.plotlab.game;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.plotlab.expr.CompiledExpression;
import com.plotlab.expr.parser.Expr;

/**
 * Derives hint facts from a target's expression tree.
 *
 * Features are the function names and binary operator symbols that occur in
 * the tree; each configured feature present contributes its fact text once.
 * Working on the tree keeps {@code sinh} from being reported as a sine and
 * {@code **} from counting as multiplication.
 */
public final class HintCatalog {

    private final Map<String, String> facts;
    private final String fallback;

    public HintCatalog(Map<String, String> facts, String fallback) {
        this.facts = facts;
        this.fallback = fallback;
    }

    public static HintCatalog from(GameConfig config) {
        return new HintCatalog(config.getHintFacts(), config.getFallbackHint());
    }

    /** Distinct fact texts that apply to {@code target}, in configuration order. */
    public List<String> factsFor(CompiledExpression target) {
        Set<String> features = features(target.getRoot());
        Set<String> texts = new LinkedHashSet<>();
        for (Map.Entry<String, String> e : facts.entrySet()) {
            if (features.contains(e.getKey())) texts.add(e.getValue());
        }
        return new ArrayList<>(texts);
    }

    /** One applicable fact chosen by {@code random}, or the fallback when none applies. */
    public String pick(CompiledExpression target, RandomSource random) {
        List<String> applicable = factsFor(target);
        if (applicable.isEmpty()) return fallback;
        return applicable.get(random.nextInt(applicable.size()));
    }

    static Set<String> features(Expr.ExprInterface root) {
        Set<String> out = new LinkedHashSet<>();
        root.accept(new FeatureCollector(out));
        return out;
    }

    private static final class FeatureCollector implements Expr.ExprVisitor<Void> {
        private final Set<String> out;

        FeatureCollector(Set<String> out) {
            this.out = out;
        }

        @Override
        public Void visitConstantExpr(Expr.Constant expr) {
            if (expr.name != null) out.add(expr.name);
            return null;
        }

        @Override
        public Void visitVariableExpr(Expr.Variable expr) {
            return null;
        }

        @Override
        public Void visitCallExpr(Expr.Call expr) {
            out.add(expr.function.name);
            for (Expr.ExprInterface arg : expr.arguments) arg.accept(this);
            return null;
        }

        @Override
        public Void visitBinaryExpr(Expr.Binary expr) {
            out.add(expr.operator.lexeme);
            expr.left.accept(this);
            expr.right.accept(this);
            return null;
        }

        @Override
        public Void visitNegateExpr(Expr.Negate expr) {
            expr.operand.accept(this);
            return null;
        }
    }
}
