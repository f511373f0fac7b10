package com.plotlab.sampling;

import java.util.ArrayList;
import java.util.List;

import com.plotlab.debug.Debug;
import com.plotlab.expr.CompiledExpression;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.expr.parser.EvaluationOutcome;
import com.plotlab.expr.parser.ExpressionException;

/**
 * Evaluates an expression at every step of the domain and collects the
 * points that produced a finite value.
 *
 * A failing point is dropped on its own; it never invalidates the rest of
 * the curve. The result is valid iff at least one point survived.
 */
public class Sampler {

    private final ExpressionEngine engine;
    private final SamplingSettings settings;

    public Sampler(ExpressionEngine engine, SamplingSettings settings) {
        if (engine == null) throw new IllegalArgumentException("engine must not be null");
        if (settings == null) throw new IllegalArgumentException("settings must not be null");
        this.engine = engine;
        this.settings = settings;
    }

    /** Compiles and samples {@code text}; rejected or blank text yields an invalid result. */
    public SampleResult sample(String text) {
        String trimmed = (text == null) ? "" : text.trim();
        if (trimmed.isEmpty()) {
            return SampleResult.invalid(settings.fallbackRange, null);
        }
        CompiledExpression compiled;
        try {
            compiled = engine.compile(trimmed);
        } catch (ExpressionException e) {
            Debug.get().d(Debug.TAG_SAMPLE, "not sampling '" + trimmed + "': " + e.getMessage());
            return SampleResult.invalid(settings.fallbackRange, e.getMessage());
        }
        return sample(compiled);
    }

    public SampleResult sample(CompiledExpression expression) {
        List<SamplePoint> points = new ArrayList<>(settings.steps + 1);
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        int skipped = 0;

        for (int i = 0; i <= settings.steps; i++) {
            double x = settings.xAt(i);
            EvaluationOutcome outcome = expression.evaluate(x);
            if (!outcome.isSuccess()) {
                skipped++;
                continue;
            }
            double y = outcome.getValue();
            points.add(new SamplePoint(x, y));
            if (y < min) min = y;
            if (y > max) max = y;
        }

        if (points.isEmpty()) {
            Debug.get().d(Debug.TAG_SAMPLE, "'" + expression.getSource() + "' has no valid point on ["
                    + settings.xMin + ", " + settings.xMax + "]");
            return new SampleResult(Curve.empty(), false, settings.fallbackRange, skipped, null);
        }
        if (skipped > 0) {
            Debug.get().t(Debug.TAG_SAMPLE, "'" + expression.getSource() + "' skipped " + skipped + " point(s)");
        }
        return new SampleResult(Curve.of(points), true, plotRange(min, max), skipped, null);
    }

    /**
     * Pads the observed [min, max] by the margin ratio. A flat curve is first
     * widened by the constant padding so the range never collapses.
     */
    YRange plotRange(double min, double max) {
        if (min == max) {
            min -= settings.constantPadding;
            max += settings.constantPadding;
        }
        double margin = (max - min) * settings.marginRatio;
        return new YRange(min - margin, max + margin);
    }
}
