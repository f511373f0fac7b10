import com.plotlab.expr.CompiledExpression;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.expr.parser.EvaluationOutcome;
import com.plotlab.expr.parser.EvaluationOutcome.Failure;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class EvaluatorTest {

    private final ExpressionEngine engine = new ExpressionEngine();

    private double value(String src, double x) {
        EvaluationOutcome o = engine.evaluate(src, x);
        assertTrue(o.isSuccess(), () -> src + " -> " + o);
        return o.getValue();
    }

    private Failure failure(String src, double x) {
        EvaluationOutcome o = engine.evaluate(src, x);
        assertFalse(o.isSuccess(), () -> src + " unexpectedly gave " + o);
        return o.getFailure();
    }

    @Test
    void arithmeticPrecedence() {
        assertEquals(14.0, value("2 + 3 * 4", 0), 1e-12);
        assertEquals(20.0, value("(2 + 3) * 4", 0), 1e-12);
        assertEquals(11.0, value("10 / 2 + 6", 0), 1e-12);
        assertEquals(512.0, value("2 ** 3 ** 2", 0), 1e-12);
        assertEquals(-4.0, value("-2 ** 2", 0), 1e-12);
        assertEquals(0.5, value("2 ** -1", 0), 1e-12);
        assertEquals(64.0, value("(-8) ** 2", 0), 1e-12);
    }

    @Test
    void variableIsBound() {
        assertEquals(9.0, value("x * x", 3), 1e-12);
        assertEquals(0.0, value("sin(x)", 0), 1e-12);
        assertEquals(-2.5, value("-x", 2.5), 1e-12);
    }

    @Test
    void moduloTakesSignOfDivisor() {
        assertEquals(2.0, value("10 % 4", 0), 1e-12);
        assertEquals(2.0, value("-7 % 3", 0), 1e-12);
        assertEquals(-2.0, value("7 % -3", 0), 1e-12);
        assertEquals(0.5, value("x % 1", 2.5), 1e-12);
    }

    @Test
    void namedFunctionsAndConstants() {
        assertEquals(Math.PI, value("pi", 0), 0.0);
        assertEquals(Math.E, value("e", 0), 0.0);
        assertEquals(1024.0, value("pow(2, 10)", 0), 1e-12);
        assertEquals(2.0, value("log10(100)", 0), 1e-12);
        assertEquals(3.0, value("log(8, 2)", 0), 1e-12);
        assertEquals(1.0, value("log(e)", 0), 1e-12);
        assertEquals(3.0, value("abs(-3)", 0), 0.0);
        assertEquals(-2.0, value("floor(-1.5)", 0), 0.0);
        assertEquals(-1.0, value("ceil(-1.5)", 0), 0.0);
        assertEquals(Math.PI / 2, value("asin(1)", 0), 1e-12);
        assertEquals(0.0, value("tanh(0) + sinh(0)", 0), 0.0);
        assertEquals(1.0, value("cosh(0)", 0), 0.0);
    }

    @Test
    void roundHalfToEven() {
        assertEquals(2.0, value("round(2.5)", 0), 0.0);
        assertEquals(4.0, value("round(3.5)", 0), 0.0);
        assertEquals(-2.0, value("round(-2.5)", 0), 0.0);
        assertEquals(3.0, value("round(2.6)", 0), 0.0);
    }

    @Test
    void divisionAndModuloByZeroAreDomainErrors() {
        assertEquals(Failure.DOMAIN_ERROR, failure("1 / x", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("5 % x", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("0 ** -1", 0));
    }

    @Test
    void logOfNonPositiveIsDomainError() {
        assertEquals(Failure.DOMAIN_ERROR, failure("log(x)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("log(x)", -1));
        assertEquals(Failure.DOMAIN_ERROR, failure("log10(x)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("log(8, 1)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("log(8, -2)", 0));
    }

    @Test
    void resultsWithoutRealValueAreDomainErrors() {
        assertEquals(Failure.DOMAIN_ERROR, failure("sqrt(x - 20)", 3));
        assertEquals(Failure.DOMAIN_ERROR, failure("asin(2)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("acos(-1.5)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("(-8) ** (1 / 3)", 0));
        assertEquals(Failure.DOMAIN_ERROR, failure("pow(-2, 0.5)", 0));
    }

    @Test
    void overflowIsNonFinite() {
        assertEquals(Failure.NON_FINITE, failure("exp(1000)", 0));
        assertEquals(Failure.NON_FINITE, failure("10 ** 400", 0));
        assertEquals(Failure.NON_FINITE, failure("cosh(x)", 1000));
        // an infinite intermediate never turns into a finite answer
        assertEquals(Failure.NON_FINITE, failure("atan(exp(1000))", 0));
    }

    @Test
    void compileErrorsBecomeOutcomes() {
        assertEquals(Failure.PARSE_ERROR, failure("sin(x", 0));
        assertEquals(Failure.PARSE_ERROR, failure("", 0));
        assertEquals(Failure.UNKNOWN_IDENTIFIER, failure("foo(x)", 0));
        assertEquals(Failure.ARITY_MISMATCH, failure("pow(x)", 0));
    }

    @Test
    void evaluationIsRepeatable() {
        CompiledExpression expr = engine.compile("sin(x) / x + log(abs(x)) ** 2");
        double[] xs = {-3.5, -1, 0, 0.25, 1, 7.75};
        for (double x : xs) {
            EvaluationOutcome first = expr.evaluate(x);
            for (int i = 0; i < 20; i++) {
                assertEquals(first, expr.evaluate(x), "x=" + x);
            }
        }
        assertFalse(expr.evaluate(0).isSuccess());
    }

    @Test
    void failedOutcomeHasNoValue() {
        EvaluationOutcome o = engine.evaluate("1 / 0", 0);
        assertThrows(IllegalStateException.class, o::getValue);
        assertNotNull(o.getMessage());
    }
}
