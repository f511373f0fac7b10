import com.plotlab.expr.CompiledExpression;
import com.plotlab.expr.ExpressionEngine;
import com.plotlab.expr.parser.ExpressionException;
import com.plotlab.expr.parser.ExpressionException.ErrorKind;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private final ExpressionEngine engine = new ExpressionEngine();

    private String tree(String src) {
        return engine.compile(src).canonicalForm();
    }

    private ErrorKind rejectKind(String src) {
        ExpressionException e = assertThrows(ExpressionException.class, () -> engine.compile(src), src);
        return e.getKind();
    }

    @Test
    void sameTextParsesToSameTree() {
        String src = "floor(sin(x * 3)) + x / 5 - -exp(-x) * 2 ** x % 7";
        CompiledExpression a = engine.compile(src);
        CompiledExpression b = engine.compile(src);
        assertNotSame(a.getRoot(), b.getRoot());
        assertEquals(a.canonicalForm(), b.canonicalForm());
    }

    @Test
    void multiplicationBindsTighterThanAddition() {
        assertEquals("(+ 2.0 (* 3.0 x))", tree("2 + 3 * x"));
        assertEquals("(* (+ 2.0 3.0) x)", tree("(2 + 3) * x"));
    }

    @Test
    void subtractionAndDivisionAreLeftAssociative() {
        assertEquals("(- (- 10.0 4.0) 3.0)", tree("10 - 4 - 3"));
        assertEquals("(/ (/ x 2.0) 3.0)", tree("x / 2 / 3"));
    }

    @Test
    void powerIsRightAssociativeAndAboveUnaryMinus() {
        assertEquals("(** 2.0 (** 3.0 2.0))", tree("2 ** 3 ** 2"));
        assertEquals("(neg (** x 2.0))", tree("-x ** 2"));
        assertEquals("(** 2.0 (neg x))", tree("2 ** -x"));
    }

    @Test
    void unaryPlusIsTransparent() {
        assertEquals(tree("x"), tree("+x"));
    }

    @Test
    void constantsAndCalls() {
        assertEquals("(* 2.0 pi)", tree("2 * pi"));
        assertEquals("(call pow x e)", tree("pow(x, e)"));
        assertEquals("(call log x 10.0)", tree("log(x, 10)"));
        assertEquals("(call sqrt (call abs (call sin (* x 3.0))))", tree("sqrt(abs(sin(x * 3)))"));
    }

    @Test
    void grammarErrors() {
        assertEquals(ErrorKind.SYNTAX, rejectKind("sin(x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("(x + 1"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("x + 1)"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("x x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("x +"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("* x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("sin x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("sin()"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("sin(x,)"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("pi(2)"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("x(2)"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("()"));
    }

    @Test
    void blankInputIsEmpty() {
        assertEquals(ErrorKind.EMPTY, rejectKind(""));
        assertEquals(ErrorKind.EMPTY, rejectKind("   "));
    }

    @Test
    void unknownNamesAreRejectedAtParseTime() {
        assertEquals(ErrorKind.UNKNOWN_IDENTIFIER, rejectKind("foo(x)"));
        assertEquals(ErrorKind.UNKNOWN_IDENTIFIER, rejectKind("y + 1"));
        assertEquals(ErrorKind.UNKNOWN_IDENTIFIER, rejectKind("SIN(x)"));
        assertEquals(ErrorKind.UNKNOWN_IDENTIFIER, rejectKind("X"));
    }

    @Test
    void wrongArgumentCountIsArityMismatch() {
        assertEquals(ErrorKind.ARITY_MISMATCH, rejectKind("pow(x)"));
        assertEquals(ErrorKind.ARITY_MISMATCH, rejectKind("sin(x, 2)"));
        assertEquals(ErrorKind.ARITY_MISMATCH, rejectKind("log(x, 2, 3)"));
    }

    @Test
    void escapeAttemptsNeverCompile() {
        String[] hostile = {
                "__import__('os').system('ls')",
                "os.system(1)",
                "open(x)",
                "exec(x)",
                "eval(x)",
                "getClass(x)",
                "Runtime(x)",
                "x; exit()",
                "x[0]",
                "\"rm -rf\"",
                "lambda(x)",
                "System.exit(0)",
        };
        for (String src : hostile) {
            assertThrows(ExpressionException.class, () -> engine.compile(src), src);
        }
    }

    @Test
    void nestingIsBounded() {
        String ok = "(".repeat(50) + "x" + ")".repeat(50);
        assertEquals("x", tree(ok));

        String deep = "(".repeat(150) + "x" + ")".repeat(150);
        ExpressionException e = assertThrows(ExpressionException.class, () -> engine.compile(deep));
        assertEquals(ErrorKind.SYNTAX, e.getKind());
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());

        assertEquals(ErrorKind.SYNTAX, rejectKind("-".repeat(150) + "x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("sin(".repeat(150) + "x" + ")".repeat(150)));
    }

    @Test
    void hugeInputIsRejectedNotOverflowed() {
        assertEquals(ErrorKind.SYNTAX, rejectKind("(".repeat(20000) + "x" + ")".repeat(20000)));
        assertEquals(ErrorKind.SYNTAX, rejectKind("-".repeat(50000) + "x"));
        assertEquals(ErrorKind.SYNTAX, rejectKind("x" + " + x".repeat(5000)));

        ExpressionException e = assertThrows(ExpressionException.class,
                () -> engine.compile("x" + " + x".repeat(5000)));
        assertTrue(e.getMessage().contains("too long"), e.getMessage());
    }

    @Test
    void longButShallowInputStillParses() {
        String src = "x" + " + x".repeat(400);
        assertEquals(401.0, engine.compile(src).evaluate(1.0).getValue(), 1e-9);
    }

    @Test
    void errorMessageCarriesColumn() {
        ExpressionException e = assertThrows(ExpressionException.class, () -> engine.compile("x + foo(1)"));
        assertEquals(4, e.getOffset());
        assertTrue(e.getMessage().startsWith("[col 4]"), e.getMessage());
    }
}
