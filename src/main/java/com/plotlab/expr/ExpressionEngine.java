package com.plotlab.expr;

import java.util.List;

import com.plotlab.debug.Debug;
import com.plotlab.expr.functions.FunctionRegistry;
import com.plotlab.expr.parser.EvaluationOutcome;
import com.plotlab.expr.parser.ExpressionException;
import com.plotlab.expr.parser.Lexer;
import com.plotlab.expr.parser.Parser;
import com.plotlab.expr.parser.Token;

/**
 * Entry point for turning user text into something that can be evaluated.
 *
 * - Closed grammar: numbers, {@code x}, + - * / % ** and parentheses
 * - Sandboxed: identifiers resolve only against the {@link FunctionRegistry}
 * - Stateless after construction; safe to share between sessions
 */
public class ExpressionEngine {

    private final FunctionRegistry registry;

    public ExpressionEngine() {
        this(FunctionRegistry.standard());
    }

    public ExpressionEngine(FunctionRegistry registry) {
        if (registry == null) throw new IllegalArgumentException("registry must not be null");
        this.registry = registry;
    }

    /**
     * Tokenizes and parses {@code text}.
     *
     * @throws ExpressionException for lexical, syntax, unknown-name and arity errors,
     *                             and for blank input ({@code ErrorKind.EMPTY})
     */
    public CompiledExpression compile(String text) {
        String source = (text == null) ? "" : text;
        List<Token> tokens = new Lexer(source).tokenize();
        CompiledExpression compiled = new CompiledExpression(source, new Parser(tokens, registry).parse());
        if (Debug.get().enabled()) {
            Debug.get().t(Debug.TAG_PARSE, "compiled '" + source + "' -> " + compiled.canonicalForm());
        }
        return compiled;
    }

    /** Compiles and evaluates once; compile errors come back as failed outcomes. */
    public EvaluationOutcome evaluate(String text, double x) {
        CompiledExpression compiled;
        try {
            compiled = compile(text);
        } catch (ExpressionException e) {
            Debug.get().d(Debug.TAG_PARSE, "rejected '" + text + "': " + e.getMessage());
            return EvaluationOutcome.fromParseError(e);
        }
        return compiled.evaluate(x);
    }
}
