package com.plotlab.expr.parser;

import java.util.ArrayList;
import java.util.List;

import com.plotlab.expr.functions.FunctionRegistry;
import com.plotlab.expr.parser.Expr.Binary;
import com.plotlab.expr.parser.Expr.Call;
import com.plotlab.expr.parser.Expr.Constant;
import com.plotlab.expr.parser.Expr.Negate;
import com.plotlab.expr.parser.Expr.Variable;
import com.plotlab.expr.parser.ExpressionException.ErrorKind;

/**
 * Recursive-descent parser for single-variable arithmetic.
 *
 * <pre>
 * expression -> term
 * term       -> factor ( ( "+" | "-" ) factor )*
 * factor     -> unary ( ( "*" | "/" | "%" ) unary )*
 * unary      -> ( "-" | "+" ) unary | power
 * power      -> primary ( "**" unary )?
 * primary    -> NUMBER | "x" | CONSTANT | FUNCTION "(" arguments ")" | "(" expression ")"
 * </pre>
 *
 * {@code **} binds tighter than unary minus and associates to the right, so
 * {@code -x ** 2} is {@code -(x ** 2)} and {@code 2 ** 3 ** 2} is
 * {@code 2 ** (3 ** 2)}. Identifiers are resolved against the registry here;
 * unknown names and wrong argument counts never reach evaluation.
 *
 * Input is capped at {@link #MAX_TOKENS} tokens and {@link #MAX_NESTING}
 * levels of parentheses, signs and exponents, which bounds the depth of every
 * tree this parser returns.
 */
public class Parser {
    public static final int MAX_TOKENS = 1000;
    public static final int MAX_NESTING = 100;

    private final List<Token> tokens;
    private final FunctionRegistry registry;
    private int current = 0;
    private int depth = 0;

    public Parser(List<Token> tokens, FunctionRegistry registry) {
        this.tokens = tokens;
        this.registry = registry;
    }

    public Expr.ExprInterface parse() {
        if (isAtEnd()) {
            throw new ExpressionException(ErrorKind.EMPTY, peek().offset, "Empty expression.");
        }
        // the trailing EOF token does not count
        if (tokens.size() - 1 > MAX_TOKENS) {
            throw error(tokens.get(MAX_TOKENS), "Expression too long (more than " + MAX_TOKENS + " tokens).");
        }
        Expr.ExprInterface expr = expression();
        if (!isAtEnd()) {
            throw error(peek(), "Unexpected '" + peek().lexeme + "' after expression.");
        }
        return expr;
    }

    private Expr.ExprInterface expression() { return term(); }

    private Expr.ExprInterface term() {
        Expr.ExprInterface expr = factor();
        while (match(TokenType.PLUS, TokenType.MINUS)) {
            Token op = previous();
            Expr.ExprInterface right = factor();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface factor() {
        Expr.ExprInterface expr = unary();
        while (match(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT)) {
            Token op = previous();
            Expr.ExprInterface right = unary();
            expr = new Binary(expr, op, right);
        }
        return expr;
    }

    private Expr.ExprInterface unary() {
        if (++depth > MAX_NESTING) {
            throw error(peek(), "Expression nested too deeply.");
        }
        try {
            if (match(TokenType.MINUS)) {
                Token op = previous();
                Expr.ExprInterface operand = unary();
                return new Negate(op, operand);
            }
            if (match(TokenType.PLUS)) {
                return unary();
            }
            return power();
        } finally {
            depth--;
        }
    }

    private Expr.ExprInterface power() {
        Expr.ExprInterface base = primary();
        if (match(TokenType.DOUBLE_STAR)) {
            Token op = previous();
            Expr.ExprInterface exponent = unary();
            return new Binary(base, op, exponent);
        }
        return base;
    }

    private Expr.ExprInterface primary() {
        if (match(TokenType.NUMBER)) return new Constant(previous().literal, null);
        if (match(TokenType.IDENTIFIER)) return identifier(previous());

        if (match(TokenType.LEFT_PAREN)) {
            Expr.ExprInterface expr = expression();
            consume(TokenType.RIGHT_PAREN, "Expect ')' after expression.");
            return expr;
        }

        if (isAtEnd()) throw error(peek(), "Unexpected end of expression.");
        throw error(peek(), "Expect expression, got '" + peek().lexeme + "'.");
    }

    private Expr.ExprInterface identifier(Token name) {
        String id = name.lexeme;

        if (FunctionRegistry.VARIABLE.equals(id)) return new Variable(name);

        if (registry.isConstant(id)) {
            if (check(TokenType.LEFT_PAREN)) {
                throw error(peek(), "'" + id + "' is a constant, not a function.");
            }
            return new Constant(registry.constant(id), id);
        }

        FunctionRegistry.Function fn = registry.function(id);
        if (fn == null) {
            throw new ExpressionException(ErrorKind.UNKNOWN_IDENTIFIER, name.offset, "Unknown identifier '" + id + "'.");
        }
        consume(TokenType.LEFT_PAREN, "Expect '(' after function name '" + id + "'.");
        return finishCall(name, fn);
    }

    private Expr.ExprInterface finishCall(Token name, FunctionRegistry.Function fn) {
        List<Expr.ExprInterface> arguments = new ArrayList<>();

        if (check(TokenType.RIGHT_PAREN)) {
            throw error(peek(), name.lexeme + "() requires " + fn.arityDescription() + " argument(s).");
        }
        do {
            arguments.add(expression());
        } while (match(TokenType.COMMA));

        consume(TokenType.RIGHT_PAREN, "Expect ')' after arguments.");

        if (!fn.acceptsArity(arguments.size())) {
            throw new ExpressionException(ErrorKind.ARITY_MISMATCH, name.offset,
                    name.lexeme + "() expects " + fn.arityDescription() + " argument(s), got " + arguments.size() + ".");
        }
        return new Call(name, fn, arguments);
    }

    private boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    private Token consume(TokenType type, String message) {
        if (check(type)) return advance();
        throw error(peek(), message);
    }

    private boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type == type;
    }

    private Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    private boolean isAtEnd() { return peek().type == TokenType.EOF; }
    private Token peek() { return tokens.get(current); }
    private Token previous() { return tokens.get(current - 1); }

    private ExpressionException error(Token token, String message) {
        return new ExpressionException(ErrorKind.SYNTAX, token.offset, message);
    }
}
