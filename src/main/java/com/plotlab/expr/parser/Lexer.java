package com.plotlab.expr.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.plotlab.expr.parser.ExpressionException.ErrorKind;

/**
 * Splits expression text into tokens. Whitespace is never significant; the
 * returned list always ends with an EOF token.
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int start = 0;
    private int current = 0;

    public Lexer(String source) {
        this.source = (source == null) ? "" : source;
    }

    public List<Token> tokenize() {
        while (!isAtEnd()) {
            start = current;
            scanToken();
        }
        tokens.add(new Token(TokenType.EOF, "", null, current));
        return Collections.unmodifiableList(tokens);
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '(': addToken(TokenType.LEFT_PAREN); break;
            case ')': addToken(TokenType.RIGHT_PAREN); break;
            case ',': addToken(TokenType.COMMA); break;
            case '+': addToken(TokenType.PLUS); break;
            case '-': addToken(TokenType.MINUS); break;
            case '/': addToken(TokenType.SLASH); break;
            case '%': addToken(TokenType.PERCENT); break;
            case '*':
                if (match('*')) addToken(TokenType.DOUBLE_STAR);
                else addToken(TokenType.STAR);
                break;
            case ' ': case '\r': case '\t': case '\n':
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) number();
                else if (isAlpha(c)) identifier();
                else throw error(start, "Unexpected character: '" + c + "'");
        }
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        addToken(TokenType.IDENTIFIER);
    }

    private void number() {
        boolean seenDot = source.charAt(start) == '.';
        while (isDigit(peek()) || peek() == '.') {
            if (peek() == '.') {
                if (seenDot) throw error(current, "Second decimal point in number literal");
                seenDot = true;
            }
            advance();
        }
        double value = Double.parseDouble(source.substring(start, current));
        addToken(TokenType.NUMBER, value);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advance() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z');
    }
    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private void addToken(TokenType type) { addToken(type, null); }
    private void addToken(TokenType type, Double literal) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, literal, start));
    }

    private ExpressionException error(int offset, String msg) {
        return new ExpressionException(ErrorKind.LEXICAL, offset, msg);
    }
}
