package com.plotlab.expr.parser;

public final class Token {
    public final TokenType type;
    public final String lexeme;
    /** Parsed value for NUMBER tokens, null otherwise. */
    public final Double literal;
    /** Zero-based character offset of the first character in the source text. */
    public final int offset;

    Token(TokenType type, String lexeme, Double literal, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return type + (lexeme.isEmpty() ? "" : " '" + lexeme + "'") + " @" + offset;
    }
}
