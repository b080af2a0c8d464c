package com.calor.compiler.parser;

public enum TokenKind {
    TAG,
    CLOSING_TAG,
    IDENTIFIER,
    INT_LITERAL,
    FLOAT_LITERAL,
    DECIMAL_LITERAL,
    STRING_LITERAL,
    CHAR_LITERAL,
    BOOL_LITERAL,
    NULL_LITERAL,
    OPERATOR,
    ARROW,
    EQUALS,
    COLON,
    COMMA,
    DOT,
    LPAREN,
    RPAREN,
    LBRACE,
    RBRACE,
    LBRACKET,
    RBRACKET,
    EOF;

    public boolean isLiteral() {
        return this == INT_LITERAL || this == FLOAT_LITERAL || this == DECIMAL_LITERAL
                || this == STRING_LITERAL || this == CHAR_LITERAL || this == BOOL_LITERAL
                || this == NULL_LITERAL;
    }
}
