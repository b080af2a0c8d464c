package com.calor.compiler.parser;

import com.calor.compiler.model.Span;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the Calor lexer.
 */
@Data
@AllArgsConstructor
public class Token {
    private TokenKind kind;
    private String text;
    private Object value;
    private Span span;
    /** Set for TAG and CLOSING_TAG tokens. */
    private Tag tag;
    /** Attribute block written directly after a tag, otherwise {@link AttributeBlock#NONE}. */
    private AttributeBlock attributes;

    public static Token simple(TokenKind kind, String text, Span span) {
        return new Token(kind, text, null, span, null, AttributeBlock.NONE);
    }

    public static Token literal(TokenKind kind, String text, Object value, Span span) {
        return new Token(kind, text, value, span, null, AttributeBlock.NONE);
    }

    public boolean isTag(Tag expected) {
        return kind == TokenKind.TAG && tag == expected;
    }

    public boolean isClosing(Tag expected) {
        return kind == TokenKind.CLOSING_TAG && tag == expected;
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    public int getLine() {
        return span.getLine();
    }

    public int getColumn() {
        return span.getColumn();
    }

    /**
     * Span of the tag together with its attribute block.
     */
    public Span getFullSpan() {
        return attributes.isPresent() ? span.union(attributes.getSpan()) : span;
    }

    /**
     * Human-readable description used in diagnostics.
     */
    public String describe() {
        return switch (kind) {
            case TAG -> "§" + tag.getName();
            case CLOSING_TAG -> "§/" + tag.getClosingName();
            case EOF -> "end of input";
            case STRING_LITERAL -> "string literal";
            default -> "'" + text + "'";
        };
    }
}
