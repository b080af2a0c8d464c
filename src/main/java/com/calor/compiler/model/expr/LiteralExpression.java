package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * Literal value. The value is a {@code Long}, {@code Double}, {@code BigDecimal},
 * {@code String}, {@code Boolean}, {@code Character} or null, matching {@link #literalKind}.
 */
@Value
public class LiteralExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    LiteralKind literalKind;

    Object value;

    public static LiteralExpression ofInt(Span span, long value) {
        return new LiteralExpression(span, LiteralKind.INT, value);
    }

    public static LiteralExpression ofString(Span span, String value) {
        return new LiteralExpression(span, LiteralKind.STRING, value);
    }

    public static LiteralExpression ofBool(Span span, boolean value) {
        return new LiteralExpression(span, LiteralKind.BOOL, value);
    }

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.LITERAL;
    }
}
