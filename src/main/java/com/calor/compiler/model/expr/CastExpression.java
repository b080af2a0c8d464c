package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code (cast type e)}: the only way to write a narrowing numeric conversion.
 */
@Value
public class CastExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String targetType;

    @NonNull
    Expression operand;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CAST;
    }
}
