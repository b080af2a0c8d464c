package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code (unwrap e)} or {@code (unwrap-or e default)} over an Option or Result.
 */
@Value
public class UnwrapExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression operand;

    Expression defaultValue;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.UNWRAP;
    }
}
