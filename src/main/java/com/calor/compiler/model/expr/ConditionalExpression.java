package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code (? condition whenTrue whenFalse)}.
 */
@Value
public class ConditionalExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression condition;

    @NonNull
    Expression whenTrue;

    @NonNull
    Expression whenFalse;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CONDITIONAL;
    }
}
