package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code (unchecked e)}: integer arithmetic inside wraps instead of trapping.
 */
@Value
public class UncheckedExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression operand;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.UNCHECKED;
    }
}
