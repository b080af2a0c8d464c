package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class UnaryExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    UnaryOperator operator;

    @NonNull
    Expression operand;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.UNARY;
    }
}
