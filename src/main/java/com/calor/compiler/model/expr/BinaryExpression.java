package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class BinaryExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    BinaryOperator operator;

    @NonNull
    Expression left;

    @NonNull
    Expression right;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.BINARY;
    }
}
