package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class StringOpExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    StringOp operation;

    @NonNull
    List<Expression> arguments;

    /** Null when no {@code :mode} suffix was written. */
    ComparisonMode comparisonMode;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.STRING_OP;
    }
}
