package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class BuilderOpExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    BuilderOp operation;

    @NonNull
    List<Expression> arguments;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.BUILDER_OP;
    }
}
