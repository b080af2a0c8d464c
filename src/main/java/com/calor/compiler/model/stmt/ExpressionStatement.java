package com.calor.compiler.model.stmt;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * A call or increment evaluated for its effect.
 */
@Value
public class ExpressionStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression expression;

    @Override
    public StatementKind kind() {
        return StatementKind.EXPRESSION;
    }
}
