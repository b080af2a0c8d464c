package com.calor.compiler.model.stmt;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

@Value
public class ReturnStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    Expression value;

    @Override
    public StatementKind kind() {
        return StatementKind.RETURN;
    }
}
