package com.calor.compiler.model.stmt;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class AssignStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression target;

    @NonNull
    Expression value;

    @Override
    public StatementKind kind() {
        return StatementKind.ASSIGN;
    }
}
