package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class DoWhileStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    List<Statement> body;

    @NonNull
    Expression condition;

    @Override
    public StatementKind kind() {
        return StatementKind.DO_WHILE;
    }
}
