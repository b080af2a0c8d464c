package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class ForeachStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String variable;

    String variableType;

    @NonNull
    Expression collection;

    @NonNull
    BodyForm form;

    @NonNull
    List<Statement> body;

    @Override
    public StatementKind kind() {
        return StatementKind.FOREACH;
    }
}
