package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §USE{id:name:type} resource … §/USE{id}}: the resource is disposed when the body exits.
 */
@Value
public class UsingStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String variable;

    String variableType;

    @NonNull
    Expression resource;

    @NonNull
    List<Statement> body;

    @Override
    public StatementKind kind() {
        return StatementKind.USING;
    }
}
