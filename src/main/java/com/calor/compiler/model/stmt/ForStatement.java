package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.BodyForm;
import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §L{id:var:from:to:step}}; the upper bound is inclusive.
 */
@Value
public class ForStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    String variable;

    @NonNull
    Expression from;

    @NonNull
    Expression to;

    /** Null means a step of 1. */
    Expression step;

    @NonNull
    BodyForm form;

    @NonNull
    List<Statement> body;

    @Override
    public StatementKind kind() {
        return StatementKind.FOR;
    }
}
