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
public class IfStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    Expression condition;

    @NonNull
    BodyForm form;

    @NonNull
    List<Statement> thenBody;

    @NonNull
    List<ElseIfClause> elseIfs;

    /** Null when there is no {@code §EL} branch. */
    List<Statement> elseBody;

    /** Form of the else branch; null when there is none. */
    BodyForm elseForm;

    @Override
    public StatementKind kind() {
        return StatementKind.IF;
    }
}
