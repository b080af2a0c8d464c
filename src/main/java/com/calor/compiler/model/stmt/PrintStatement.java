package com.calor.compiler.model.stmt;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class PrintStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression value;

    /** False for {@code §Pf}, which prints without a trailing newline. */
    boolean newline;

    @Override
    public StatementKind kind() {
        return StatementKind.PRINT;
    }
}
