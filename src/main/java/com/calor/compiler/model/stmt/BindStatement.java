package com.calor.compiler.model.stmt;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §B{~name:type} value}; a leading {@code ~} marks the binding mutable.
 */
@Value
public class BindStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String name;

    /** Null when the type is inferred from the value. */
    String type;

    boolean mutable;

    @NonNull
    Expression value;

    @Override
    public StatementKind kind() {
        return StatementKind.BIND;
    }
}
