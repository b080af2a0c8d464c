package com.calor.compiler.model.stmt;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.ToString;
import lombok.Value;

@Value
public class RethrowStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @Override
    public StatementKind kind() {
        return StatementKind.RETHROW;
    }
}
