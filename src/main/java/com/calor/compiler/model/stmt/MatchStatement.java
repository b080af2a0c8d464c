package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.expr.MatchCase;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class MatchStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    Expression target;

    @NonNull
    List<MatchCase> cases;

    @Override
    public StatementKind kind() {
        return StatementKind.MATCH;
    }
}
