package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class TryStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String id;

    @NonNull
    List<Statement> tryBody;

    @NonNull
    List<CatchClause> catches;

    /** Null when there is no {@code §FI} block. */
    List<Statement> finallyBody;

    @Override
    public StatementKind kind() {
        return StatementKind.TRY;
    }
}
