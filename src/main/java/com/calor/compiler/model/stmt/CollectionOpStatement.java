package com.calor.compiler.model.stmt;

import java.util.List;

import com.calor.compiler.model.expr.Expression;
import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

@Value
public class CollectionOpStatement implements Statement {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    CollectionOp operation;

    @NonNull
    String collection;

    @NonNull
    List<Expression> arguments;

    @Override
    public StatementKind kind() {
        return StatementKind.COLLECTION_OP;
    }
}
