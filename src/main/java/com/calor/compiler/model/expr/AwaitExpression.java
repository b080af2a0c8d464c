package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §AWAIT expr}; {@code configureAwait} is null unless written as {@code §AWAIT{false}}.
 */
@Value
public class AwaitExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    Expression awaited;

    Boolean configureAwait;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.AWAIT;
    }
}
