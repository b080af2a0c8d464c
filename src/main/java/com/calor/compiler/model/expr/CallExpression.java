package com.calor.compiler.model.expr;

import java.util.List;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §C{target} §A arg … §/C}. A target written with a trailing {@code !} is fallible.
 */
@Value
public class CallExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    String target;

    boolean fallible;

    @NonNull
    List<Expression> arguments;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.CALL;
    }
}
