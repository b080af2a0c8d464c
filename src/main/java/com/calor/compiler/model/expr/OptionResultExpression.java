package com.calor.compiler.model.expr;

import com.calor.compiler.model.Span;

import lombok.EqualsAndHashCode;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;

/**
 * {@code §SM v}, {@code §NN{type}}, {@code §OK v} or {@code §ERR v}. {@code value} is null
 * only for NONE; {@code typeName} is only carried by NONE.
 */
@Value
public class OptionResultExpression implements Expression {

    @EqualsAndHashCode.Exclude
    @ToString.Exclude
    Span span;

    @NonNull
    OptionResultVariant variant;

    Expression value;

    String typeName;

    @Override
    public ExpressionKind kind() {
        return ExpressionKind.OPTION_RESULT;
    }
}
